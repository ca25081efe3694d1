package app.majid.aquifer.synchronizer.model;

public enum ErrorKind {
    CONNECTION,
    VALIDATION,
    EXECUTION,
    LOG_WRITE,
    NOT_FOUND,
    UNSUPPORTED
}
