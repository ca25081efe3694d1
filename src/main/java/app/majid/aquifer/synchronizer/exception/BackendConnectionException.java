package app.majid.aquifer.synchronizer.exception;

import app.majid.aquifer.synchronizer.model.ErrorKind;

/**
 * Thrown when a backend cannot be reached. Fatal for that backend only.
 */
public class BackendConnectionException extends SynchronizationException {

    private final String backendName;

    public BackendConnectionException(String backendName, Throwable cause) {
        super("Cannot connect to backend '" + backendName + "': " + cause.getMessage(), cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.CONNECTION;
    }
}
