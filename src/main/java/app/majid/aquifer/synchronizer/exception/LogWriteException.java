package app.majid.aquifer.synchronizer.exception;

import app.majid.aquifer.synchronizer.model.ErrorKind;
import app.majid.aquifer.synchronizer.model.SchemaObjectRef;

/**
 * Thrown when a change was applied but its sync log entry could not be written.
 * The change can no longer be rolled back through the log.
 */
public class LogWriteException extends SynchronizationException {

    private final SchemaObjectRef ref;

    public LogWriteException(SchemaObjectRef ref, Throwable cause) {
        super("Failed to write sync log entry for " + ref + ": " + cause.getMessage(), cause);
        this.ref = ref;
    }

    public SchemaObjectRef getRef() {
        return ref;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.LOG_WRITE;
    }
}
