package app.majid.aquifer.synchronizer.exception;

import app.majid.aquifer.synchronizer.db.BackendVariant;
import app.majid.aquifer.synchronizer.model.ErrorKind;

/**
 * Thrown by backends for operations that have no meaning for their variant,
 * e.g. stored procedures on a document store.
 */
public class UnsupportedBackendOperationException extends SynchronizationException {

    private final BackendVariant variant;
    private final String operation;

    public UnsupportedBackendOperationException(BackendVariant variant, String operation) {
        super("Operation '" + operation + "' is not supported by " + variant + " backends");
        this.variant = variant;
        this.operation = operation;
    }

    public BackendVariant getVariant() {
        return variant;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.UNSUPPORTED;
    }
}
