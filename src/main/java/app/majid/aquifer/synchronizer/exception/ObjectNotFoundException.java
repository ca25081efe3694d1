package app.majid.aquifer.synchronizer.exception;

import app.majid.aquifer.synchronizer.model.ErrorKind;
import app.majid.aquifer.synchronizer.model.SchemaObjectRef;

/**
 * Thrown when an object, or the log history needed to roll it back, does not exist.
 */
public class ObjectNotFoundException extends SynchronizationException {

    private final SchemaObjectRef ref;

    public ObjectNotFoundException(SchemaObjectRef ref, String message) {
        super(message);
        this.ref = ref;
    }

    public SchemaObjectRef getRef() {
        return ref;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.NOT_FOUND;
    }
}
