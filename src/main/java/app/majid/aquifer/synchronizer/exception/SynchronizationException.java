package app.majid.aquifer.synchronizer.exception;

import app.majid.aquifer.synchronizer.model.ErrorKind;

/**
 * Base exception for all synchronization-related errors.
 * Every subclass maps to exactly one {@link ErrorKind} so results can report it without inspecting types.
 */
public abstract class SynchronizationException extends Exception {

    protected SynchronizationException(String message) {
        super(message);
    }

    protected SynchronizationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getErrorKind();
}
