package app.majid.aquifer.synchronizer.exception;

import app.majid.aquifer.synchronizer.model.ErrorKind;

/**
 * Thrown when the test transaction rejects a candidate statement. Nothing was changed on the target.
 */
public class ValidationException extends SynchronizationException {

    private final String statement;

    public ValidationException(String statement, String reason) {
        super("Statement rejected by test transaction: " + reason);
        this.statement = statement;
    }

    public String getStatement() {
        return statement;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.VALIDATION;
    }
}
