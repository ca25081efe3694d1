package app.majid.aquifer.synchronizer.exception;

import app.majid.aquifer.synchronizer.model.ErrorKind;

/**
 * Thrown when a statement fails on a backend. When raised during apply, after validation succeeded,
 * the target may be left matching neither its previous nor its intended shape.
 */
public class StatementExecutionException extends SynchronizationException {

    private final String statement;

    public StatementExecutionException(String statement, Throwable cause) {
        super("Failed to execute statement: " + cause.getMessage(), cause);
        this.statement = statement;
    }

    public String getStatement() {
        return statement;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.EXECUTION;
    }
}
