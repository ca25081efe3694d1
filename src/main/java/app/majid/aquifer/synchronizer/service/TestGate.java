package app.majid.aquifer.synchronizer.service;

import app.majid.aquifer.synchronizer.db.SchemaBackend;
import app.majid.aquifer.synchronizer.exception.BackendConnectionException;
import app.majid.aquifer.synchronizer.exception.StatementExecutionException;
import app.majid.aquifer.synchronizer.exception.UnsupportedBackendOperationException;
import app.majid.aquifer.synchronizer.exception.ValidationException;
import app.majid.aquifer.synchronizer.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Dry-runs candidate statements against a target inside a transaction that is always rolled back.
 * <p>
 * The gate is best effort. A statement accepted here is applied moments later outside the test
 * transaction, and a concurrent schema change on the target in between can still make the apply
 * fail. No lock is taken to close that window. Engines whose DDL commits implicitly (MySQL,
 * Oracle, H2) refuse the test transaction, so their changes come back as unsupported and are
 * never applied.
 */
@Component
public class TestGate {

    private static final Logger logger = LoggerFactory.getLogger(TestGate.class);

    /**
     * Executes the statements in order inside one test transaction and rolls it back,
     * whatever the outcome. Stops at the first failing statement.
     */
    public ValidationResult validate(SchemaBackend backend, List<String> statements)
            throws UnsupportedBackendOperationException, BackendConnectionException {
        backend.beginTestTransaction();
        try {
            for (String statement : statements) {
                try {
                    backend.execute(statement);
                } catch (StatementExecutionException e) {
                    logger.debug("Test transaction on '{}' rejected statement: {}", backend.name(), statement);
                    return ValidationResult.rejected(statement, e.getCause() != null
                            ? e.getCause().getMessage()
                            : e.getMessage());
                }
            }
            return ValidationResult.accepted();
        } finally {
            backend.rollbackTestTransaction();
        }
    }

    /**
     * Same as {@link #validate(SchemaBackend, List)} but throws when the statements are rejected.
     */
    public void requireValid(SchemaBackend backend, List<String> statements)
            throws ValidationException, UnsupportedBackendOperationException, BackendConnectionException {
        ValidationResult result = validate(backend, statements);
        if (!result.valid()) {
            throw new ValidationException(result.rejectedStatement(), result.error());
        }
    }
}
