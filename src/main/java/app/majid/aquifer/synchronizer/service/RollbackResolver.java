package app.majid.aquifer.synchronizer.service;

import app.majid.aquifer.synchronizer.db.SchemaBackend;
import app.majid.aquifer.synchronizer.event.SyncEvent;
import app.majid.aquifer.synchronizer.event.SyncEventListener;
import app.majid.aquifer.synchronizer.exception.BackendConnectionException;
import app.majid.aquifer.synchronizer.exception.ObjectNotFoundException;
import app.majid.aquifer.synchronizer.exception.StatementExecutionException;
import app.majid.aquifer.synchronizer.exception.UnsupportedBackendOperationException;
import app.majid.aquifer.synchronizer.exception.ValidationException;
import app.majid.aquifer.synchronizer.model.ObjectKind;
import app.majid.aquifer.synchronizer.model.RollbackResult;
import app.majid.aquifer.synchronizer.model.SchemaChange;
import app.majid.aquifer.synchronizer.model.SchemaObjectRef;
import app.majid.aquifer.synchronizer.model.SyncLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reverses the most recent logged change of an object on one target.
 * <p>
 * The log entry used is never modified or deleted, so rolling back twice re-applies the same
 * inverse. That is harmless for definition replacement but not for a column drop.
 */
@Service
public class RollbackResolver {

    private static final Logger logger = LoggerFactory.getLogger(RollbackResolver.class);

    private final ActionLog actionLog;
    private final TestGate testGate;
    private final SyncEventListener events;

    public RollbackResolver(ActionLog actionLog, TestGate testGate, SyncEventListener events) {
        this.actionLog = actionLog;
        this.testGate = testGate;
        this.events = events;
    }

    public RollbackResult rollback(SchemaBackend target, SchemaObjectRef ref) {
        String targetName = target.name();
        try {
            SyncLogEntry entry = actionLog.latest(target, ref)
                    .orElseThrow(() -> new ObjectNotFoundException(ref, "No sync log history for " + ref));
            logger.debug("Rolling back {} on '{}' using {}", ref, targetName, entry);

            List<String> statements = inverseOf(target, entry);
            execute(target, statements);

            String message = "Rolled back %s (%d statements)".formatted(entry.action().label(), statements.size());
            events.onEvent(SyncEvent.info(targetName, ref, message));
            return RollbackResult.of(targetName, ref, RollbackResult.Status.ROLLED_BACK, null, message);
        } catch (ObjectNotFoundException e) {
            events.onEvent(SyncEvent.warn(targetName, ref, e.getErrorKind(), e.getMessage()));
            return RollbackResult.of(targetName, ref, RollbackResult.Status.NOT_FOUND, e.getErrorKind(), e.getMessage());
        } catch (ValidationException e) {
            events.onEvent(SyncEvent.error(targetName, ref, e.getErrorKind(), e.getMessage() + ": " + e.getStatement()));
            return RollbackResult.of(targetName, ref, RollbackResult.Status.VALIDATION_FAILED, e.getErrorKind(), e.getMessage());
        } catch (StatementExecutionException e) {
            events.onEvent(SyncEvent.severe(targetName, ref, e.getErrorKind(),
                    "Rollback failed, target may be inconsistent: " + e.getMessage()));
            return RollbackResult.of(targetName, ref, RollbackResult.Status.EXECUTION_FAILED, e.getErrorKind(), e.getMessage());
        } catch (UnsupportedBackendOperationException e) {
            events.onEvent(SyncEvent.warn(targetName, ref, e.getErrorKind(), e.getMessage()));
            return RollbackResult.of(targetName, ref, RollbackResult.Status.UNSUPPORTED, e.getErrorKind(), e.getMessage());
        } catch (BackendConnectionException e) {
            events.onEvent(SyncEvent.error(targetName, ref, e.getErrorKind(), e.getMessage()));
            return RollbackResult.of(targetName, ref, RollbackResult.Status.FAILED, e.getErrorKind(), e.getMessage());
        } catch (DataAccessException e) {
            logger.debug("Rollback of {} on '{}' failed", ref, targetName, e);
            events.onEvent(SyncEvent.error(targetName, ref, null, e.getMessage()));
            return RollbackResult.of(targetName, ref, RollbackResult.Status.FAILED, null, e.getMessage());
        }
    }

    /**
     * Computes the statements that reverse an entry. Creations are dropped directly; alterations and
     * definition syncs pass through the test gate first.
     */
    private List<String> inverseOf(SchemaBackend target, SyncLogEntry entry)
            throws ObjectNotFoundException, ValidationException, UnsupportedBackendOperationException, BackendConnectionException {
        SchemaObjectRef ref = entry.ref();
        return switch (entry.action()) {
            case CREATE -> ref.kind() == ObjectKind.INDEX
                    ? List.of(entry.rollbackAction())
                    : target.render(new SchemaChange.DropObject(ref));
            case ALTER -> gated(target, List.of(entry.rollbackAction()));
            case SYNC -> {
                if (entry.originalState() == null) {
                    throw new ObjectNotFoundException(ref, "Sync log entry for " + ref + " has no original state");
                }
                yield gated(target, target.render(new SchemaChange.ReplaceFromDefinition(ref, entry.originalState())));
            }
        };
    }

    private List<String> gated(SchemaBackend target, List<String> statements)
            throws ValidationException, UnsupportedBackendOperationException, BackendConnectionException {
        testGate.requireValid(target, statements);
        return statements;
    }

    private static void execute(SchemaBackend target, List<String> statements)
            throws StatementExecutionException, UnsupportedBackendOperationException {
        for (String statement : statements) {
            target.execute(statement);
        }
    }
}
