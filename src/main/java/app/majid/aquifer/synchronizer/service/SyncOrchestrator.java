package app.majid.aquifer.synchronizer.service;

import app.majid.aquifer.synchronizer.db.SchemaBackend;
import app.majid.aquifer.synchronizer.event.SyncEvent;
import app.majid.aquifer.synchronizer.event.SyncEventListener;
import app.majid.aquifer.synchronizer.exception.BackendConnectionException;
import app.majid.aquifer.synchronizer.exception.LogWriteException;
import app.majid.aquifer.synchronizer.exception.ObjectNotFoundException;
import app.majid.aquifer.synchronizer.exception.StatementExecutionException;
import app.majid.aquifer.synchronizer.exception.UnsupportedBackendOperationException;
import app.majid.aquifer.synchronizer.exception.ValidationException;
import app.majid.aquifer.synchronizer.model.CancellationToken;
import app.majid.aquifer.synchronizer.model.DiffResult;
import app.majid.aquifer.synchronizer.model.ErrorKind;
import app.majid.aquifer.synchronizer.model.IndexDefinition;
import app.majid.aquifer.synchronizer.model.ObjectDefinition;
import app.majid.aquifer.synchronizer.model.ObjectDiff;
import app.majid.aquifer.synchronizer.model.ObjectKind;
import app.majid.aquifer.synchronizer.model.ObjectSyncResult;
import app.majid.aquifer.synchronizer.model.SchemaObjectRef;
import app.majid.aquifer.synchronizer.model.ScriptDefinition;
import app.majid.aquifer.synchronizer.model.SyncLogEntry;
import app.majid.aquifer.synchronizer.model.SyncOptions;
import app.majid.aquifer.synchronizer.model.SyncOutcome;
import app.majid.aquifer.synchronizer.model.TableDefinition;
import app.majid.aquifer.synchronizer.model.TargetSyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives the synchronization of one target from one source.
 * <p>
 * Passes run in order (tables, views, procedures) and objects within a pass run serially on the
 * target's single connection. Every object goes through discover, diff and, unless the diff is a
 * no-op, validate, apply and log. Failures are scoped to the object, or to the pass when the source
 * cannot list a kind. A lost connection ends the run for this target, and the outcomes gathered
 * until then are always returned.
 */
@Service
public class SyncOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final DiffEngine diffEngine;
    private final TestGate testGate;
    private final ActionLog actionLog;
    private final SynchronizerIgnoreService ignoreService;
    private final SyncEventListener events;

    public SyncOrchestrator(DiffEngine diffEngine,
                            TestGate testGate,
                            ActionLog actionLog,
                            SynchronizerIgnoreService ignoreService,
                            SyncEventListener events) {
        this.diffEngine = diffEngine;
        this.testGate = testGate;
        this.actionLog = actionLog;
        this.ignoreService = ignoreService;
        this.events = events;
    }

    /**
     * Synchronizes every selected object kind from source to target.
     *
     * @param token checked before each object; an apply already started always completes and is logged
     */
    public TargetSyncResult synchronize(SchemaBackend source, SchemaBackend target,
                                        SyncOptions options, CancellationToken token) {
        String targetName = target.name();
        List<ObjectSyncResult> results = new ArrayList<>();
        logger.info("Synchronizing '{}' from '{}' with {}", targetName, source.name(), options);

        try {
            List<ObjectKind> passes = new ArrayList<>();
            if (options.syncTables()) {
                passes.add(ObjectKind.TABLE);
            }
            if (options.syncViews()) {
                passes.add(ObjectKind.VIEW);
            }
            if (options.syncProcedures()) {
                passes.add(ObjectKind.PROCEDURE);
            }

            for (ObjectKind kind : passes) {
                if (!runPass(kind, source, target, options, token, results)) {
                    String message = "Cancelled after %d objects".formatted(results.size());
                    events.onEvent(SyncEvent.info(targetName, null, message));
                    return new TargetSyncResult(targetName, TargetSyncResult.Status.CANCELLED, results, message);
                }
            }
        } catch (BackendConnectionException e) {
            events.onEvent(SyncEvent.error(targetName, null, e.getErrorKind(), e.getMessage()));
            return new TargetSyncResult(targetName, TargetSyncResult.Status.FAILED, results, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected failure while synchronizing '{}' after {} objects", targetName, results.size(), e);
            events.onEvent(SyncEvent.error(targetName, null, null, e.getMessage()));
            return new TargetSyncResult(targetName, TargetSyncResult.Status.FAILED, results, e.getMessage());
        }

        logger.info("Finished '{}': {} objects, {} applied, {} failed", targetName, results.size(),
                results.stream().filter(ObjectSyncResult::isSuccess).count(),
                results.stream().filter(r -> !r.isSuccess() && r.outcome() != SyncOutcome.NO_OP).count());
        return new TargetSyncResult(targetName, TargetSyncResult.Status.COMPLETED, results, null);
    }

    /**
     * @return {@code false} if the pass stopped because of cancellation
     */
    private boolean runPass(ObjectKind kind, SchemaBackend source, SchemaBackend target, SyncOptions options,
                            CancellationToken token, List<ObjectSyncResult> results)
            throws BackendConnectionException {
        SchemaObjectRef pass = new SchemaObjectRef(kind, "*");
        List<String> names;
        try {
            names = source.listObjects(kind);
        } catch (UnsupportedBackendOperationException e) {
            events.onEvent(SyncEvent.warn(source.name(), pass, e.getErrorKind(), e.getMessage()));
            results.add(ObjectSyncResult.failed(pass, null, SyncOutcome.UNSUPPORTED, e.getErrorKind(), e.getMessage()));
            return true;
        } catch (DataAccessException e) {
            logger.debug("Listing {} objects on '{}' failed", kind.label(), source.name(), e);
            events.onEvent(SyncEvent.error(source.name(), pass, null, "Cannot list %s objects: %s"
                    .formatted(kind.label(), e.getMessage())));
            results.add(ObjectSyncResult.failed(pass, null, SyncOutcome.FAILED, null, e.getMessage()));
            return true;
        }

        logger.debug("Pass {} on '{}': {} source objects", kind.label(), target.name(), names.size());
        for (String name : names) {
            if (token.isCancelled()) {
                return false;
            }

            SchemaObjectRef ref = new SchemaObjectRef(kind, name);
            if (!ignoreService.shouldProcess(ref)) {
                logger.debug("Ignoring {}", ref);
                continue;
            }
            try {
                results.addAll(synchronizeObject(ref, source, target, options));
            } catch (DataAccessException e) {
                logger.debug("Synchronizing {} on '{}' failed", ref, target.name(), e);
                events.onEvent(SyncEvent.error(target.name(), ref, null, e.getMessage()));
                results.add(ObjectSyncResult.failed(ref, null, SyncOutcome.FAILED, null, e.getMessage()));
            }
        }
        return true;
    }

    private List<ObjectSyncResult> synchronizeObject(SchemaObjectRef ref, SchemaBackend source, SchemaBackend target,
                                                     SyncOptions options) throws BackendConnectionException {
        String targetName = target.name();
        ObjectDiff diff;
        try {
            diff = diff(ref, source, target, options);
        } catch (UnsupportedBackendOperationException e) {
            events.onEvent(SyncEvent.warn(targetName, ref, e.getErrorKind(), e.getMessage()));
            return List.of(ObjectSyncResult.failed(ref, null, SyncOutcome.UNSUPPORTED, e.getErrorKind(), e.getMessage()));
        } catch (ObjectNotFoundException e) {
            events.onEvent(SyncEvent.error(targetName, ref, e.getErrorKind(), e.getMessage()));
            return List.of(ObjectSyncResult.failed(ref, null, SyncOutcome.FAILED, e.getErrorKind(), e.getMessage()));
        } catch (DataAccessException e) {
            logger.debug("Introspection of {} failed", ref, e);
            events.onEvent(SyncEvent.error(targetName, ref, null, e.getMessage()));
            return List.of(ObjectSyncResult.failed(ref, null, SyncOutcome.FAILED, null, e.getMessage()));
        }

        diff.notices().forEach(notice -> events.onEvent(SyncEvent.info(targetName, ref, notice)));

        List<ObjectSyncResult> results = new ArrayList<>();
        if (diff.isNoOp()) {
            results.add(ObjectSyncResult.noOp(ref, diff.notices().isEmpty() ? null : String.join("; ", diff.notices())));
        } else {
            // Each ALTER of a table assumes the previous one was applied
            for (DiffResult change : diff.changes()) {
                ObjectSyncResult result = apply(target, change);
                results.add(result);
                if (!result.isSuccess()) {
                    break;
                }
            }
        }

        if (ref.kind() == ObjectKind.TABLE && options.syncIndexes()) {
            results.addAll(synchronizeIndexes(ref, source, target));
        }
        return results;
    }

    private ObjectDiff diff(SchemaObjectRef ref, SchemaBackend source, SchemaBackend target, SyncOptions options)
            throws ObjectNotFoundException, UnsupportedBackendOperationException, BackendConnectionException {
        ObjectDefinition sourceDefinition = source.getDefinition(ref);
        ObjectDefinition targetDefinition = target.objectExists(ref) ? target.getDefinition(ref) : null;

        return switch (ref.kind()) {
            case TABLE -> diffEngine.diffTable(
                    (TableDefinition) sourceDefinition, (TableDefinition) targetDefinition, options);
            case VIEW -> diffEngine.diffView(
                    (ScriptDefinition) sourceDefinition, (ScriptDefinition) targetDefinition, options);
            case PROCEDURE -> diffEngine.diffProcedure(
                    (ScriptDefinition) sourceDefinition, (ScriptDefinition) targetDefinition, options);
            case INDEX -> throw new IllegalArgumentException("Indexes are synchronized with their table: " + ref);
        };
    }

    /**
     * Creates source indexes missing from the target table. Only runs when the table exists on the
     * target once the table itself has been processed.
     */
    private List<ObjectSyncResult> synchronizeIndexes(SchemaObjectRef table, SchemaBackend source,
                                                      SchemaBackend target) throws BackendConnectionException {
        ObjectDiff diff;
        try {
            if (!target.objectExists(table)) {
                return List.of();
            }
            List<IndexDefinition> sourceIndexes = source.listIndexes(table.name());
            List<IndexDefinition> targetIndexes = target.listIndexes(table.name());
            diff = diffEngine.diffIndexes(table.name(), sourceIndexes, targetIndexes);
        } catch (UnsupportedBackendOperationException e) {
            events.onEvent(SyncEvent.warn(target.name(), table, e.getErrorKind(), e.getMessage()));
            return List.of(ObjectSyncResult.failed(table, null, SyncOutcome.UNSUPPORTED, e.getErrorKind(), e.getMessage()));
        } catch (DataAccessException e) {
            events.onEvent(SyncEvent.error(target.name(), table, null, "Index introspection failed: " + e.getMessage()));
            return List.of(ObjectSyncResult.failed(table, null, SyncOutcome.FAILED, null, e.getMessage()));
        }

        List<ObjectSyncResult> results = new ArrayList<>();
        for (DiffResult change : diff.changes()) {
            results.add(apply(target, change));
        }
        return results;
    }

    /**
     * Validates, applies and logs one change.
     */
    private ObjectSyncResult apply(SchemaBackend target, DiffResult change) throws BackendConnectionException {
        SchemaObjectRef ref = change.ref();
        String targetName = target.name();

        List<String> statements;
        SyncLogEntry draft;
        try {
            statements = target.render(change.change());
            draft = actionLog.draft(target, change);
            testGate.requireValid(target, statements);
        } catch (UnsupportedBackendOperationException e) {
            events.onEvent(SyncEvent.warn(targetName, ref, e.getErrorKind(), e.getMessage()));
            return ObjectSyncResult.failed(ref, change.action(), SyncOutcome.UNSUPPORTED, e.getErrorKind(), e.getMessage());
        } catch (ValidationException e) {
            String message = "Skipped %s, %s: %s".formatted(change.action().label(), e.getMessage(), e.getStatement());
            events.onEvent(SyncEvent.error(targetName, ref, e.getErrorKind(), message));
            return ObjectSyncResult.failed(ref, change.action(), SyncOutcome.VALIDATION_FAILED, e.getErrorKind(), e.getMessage());
        }

        for (String statement : statements) {
            try {
                target.execute(statement);
            } catch (StatementExecutionException | UnsupportedBackendOperationException e) {
                String message = "%s failed after validation, target may be inconsistent: %s"
                        .formatted(change.action().label(), e.getMessage());
                events.onEvent(SyncEvent.severe(targetName, ref, ErrorKind.EXECUTION, message));
                return ObjectSyncResult.failed(ref, change.action(), SyncOutcome.EXECUTION_FAILED, ErrorKind.EXECUTION, e.getMessage());
            }
        }

        try {
            actionLog.append(target, draft);
        } catch (LogWriteException e) {
            String message = "%s applied but not logged, it cannot be rolled back: %s"
                    .formatted(change.action().label(), e.getMessage());
            events.onEvent(SyncEvent.critical(targetName, ref, e.getErrorKind(), message));
            return ObjectSyncResult.failed(ref, change.action(), SyncOutcome.LOG_WRITE_FAILED, e.getErrorKind(), e.getMessage());
        }

        String message = "%s applied (%d statements)".formatted(change.action().label(), statements.size());
        events.onEvent(SyncEvent.info(targetName, ref, message));
        return ObjectSyncResult.applied(ref, change.action(), message);
    }
}
