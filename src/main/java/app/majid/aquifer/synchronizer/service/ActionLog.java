package app.majid.aquifer.synchronizer.service;

import app.majid.aquifer.synchronizer.db.SchemaBackend;
import app.majid.aquifer.synchronizer.exception.BackendConnectionException;
import app.majid.aquifer.synchronizer.exception.LogWriteException;
import app.majid.aquifer.synchronizer.exception.UnsupportedBackendOperationException;
import app.majid.aquifer.synchronizer.model.DiffResult;
import app.majid.aquifer.synchronizer.model.SchemaObjectRef;
import app.majid.aquifer.synchronizer.model.SyncAction;
import app.majid.aquifer.synchronizer.model.SyncLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

import static app.majid.aquifer.common.constants.SyncConstants.SYNC_DIRECTION_SOURCE_TO_TARGET;

/**
 * Append-only record of the changes applied to a target, stored inside that target.
 * Entries are never updated or deleted here.
 */
@Service
public class ActionLog {

    private static final Logger logger = LoggerFactory.getLogger(ActionLog.class);

    private final Clock clock;
    private final SourceCodeHashProvider sourceCodeHashProvider;

    public ActionLog(Clock clock, SourceCodeHashProvider sourceCodeHashProvider) {
        this.clock = clock;
        this.sourceCodeHashProvider = sourceCodeHashProvider;
    }

    /**
     * Builds the entry for a change before it is applied, so that nothing left to render can fail
     * once the target has been mutated. The timestamp is replaced on {@link #append}.
     */
    public SyncLogEntry draft(SchemaBackend backend, DiffResult diff) throws UnsupportedBackendOperationException {
        String originalState = diff.originalState() == null
                ? null
                : backend.renderDefinition(diff.originalState());
        String newState = backend.renderDefinition(diff.newState());

        String rollbackAction = diff.action() == SyncAction.SYNC
                ? originalState
                : String.join("\n", backend.render(diff.rollback()));

        SchemaObjectRef ref = diff.ref();
        return new SyncLogEntry(
                ref.kind(),
                ref.name(),
                diff.action(),
                sourceCodeHashProvider.getHash(),
                SYNC_DIRECTION_SOURCE_TO_TARGET,
                originalState,
                newState,
                rollbackAction,
                clock.instant());
    }

    /**
     * Appends an entry, stamped with the current time.
     *
     * @throws LogWriteException if the backend could not store the entry
     */
    public SyncLogEntry append(SchemaBackend backend, SyncLogEntry entry) throws LogWriteException {
        SyncLogEntry stamped = entry.withTimestamp(clock.instant());
        try {
            backend.appendLogEntry(stamped);
        } catch (RuntimeException e) {
            throw new LogWriteException(stamped.ref(), e);
        }
        logger.debug("Logged {} on '{}'", stamped, backend.name());
        return stamped;
    }

    /**
     * Returns the authoritative entry for rollback: the latest by timestamp, ties broken by
     * insertion order.
     */
    public Optional<SyncLogEntry> latest(SchemaBackend backend, SchemaObjectRef ref) throws BackendConnectionException {
        return backend.latestLogEntry(ref);
    }
}
