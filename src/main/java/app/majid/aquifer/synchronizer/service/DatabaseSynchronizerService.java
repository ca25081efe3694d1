package app.majid.aquifer.synchronizer.service;

import app.majid.aquifer.db.config.DbConfig;
import app.majid.aquifer.db.config.DbProperties;
import app.majid.aquifer.db.config.TargetConfig;
import app.majid.aquifer.db.service.SchemaBackendFactory;
import app.majid.aquifer.synchronizer.db.SchemaBackend;
import app.majid.aquifer.synchronizer.event.SyncEvent;
import app.majid.aquifer.synchronizer.event.SyncEventListener;
import app.majid.aquifer.synchronizer.exception.BackendConnectionException;
import app.majid.aquifer.synchronizer.model.CancellationToken;
import app.majid.aquifer.synchronizer.model.ObjectSyncResult;
import app.majid.aquifer.synchronizer.model.RollbackResult;
import app.majid.aquifer.synchronizer.model.SchemaObjectRef;
import app.majid.aquifer.synchronizer.model.SyncOptions;
import app.majid.aquifer.synchronizer.model.SyncOutcome;
import app.majid.aquifer.synchronizer.model.TargetSyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static app.majid.aquifer.common.constants.SyncConstants.SOURCE_NAME;

/**
 * Synchronizes every configured target from the configured source.
 * <p>
 * Targets share no state: each worker opens its own source and target connections, so targets run
 * in parallel on a bounded pool while objects of one target stay serial.
 */
@Service
public class DatabaseSynchronizerService implements SynchronizerService {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseSynchronizerService.class);

    private final DbProperties dbProperties;
    private final SchemaBackendFactory backendFactory;
    private final SyncOrchestrator orchestrator;
    private final RollbackResolver rollbackResolver;
    private final SyncEventListener events;

    private final Set<CancellationToken> activeRuns = ConcurrentHashMap.newKeySet();

    public DatabaseSynchronizerService(DbProperties dbProperties,
                                       SchemaBackendFactory backendFactory,
                                       SyncOrchestrator orchestrator,
                                       RollbackResolver rollbackResolver,
                                       SyncEventListener events) {
        this.dbProperties = dbProperties;
        this.backendFactory = backendFactory;
        this.orchestrator = orchestrator;
        this.rollbackResolver = rollbackResolver;
        this.events = events;
    }

    @Override
    public List<TargetSyncResult> synchronize(SyncOptions options, List<String> targets) {
        DbConfig source = requireSource();
        List<TargetConfig> selected = selectTargets(targets);
        if (selected.isEmpty()) {
            logger.debug("No targets configured for sync");
            return List.of();
        }

        logger.info("Syncing {} target(s) with {}", selected.size(), options);
        if (!options.anyPassSelected()) {
            logger.warn("No object kind selected, targets will only be connected to");
        }

        CancellationToken token = new CancellationToken();
        activeRuns.add(token);
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(dbProperties.parallelism(), selected.size()));
        try {
            List<CompletableFuture<TargetSyncResult>> futures = selected.stream()
                    .map(target -> CompletableFuture.supplyAsync(() ->
                            synchronizeTarget(source, target, options, token), executor))
                    .toList();

            List<TargetSyncResult> results = futures.stream()
                    .map(CompletableFuture::join)
                    .toList();

            logSyncSummary(results);
            return results;
        } finally {
            executor.shutdown();
            activeRuns.remove(token);
        }
    }

    @Override
    public int cancelRunning() {
        int cancelled = 0;
        for (CancellationToken token : activeRuns) {
            token.cancel();
            cancelled++;
        }
        logger.info("Requested cancellation of {} running sync(s)", cancelled);
        return cancelled;
    }

    @Override
    public List<RollbackResult> rollback(SchemaObjectRef ref, List<String> targets) {
        List<TargetConfig> selected = selectTargets(targets);
        logger.info("Rolling back {} on {} target(s)", ref, selected.size());

        return selected.stream()
                .map(target -> rollbackTarget(target, ref))
                .toList();
    }

    private TargetSyncResult synchronizeTarget(DbConfig source, TargetConfig target, SyncOptions options,
                                               CancellationToken token) {
        TargetSyncResult result = null;
        try (SchemaBackend sourceBackend = backendFactory.openSource(SOURCE_NAME, source);
             SchemaBackend targetBackend = backendFactory.open(target.name(), target.config())) {
            result = orchestrator.synchronize(sourceBackend, targetBackend, options, token);
        } catch (BackendConnectionException e) {
            events.onEvent(SyncEvent.error(target.name(), null, e.getErrorKind(), e.getMessage()));
            return new TargetSyncResult(target.name(), TargetSyncResult.Status.FAILED, List.of(), e.getMessage());
        } catch (RuntimeException e) {
            if (result != null) {
                // Only closing failed, the outcomes gathered before stand
                logger.warn("Failed to close connections of '{}' after sync", target.name(), e);
                return result;
            }
            logger.error("Unexpected failure while syncing '{}'", target.name(), e);
            return new TargetSyncResult(target.name(), TargetSyncResult.Status.FAILED, List.of(), e.getMessage());
        }
        return result;
    }

    private RollbackResult rollbackTarget(TargetConfig target, SchemaObjectRef ref) {
        RollbackResult result = null;
        try (SchemaBackend backend = backendFactory.open(target.name(), target.config())) {
            result = rollbackResolver.rollback(backend, ref);
        } catch (BackendConnectionException e) {
            events.onEvent(SyncEvent.error(target.name(), ref, e.getErrorKind(), e.getMessage()));
            return RollbackResult.of(target.name(), ref, RollbackResult.Status.FAILED, e.getErrorKind(), e.getMessage());
        } catch (RuntimeException e) {
            if (result != null) {
                logger.warn("Failed to close connection of '{}' after rollback", target.name(), e);
                return result;
            }
            logger.error("Unexpected failure while rolling back {} on '{}'", ref, target.name(), e);
            events.onEvent(SyncEvent.error(target.name(), ref, null, e.getMessage()));
            return RollbackResult.of(target.name(), ref, RollbackResult.Status.FAILED, null, e.getMessage());
        }
        return result;
    }

    private DbConfig requireSource() {
        if (dbProperties.source() == null) {
            throw new IllegalStateException("No source database configured (aquifer.source)");
        }
        return dbProperties.source();
    }

    private List<TargetConfig> selectTargets(List<String> names) {
        if (names == null || names.isEmpty()) {
            return dbProperties.targets();
        }
        return names.stream()
                .map(name -> dbProperties.findTarget(name)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown target: " + name)))
                .distinct()
                .toList();
    }

    /**
     * Logs a summary of synchronization results.
     */
    private void logSyncSummary(List<TargetSyncResult> results) {
        long completed = results.stream().filter(r -> r.status() == TargetSyncResult.Status.COMPLETED).count();
        long cancelled = results.stream().filter(r -> r.status() == TargetSyncResult.Status.CANCELLED).count();
        long failed = results.stream().filter(r -> r.status() == TargetSyncResult.Status.FAILED).count();
        long applied = results.stream()
                .flatMap(r -> r.objects().stream())
                .filter(ObjectSyncResult::isSuccess)
                .count();
        long objectFailures = results.stream()
                .flatMap(r -> r.objects().stream())
                .filter(o -> !o.isSuccess() && o.outcome() != SyncOutcome.NO_OP)
                .count();

        logger.info("Sync summary - Targets: {}, Completed: {}, Cancelled: {}, Failed: {}, Changes applied: {}, Object failures: {}",
                results.size(), completed, cancelled, failed, applied, objectFailures);
    }
}
