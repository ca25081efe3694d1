package app.majid.aquifer.synchronizer.service;

import app.majid.aquifer.synchronizer.model.RollbackResult;
import app.majid.aquifer.synchronizer.model.SchemaObjectRef;
import app.majid.aquifer.synchronizer.model.SyncOptions;
import app.majid.aquifer.synchronizer.model.TargetSyncResult;

import java.util.List;

/**
 * Entry point for synchronizing the configured targets from the configured source and for rolling
 * back logged changes.
 */
public interface SynchronizerService {

    /**
     * Synchronizes targets in parallel, one worker per target.
     *
     * @param options operation selectors for this run
     * @param targets names of the targets to synchronize, all configured targets when empty
     * @return one result per target, in configuration order
     * @throws IllegalArgumentException if a named target is not configured
     * @throws IllegalStateException    if no source is configured
     */
    List<TargetSyncResult> synchronize(SyncOptions options, List<String> targets);

    /**
     * Requests cancellation of every run in progress. Runs stop before their next object.
     *
     * @return number of runs that were asked to stop
     */
    int cancelRunning();

    /**
     * Rolls back the latest logged change of an object on each target.
     *
     * @param targets names of the targets, all configured targets when empty
     * @return one result per target, in configuration order
     * @throws IllegalArgumentException if a named target is not configured
     */
    List<RollbackResult> rollback(SchemaObjectRef ref, List<String> targets);
}
