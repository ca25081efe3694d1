package app.majid.aquifer.synchronizer.model;

/**
 * Operation selectors for one synchronization run.
 *
 * @param alterSync      add source columns missing from existing target tables
 * @param createOnTarget create objects missing from the target
 */
public record SyncOptions(
        boolean syncTables,
        boolean syncViews,
        boolean syncProcedures,
        boolean alterSync,
        boolean createOnTarget,
        boolean syncIndexes
) {

    public boolean anyPassSelected() {
        return syncTables || syncViews || syncProcedures;
    }
}
