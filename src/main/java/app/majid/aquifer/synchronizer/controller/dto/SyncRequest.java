package app.majid.aquifer.synchronizer.controller.dto;

import app.majid.aquifer.synchronizer.model.SyncOptions;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Request to synchronize targets from the source database")
public record SyncRequest(
        @Schema(description = "Synchronize tables", example = "true", defaultValue = "false")
        boolean syncTables,

        @Schema(description = "Synchronize views", example = "true", defaultValue = "false")
        boolean syncViews,

        @Schema(description = "Synchronize stored procedures", example = "false", defaultValue = "false")
        boolean syncProcedures,

        @Schema(description = "Add source columns missing from existing target tables", example = "true", defaultValue = "false")
        boolean alterSync,

        @Schema(description = "Create objects missing from the target. Procedures are re-created even when they exist",
                example = "false", defaultValue = "false")
        boolean createOnTarget,

        @Schema(description = "Create source indexes missing from target tables during the table pass",
                example = "false", defaultValue = "false")
        boolean syncIndexes,

        @Schema(description = "Target names to synchronize, all configured targets when omitted",
                example = "[\"reporting\"]")
        List<String> targets
) {

    public SyncOptions toOptions() {
        return new SyncOptions(syncTables, syncViews, syncProcedures, alterSync, createOnTarget, syncIndexes);
    }
}
