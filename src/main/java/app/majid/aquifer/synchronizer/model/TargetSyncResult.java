package app.majid.aquifer.synchronizer.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Result of synchronizing one target database")
public record TargetSyncResult(
        @Schema(description = "Name of the target", example = "reporting")
        String target,

        @Schema(description = "Synchronization status", example = "COMPLETED")
        Status status,

        @Schema(description = "Per-object outcomes, in processing order")
        List<ObjectSyncResult> objects,

        @Schema(description = "Details or error message")
        String message
) {

    public TargetSyncResult {
        objects = objects == null ? List.of() : List.copyOf(objects);
    }

    public long count(SyncOutcome outcome) {
        return objects.stream().filter(o -> o.outcome() == outcome).count();
    }

    @Schema(description = "Target synchronization status values")
    public enum Status {
        @Schema(description = "All selected passes ran; individual objects may still have failed")
        COMPLETED,

        @Schema(description = "Run was cancelled between objects")
        CANCELLED,

        @Schema(description = "Target could not be reached; no objects were processed after the failure")
        FAILED
    }
}
