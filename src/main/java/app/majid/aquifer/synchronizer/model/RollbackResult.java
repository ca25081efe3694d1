package app.majid.aquifer.synchronizer.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Result of rolling back one object on one target")
public record RollbackResult(
        @Schema(description = "Name of the target", example = "reporting")
        String target,

        @Schema(description = "Object kind", example = "VIEW")
        ObjectKind kind,

        @Schema(description = "Object name", example = "v_active")
        String name,

        @Schema(description = "Rollback status", example = "ROLLED_BACK")
        Status status,

        @Schema(description = "Error kind when the rollback did not happen")
        ErrorKind errorKind,

        @Schema(description = "Details or error message")
        String message
) {

    public static RollbackResult of(String target, SchemaObjectRef ref, Status status,
                                    ErrorKind errorKind, String message) {
        return new RollbackResult(target, ref.kind(), ref.name(), status, errorKind, message);
    }

    @Schema(description = "Rollback status values")
    public enum Status {
        ROLLED_BACK,
        NOT_FOUND,
        VALIDATION_FAILED,
        EXECUTION_FAILED,
        UNSUPPORTED,
        FAILED
    }
}
