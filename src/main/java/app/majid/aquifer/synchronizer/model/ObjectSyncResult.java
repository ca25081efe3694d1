package app.majid.aquifer.synchronizer.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Result of synchronizing one object on one target")
public record ObjectSyncResult(
        @Schema(description = "Object kind", example = "TABLE")
        ObjectKind kind,

        @Schema(description = "Object name", example = "orders")
        String name,

        @Schema(description = "Outcome", example = "CREATED")
        SyncOutcome outcome,

        @Schema(description = "Action attempted, if any", example = "CREATE")
        SyncAction action,

        @Schema(description = "Error kind when the object failed", example = "VALIDATION")
        ErrorKind errorKind,

        @Schema(description = "Details or error message")
        String message
) {

    public static ObjectSyncResult noOp(SchemaObjectRef ref, String message) {
        return new ObjectSyncResult(ref.kind(), ref.name(), SyncOutcome.NO_OP, null, null, message);
    }

    public static ObjectSyncResult applied(SchemaObjectRef ref, SyncAction action, String message) {
        SyncOutcome outcome = switch (action) {
            case CREATE -> SyncOutcome.CREATED;
            case ALTER -> SyncOutcome.ALTERED;
            case SYNC -> SyncOutcome.SYNCED;
        };
        return new ObjectSyncResult(ref.kind(), ref.name(), outcome, action, null, message);
    }

    public static ObjectSyncResult failed(SchemaObjectRef ref, SyncAction action, SyncOutcome outcome,
                                          ErrorKind errorKind, String message) {
        return new ObjectSyncResult(ref.kind(), ref.name(), outcome, action, errorKind, message);
    }

    public boolean isSuccess() {
        return outcome == SyncOutcome.CREATED || outcome == SyncOutcome.ALTERED || outcome == SyncOutcome.SYNCED;
    }

    public SchemaObjectRef ref() {
        return new SchemaObjectRef(kind, name);
    }
}
