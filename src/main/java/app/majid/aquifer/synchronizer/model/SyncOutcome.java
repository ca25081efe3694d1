package app.majid.aquifer.synchronizer.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Outcome of synchronizing a single object")
public enum SyncOutcome {
    @Schema(description = "Source and target already match")
    NO_OP,

    @Schema(description = "Object created on the target")
    CREATED,

    @Schema(description = "Missing column added to the target table")
    ALTERED,

    @Schema(description = "Object dropped and re-created from the source definition")
    SYNCED,

    @Schema(description = "Candidate statement rejected by the test transaction")
    VALIDATION_FAILED,

    @Schema(description = "Statement failed on apply after passing validation")
    EXECUTION_FAILED,

    @Schema(description = "Change applied but could not be logged; rollback is not possible")
    LOG_WRITE_FAILED,

    @Schema(description = "Operation not supported by the backend")
    UNSUPPORTED,

    @Schema(description = "Object could not be read from source or target")
    FAILED
}
