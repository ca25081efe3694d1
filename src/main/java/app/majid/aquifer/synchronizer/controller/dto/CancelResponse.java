package app.majid.aquifer.synchronizer.controller.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Result of a cancellation request")
public record CancelResponse(
        @Schema(description = "Number of running syncs asked to stop", example = "1")
        int cancelledRuns,

        @Schema(description = "Status message", example = "Cancellation requested")
        String message
) {
}
