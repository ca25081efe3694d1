package app.majid.aquifer.synchronizer.controller;

import app.majid.aquifer.synchronizer.controller.dto.CancelResponse;
import app.majid.aquifer.synchronizer.controller.dto.RollbackRequest;
import app.majid.aquifer.synchronizer.controller.dto.SyncRequest;
import app.majid.aquifer.synchronizer.model.RollbackResult;
import app.majid.aquifer.synchronizer.model.SchemaObjectRef;
import app.majid.aquifer.synchronizer.model.TargetSyncResult;
import app.majid.aquifer.synchronizer.service.SynchronizerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for schema synchronization and rollback.
 */
@RestController
@RequestMapping("/api/synchronizer")
@Validated
@Tag(name = "Schema Synchronizer", description = "APIs for synchronizing target schemas from the source database")
public class SynchronizerController {

    private static final Logger logger = LoggerFactory.getLogger(SynchronizerController.class);

    private final SynchronizerService synchronizerService;

    public SynchronizerController(SynchronizerService synchronizerService) {
        this.synchronizerService = synchronizerService;
    }

    @PostMapping("/sync")
    @Operation(
            summary = "Sync source to targets",
            description = "Propagates the selected object kinds from the source to every configured target, or to the named ones. " +
                    "Each change is validated in a rolled-back transaction before it is applied and logged. " +
                    "Failures are reported per object and never stop the other objects or targets."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Run finished, see per-target and per-object outcomes",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = TargetSyncResult.class)))),
            @ApiResponse(responseCode = "400", description = "Unknown target or no source configured",
                    content = @Content(schema = @Schema(implementation = GlobalExceptionHandler.ErrorResponse.class))),
            @ApiResponse(responseCode = "500", description = "Internal server error",
                    content = @Content(schema = @Schema(implementation = GlobalExceptionHandler.ErrorResponse.class)))
    })
    public List<TargetSyncResult> sync(@Valid @RequestBody SyncRequest request) {
        logger.info("Received request to sync {} (targets: {})", request.toOptions(),
                request.targets() == null || request.targets().isEmpty() ? "all" : request.targets());

        List<TargetSyncResult> results = synchronizerService.synchronize(request.toOptions(), request.targets());

        logger.info("Completed sync request with {} target results", results.size());
        return results;
    }

    @PostMapping("/sync/cancel")
    @Operation(
            summary = "Cancel running syncs",
            description = "Asks every running sync to stop before its next object. A change being applied is finished and logged."
    )
    @ApiResponse(responseCode = "200", description = "Cancellation requested",
            content = @Content(schema = @Schema(implementation = CancelResponse.class)))
    public CancelResponse cancel() {
        int cancelled = synchronizerService.cancelRunning();
        return new CancelResponse(cancelled, cancelled == 0
                ? "No sync in progress"
                : "Cancellation requested");
    }

    @PostMapping("/rollback")
    @Operation(
            summary = "Roll back an object",
            description = "Reverses the latest logged change of an object on every configured target, or on the named ones. " +
                    "Creations are dropped; alterations and definition syncs are validated before they are reverted."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Rollback attempted, see per-target status",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = RollbackResult.class)))),
            @ApiResponse(responseCode = "400", description = "Invalid selector or unknown target",
                    content = @Content(schema = @Schema(implementation = GlobalExceptionHandler.ValidationErrorResponse.class))),
            @ApiResponse(responseCode = "500", description = "Internal server error",
                    content = @Content(schema = @Schema(implementation = GlobalExceptionHandler.ErrorResponse.class)))
    })
    public List<RollbackResult> rollback(@Valid @RequestBody RollbackRequest request) {
        SchemaObjectRef ref = SchemaObjectRef.parse(request.object());
        logger.info("Received request to roll back {}", ref);

        return synchronizerService.rollback(ref, request.targets());
    }
}
