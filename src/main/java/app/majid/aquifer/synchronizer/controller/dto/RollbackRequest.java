package app.majid.aquifer.synchronizer.controller.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

import java.util.List;

@Schema(description = "Request to roll back the latest logged change of an object")
public record RollbackRequest(
        @Schema(description = "Object selector in kind:name form", example = "view:v_active", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Object selector is required")
        @Pattern(regexp = "(?i)(table|view|procedure|index):.+", message = "Object selector must be kind:name")
        String object,

        @Schema(description = "Target names to roll back on, all configured targets when omitted",
                example = "[\"reporting\"]")
        List<String> targets
) {
}
