package app.majid.aquifer.db.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * A named target database.
 */
public record TargetConfig(
        @NotBlank(message = "Target name is required")
        String name,

        @NotNull(message = "Target connection is required")
        @Valid
        DbConfig config
) {
}
