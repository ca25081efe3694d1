package app.majid.aquifer.db.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Optional;

/**
 * Source and target connections for synchronization.
 *
 * @param parallelism maximum number of targets synchronized at the same time
 */
@Validated
@ConfigurationProperties(prefix = "aquifer")
public record DbProperties(
        @Valid
        DbConfig source,

        @NotNull
        @Valid
        List<TargetConfig> targets,

        @DefaultValue("4")
        @Positive
        int parallelism
) {
    /**
     * Constructor that ensures the target list is never null.
     */
    public DbProperties {
        if (targets == null) {
            targets = List.of();
        }
    }

    public Optional<TargetConfig> findTarget(String name) {
        return targets.stream()
                .filter(t -> t.name().equalsIgnoreCase(name))
                .findFirst();
    }
}
