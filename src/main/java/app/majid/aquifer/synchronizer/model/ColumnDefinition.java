package app.majid.aquifer.synchronizer.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A column as read from a backend. The type is kept verbatim; it is never translated between engines.
 */
public record ColumnDefinition(
        String name,
        String type
) {

    public ColumnDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    /**
     * Comparison key for the column name. Engines fold unquoted identifiers differently,
     * so names are matched case-insensitively.
     */
    public String key() {
        return name.toLowerCase(Locale.ROOT);
    }
}
