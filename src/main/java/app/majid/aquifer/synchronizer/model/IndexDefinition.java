package app.majid.aquifer.synchronizer.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A secondary index of a table, matched by name.
 */
public record IndexDefinition(
        String name,
        String table,
        List<String> columns,
        boolean unique
) implements ObjectDefinition {

    public IndexDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(table, "table");
        columns = List.copyOf(columns);
    }

    public String key() {
        return name.toLowerCase(Locale.ROOT);
    }

    @Override
    public SchemaObjectRef ref() {
        return new SchemaObjectRef(ObjectKind.INDEX, name);
    }
}
