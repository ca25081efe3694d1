package app.majid.aquifer.synchronizer.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered column list of a table. Column order is kept for rendering but ignored for comparison.
 */
public record TableDefinition(
        String name,
        List<ColumnDefinition> columns
) implements ObjectDefinition {

    public TableDefinition {
        Objects.requireNonNull(name, "name");
        columns = List.copyOf(columns);
    }

    @Override
    public SchemaObjectRef ref() {
        return SchemaObjectRef.table(name);
    }

    public Map<String, ColumnDefinition> columnsByKey() {
        Map<String, ColumnDefinition> byKey = new LinkedHashMap<>();
        columns.forEach(c -> byKey.putIfAbsent(c.key(), c));
        return byKey;
    }

    public boolean hasColumn(String columnName) {
        return findColumn(columnName).isPresent();
    }

    public Optional<ColumnDefinition> findColumn(String columnName) {
        String key = new ColumnDefinition(columnName, "").key();
        return columns.stream().filter(c -> c.key().equals(key)).findFirst();
    }

    public TableDefinition withColumn(ColumnDefinition column) {
        List<ColumnDefinition> extended = new ArrayList<>(columns);
        extended.add(column);
        return new TableDefinition(name, extended);
    }

    @Override
    public String toString() {
        return "TableDefinition[name=%s, columns=%d]".formatted(name, columns.size());
    }
}
