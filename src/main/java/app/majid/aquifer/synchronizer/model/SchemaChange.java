package app.majid.aquifer.synchronizer.model;

import java.util.Objects;

/**
 * Dialect-agnostic description of a DDL change. The diff produces these; each backend renders
 * them to its own statement text.
 */
public interface SchemaChange {

    SchemaObjectRef target();

    /**
     * {@code CREATE TABLE} listing every column in order.
     */
    record CreateTable(TableDefinition table) implements SchemaChange {
        public CreateTable {
            Objects.requireNonNull(table, "table");
        }

        @Override
        public SchemaObjectRef target() {
            return table.ref();
        }
    }

    record AddColumn(String table, ColumnDefinition column) implements SchemaChange {
        public AddColumn {
            Objects.requireNonNull(table, "table");
            Objects.requireNonNull(column, "column");
        }

        @Override
        public SchemaObjectRef target() {
            return SchemaObjectRef.table(table);
        }
    }

    record DropColumn(String table, String column) implements SchemaChange {
        public DropColumn {
            Objects.requireNonNull(table, "table");
            Objects.requireNonNull(column, "column");
        }

        @Override
        public SchemaObjectRef target() {
            return SchemaObjectRef.table(table);
        }
    }

    /**
     * Executes a definition verbatim, e.g. a view or procedure body read from the source.
     */
    record CreateFromDefinition(SchemaObjectRef target, String definition) implements SchemaChange {
        public CreateFromDefinition {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(definition, "definition");
        }
    }

    /**
     * Drops the existing object, then executes the definition verbatim.
     */
    record ReplaceFromDefinition(SchemaObjectRef target, String definition) implements SchemaChange {
        public ReplaceFromDefinition {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(definition, "definition");
        }
    }

    record DropObject(SchemaObjectRef target) implements SchemaChange {
        public DropObject {
            Objects.requireNonNull(target, "target");
        }
    }

    record CreateIndex(IndexDefinition index) implements SchemaChange {
        public CreateIndex {
            Objects.requireNonNull(index, "index");
        }

        @Override
        public SchemaObjectRef target() {
            return index.ref();
        }
    }

    record DropIndex(IndexDefinition index) implements SchemaChange {
        public DropIndex {
            Objects.requireNonNull(index, "index");
        }

        @Override
        public SchemaObjectRef target() {
            return index.ref();
        }
    }
}
