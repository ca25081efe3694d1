package app.majid.aquifer.db.dialect;

import app.majid.aquifer.synchronizer.db.BackendVariant;
import app.majid.aquifer.synchronizer.exception.UnsupportedBackendOperationException;
import app.majid.aquifer.synchronizer.model.ColumnDefinition;
import app.majid.aquifer.synchronizer.model.IndexDefinition;
import app.majid.aquifer.synchronizer.model.SchemaChange;
import app.majid.aquifer.synchronizer.model.SchemaObjectRef;
import app.majid.aquifer.synchronizer.model.TableDefinition;

import java.sql.Types;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rendering shared by all relational dialects.
 * <p>
 * Subclasses supply quote characters, the identifiers that are safe unquoted and the few clauses
 * that differ between engines.
 */
public abstract class AbstractSqlDialect implements SqlDialect {

    private static final Pattern DEFAULT_UNQUOTED = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Set<String> RESERVED_WORDS = Set.of(
            "add", "all", "alter", "and", "as", "asc", "by", "check", "column", "constraint", "create",
            "date", "default", "delete", "desc", "distinct", "drop", "from", "group", "having", "in",
            "index", "insert", "into", "key", "level", "like", "not", "null", "on", "or", "order",
            "primary", "procedure", "select", "session", "table", "timestamp", "to", "union", "unique",
            "update", "user", "values", "view", "where");

    protected abstract String openQuote();

    protected abstract String closeQuote();

    /**
     * Identifiers matching this pattern keep their meaning without quotes.
     */
    protected Pattern unquotedIdentifier() {
        return DEFAULT_UNQUOTED;
    }

    /**
     * Keyword introducing a new column in {@code ALTER TABLE}.
     */
    protected String addColumnClause() {
        return "ADD COLUMN";
    }

    @Override
    public String quote(String identifier) {
        if (unquotedIdentifier().matcher(identifier).matches()
                && !RESERVED_WORDS.contains(identifier.toLowerCase(Locale.ROOT))) {
            return identifier;
        }
        return quoteAlways(identifier);
    }

    @Override
    public String quoteAlways(String identifier) {
        return openQuote() + identifier.replace(closeQuote(), closeQuote() + closeQuote()) + closeQuote();
    }

    @Override
    public List<String> render(SchemaChange change) throws UnsupportedBackendOperationException {
        if (change instanceof SchemaChange.CreateTable create) {
            return List.of(renderCreateTable(create.table()));
        }
        if (change instanceof SchemaChange.AddColumn add) {
            return List.of("ALTER TABLE " + quote(add.table()) + " " + addColumnClause() + " "
                    + columnDefinition(add.column()));
        }
        if (change instanceof SchemaChange.DropColumn drop) {
            return List.of("ALTER TABLE " + quote(drop.table()) + " DROP COLUMN " + quote(drop.column()));
        }
        if (change instanceof SchemaChange.CreateFromDefinition create) {
            return List.of(create.definition());
        }
        if (change instanceof SchemaChange.ReplaceFromDefinition replace) {
            return List.of(dropStatement(replace.target()), replace.definition());
        }
        if (change instanceof SchemaChange.DropObject drop) {
            return List.of(dropStatement(drop.target()));
        }
        if (change instanceof SchemaChange.CreateIndex create) {
            return List.of(renderCreateIndex(create.index()));
        }
        if (change instanceof SchemaChange.DropIndex drop) {
            return List.of(dropIndexStatement(drop.index()));
        }
        throw new IllegalArgumentException("Unknown schema change: " + change);
    }

    @Override
    public String renderCreateTable(TableDefinition table) {
        String columns = table.columns().stream()
                .map(this::columnDefinition)
                .collect(Collectors.joining(", "));
        return "CREATE TABLE " + quote(table.name()) + " (" + columns + ")";
    }

    @Override
    public String renderCreateIndex(IndexDefinition index) {
        String columns = index.columns().stream()
                .map(this::quote)
                .collect(Collectors.joining(", "));
        return "CREATE " + (index.unique() ? "UNIQUE " : "") + "INDEX " + quote(index.name())
                + " ON " + quote(index.table()) + " (" + columns + ")";
    }

    protected String columnDefinition(ColumnDefinition column) {
        return quote(column.name()) + " " + column.type();
    }

    protected String dropStatement(SchemaObjectRef ref) throws UnsupportedBackendOperationException {
        return switch (ref.kind()) {
            case TABLE -> "DROP TABLE " + quote(ref.name());
            case VIEW -> "DROP VIEW " + quote(ref.name());
            case PROCEDURE -> "DROP PROCEDURE " + quote(ref.name());
            case INDEX -> throw new UnsupportedBackendOperationException(
                    BackendVariant.RELATIONAL, "drop index " + ref.name() + " without its table");
        };
    }

    protected String dropIndexStatement(IndexDefinition index) {
        return "DROP INDEX " + quote(index.name());
    }

    @Override
    public String formatColumnType(String typeName, int dataType, int columnSize, int decimalDigits) {
        if (typeName == null || typeName.contains("(")) {
            return typeName;
        }
        return switch (dataType) {
            case Types.CHAR, Types.VARCHAR, Types.NCHAR, Types.NVARCHAR, Types.BINARY, Types.VARBINARY ->
                    columnSize > 0 && columnSize < Integer.MAX_VALUE ? typeName + "(" + columnSize + ")" : typeName;
            case Types.DECIMAL, Types.NUMERIC ->
                    columnSize > 0 && columnSize <= 1000
                            ? typeName + "(" + columnSize + ", " + decimalDigits + ")"
                            : typeName;
            default -> typeName;
        };
    }

    protected UnsupportedBackendOperationException unsupported(String operation) {
        return new UnsupportedBackendOperationException(BackendVariant.RELATIONAL,
                operation + " on " + type().name().toLowerCase(Locale.ROOT));
    }
}
