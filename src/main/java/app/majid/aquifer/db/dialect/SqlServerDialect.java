package app.majid.aquifer.db.dialect;

import app.majid.aquifer.db.config.DbType;
import app.majid.aquifer.synchronizer.model.IndexDefinition;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * SQL Server. View and procedure bodies come from {@code sys.sql_modules}; DDL is transactional.
 */
public class SqlServerDialect extends AbstractSqlDialect {

    private static final int MAX_FIXED_LENGTH = 8000;

    @Override
    public DbType type() {
        return DbType.SQLSERVER;
    }

    @Override
    protected String openQuote() {
        return "[";
    }

    @Override
    protected String closeQuote() {
        return "]";
    }

    @Override
    protected String addColumnClause() {
        return "ADD";
    }

    @Override
    protected String dropIndexStatement(IndexDefinition index) {
        return "DROP INDEX " + quote(index.name()) + " ON " + quote(index.table());
    }

    /**
     * Formats a data type with its length, precision and scale. Lengths beyond the fixed maximum
     * are the {@code MAX} variants.
     */
    @Override
    public String formatColumnType(String typeName, int dataType, int columnSize, int decimalDigits) {
        if (typeName == null) {
            return null;
        }
        // The driver reports identity columns as e.g. "int identity"
        String baseType = typeName.replaceFirst("(?i)\\s+identity$", "");
        return switch (baseType.toLowerCase(Locale.ROOT)) {
            case "varchar", "char", "varbinary", "binary", "nvarchar", "nchar" ->
                    baseType + "(" + (columnSize <= 0 || columnSize > MAX_FIXED_LENGTH ? "MAX" : columnSize) + ")";
            case "decimal", "numeric" -> baseType + "(" + columnSize + ", " + decimalDigits + ")";
            case "datetime2", "time", "datetimeoffset" ->
                    decimalDigits > 0 ? baseType + "(" + decimalDigits + ")" : baseType;
            default -> baseType;
        };
    }

    @Override
    public boolean supportsTransactionalDdl() {
        return true;
    }

    @Override
    public String createSyncLogTable(String tableName) {
        return """
                CREATE TABLE %s (
                    id BIGINT IDENTITY(1,1) PRIMARY KEY,
                    object_type NVARCHAR(32) NOT NULL,
                    object_name NVARCHAR(255) NOT NULL,
                    action NVARCHAR(16) NOT NULL,
                    source_code_hash NVARCHAR(64),
                    sync_direction NVARCHAR(32),
                    original_state NVARCHAR(MAX),
                    new_state NVARCHAR(MAX) NOT NULL,
                    rollback_action NVARCHAR(MAX) NOT NULL,
                    %s DATETIME2 NOT NULL
                )""".formatted(quote(tableName), quoteAlways("timestamp"));
    }

    @Override
    public List<String> listViews(JdbcTemplate jdbcTemplate, String schema) {
        return listModules(jdbcTemplate, schema, "V");
    }

    @Override
    public Optional<String> viewDefinition(JdbcTemplate jdbcTemplate, String schema, String name) {
        return moduleDefinition(jdbcTemplate, schema, "V", name);
    }

    @Override
    public List<String> listProcedures(JdbcTemplate jdbcTemplate, String schema) {
        return listModules(jdbcTemplate, schema, "P");
    }

    @Override
    public Optional<String> procedureDefinition(JdbcTemplate jdbcTemplate, String schema, String name) {
        return moduleDefinition(jdbcTemplate, schema, "P", name);
    }

    private List<String> listModules(JdbcTemplate jdbcTemplate, String schema, String objectType) {
        return jdbcTemplate.queryForList("""
                SELECT o.name
                FROM sys.objects o
                JOIN sys.schemas s ON o.schema_id = s.schema_id
                JOIN sys.sql_modules m ON o.object_id = m.object_id
                WHERE o.type = ?
                    AND o.is_ms_shipped = 0
                    AND s.name = COALESCE(?, SCHEMA_NAME())
                ORDER BY o.name
                """, String.class, objectType, schema);
    }

    private Optional<String> moduleDefinition(JdbcTemplate jdbcTemplate, String schema, String objectType,
                                              String name) {
        List<String> definitions = jdbcTemplate.queryForList("""
                SELECT m.definition
                FROM sys.objects o
                JOIN sys.schemas s ON o.schema_id = s.schema_id
                JOIN sys.sql_modules m ON o.object_id = m.object_id
                WHERE o.type = ?
                    AND s.name = COALESCE(?, SCHEMA_NAME())
                    AND o.name = ?
                """, String.class, objectType, schema, name);
        return definitions.stream().findFirst().map(String::strip);
    }
}
