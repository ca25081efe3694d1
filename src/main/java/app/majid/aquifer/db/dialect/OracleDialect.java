package app.majid.aquifer.db.dialect;

import app.majid.aquifer.db.config.DbType;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Types;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Oracle. Unquoted identifiers fold to upper case and DDL commits implicitly.
 * Definitions are produced by {@code DBMS_METADATA}.
 */
public class OracleDialect extends AbstractSqlDialect {

    private static final Pattern UNQUOTED = Pattern.compile("[A-Z][A-Z0-9_$#]*");

    @Override
    public DbType type() {
        return DbType.ORACLE;
    }

    @Override
    protected String openQuote() {
        return "\"";
    }

    @Override
    protected String closeQuote() {
        return "\"";
    }

    @Override
    protected Pattern unquotedIdentifier() {
        return UNQUOTED;
    }

    @Override
    protected String addColumnClause() {
        return "ADD";
    }

    @Override
    public String formatColumnType(String typeName, int dataType, int columnSize, int decimalDigits) {
        if (typeName == null || typeName.contains("(")) {
            return typeName;
        }
        return switch (typeName.toUpperCase(Locale.ROOT)) {
            case "VARCHAR2", "NVARCHAR2", "CHAR", "NCHAR", "RAW" -> typeName + "(" + columnSize + ")";
            case "NUMBER" -> {
                if (columnSize <= 0) {
                    yield typeName;
                }
                yield decimalDigits > 0
                        ? typeName + "(" + columnSize + ", " + decimalDigits + ")"
                        : typeName + "(" + columnSize + ")";
            }
            default -> dataType == Types.OTHER ? typeName : super.formatColumnType(typeName, dataType, columnSize, decimalDigits);
        };
    }

    @Override
    public boolean supportsTransactionalDdl() {
        return false;
    }

    @Override
    public String createSyncLogTable(String tableName) {
        return """
                CREATE TABLE %s (
                    id NUMBER(19) GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    object_type VARCHAR2(32) NOT NULL,
                    object_name VARCHAR2(255) NOT NULL,
                    action VARCHAR2(16) NOT NULL,
                    source_code_hash VARCHAR2(64),
                    sync_direction VARCHAR2(32),
                    original_state CLOB,
                    new_state CLOB NOT NULL,
                    rollback_action CLOB NOT NULL,
                    %s TIMESTAMP NOT NULL
                )""".formatted(quote(tableName), quoteAlways("timestamp"));
    }

    @Override
    public List<String> listViews(JdbcTemplate jdbcTemplate, String schema) {
        return jdbcTemplate.queryForList("""
                SELECT VIEW_NAME FROM ALL_VIEWS
                WHERE OWNER = COALESCE(?, SYS_CONTEXT('USERENV', 'CURRENT_SCHEMA'))
                ORDER BY VIEW_NAME
                """, String.class, schema);
    }

    @Override
    public Optional<String> viewDefinition(JdbcTemplate jdbcTemplate, String schema, String name) {
        if (!listViews(jdbcTemplate, schema).contains(name)) {
            return Optional.empty();
        }
        return metadataDdl(jdbcTemplate, "VIEW", schema, name);
    }

    @Override
    public List<String> listProcedures(JdbcTemplate jdbcTemplate, String schema) {
        return jdbcTemplate.queryForList("""
                SELECT OBJECT_NAME FROM ALL_PROCEDURES
                WHERE OWNER = COALESCE(?, SYS_CONTEXT('USERENV', 'CURRENT_SCHEMA'))
                    AND OBJECT_TYPE = 'PROCEDURE'
                ORDER BY OBJECT_NAME
                """, String.class, schema);
    }

    @Override
    public Optional<String> procedureDefinition(JdbcTemplate jdbcTemplate, String schema, String name) {
        if (!listProcedures(jdbcTemplate, schema).contains(name)) {
            return Optional.empty();
        }
        return metadataDdl(jdbcTemplate, "PROCEDURE", schema, name);
    }

    private Optional<String> metadataDdl(JdbcTemplate jdbcTemplate, String objectType, String schema, String name) {
        String ddl = jdbcTemplate.queryForObject("""
                SELECT DBMS_METADATA.GET_DDL(?, ?, COALESCE(?, SYS_CONTEXT('USERENV', 'CURRENT_SCHEMA')))
                FROM DUAL
                """, String.class, objectType, name, schema);
        return Optional.ofNullable(ddl).map(String::strip);
    }
}
