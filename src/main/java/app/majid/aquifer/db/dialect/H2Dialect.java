package app.majid.aquifer.db.dialect;

import app.majid.aquifer.db.config.DbType;
import app.majid.aquifer.synchronizer.exception.UnsupportedBackendOperationException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * H2, mostly for local runs and tests. Unquoted identifiers fold to upper case, DDL commits
 * implicitly and there are no stored procedures.
 */
public class H2Dialect extends AbstractSqlDialect {

    private static final Pattern UNQUOTED = Pattern.compile("[A-Z_][A-Z0-9_]*");

    @Override
    public DbType type() {
        return DbType.H2;
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
    public boolean supportsTransactionalDdl() {
        return false;
    }

    @Override
    public String createSyncLogTable(String tableName) {
        return """
                CREATE TABLE %s (
                    id BIGINT AUTO_INCREMENT PRIMARY KEY,
                    object_type VARCHAR(32) NOT NULL,
                    object_name VARCHAR(255) NOT NULL,
                    action VARCHAR(16) NOT NULL,
                    source_code_hash VARCHAR(64),
                    sync_direction VARCHAR(32),
                    original_state CLOB,
                    new_state CLOB NOT NULL,
                    rollback_action CLOB NOT NULL,
                    %s TIMESTAMP(9) NOT NULL
                )""".formatted(quote(tableName), quoteAlways("timestamp"));
    }

    @Override
    public List<String> listViews(JdbcTemplate jdbcTemplate, String schema) {
        return jdbcTemplate.queryForList("""
                SELECT TABLE_NAME FROM INFORMATION_SCHEMA.VIEWS
                WHERE TABLE_SCHEMA = COALESCE(?, SCHEMA())
                ORDER BY TABLE_NAME
                """, String.class, schema);
    }

    @Override
    public Optional<String> viewDefinition(JdbcTemplate jdbcTemplate, String schema, String name) {
        List<String> definitions = jdbcTemplate.queryForList("""
                SELECT VIEW_DEFINITION FROM INFORMATION_SCHEMA.VIEWS
                WHERE TABLE_SCHEMA = COALESCE(?, SCHEMA())
                    AND TABLE_NAME = ?
                """, String.class, schema, name);
        return definitions.stream()
                .findFirst()
                .map(body -> "CREATE VIEW " + quote(name) + " AS " + body.strip());
    }

    @Override
    public List<String> listProcedures(JdbcTemplate jdbcTemplate, String schema)
            throws UnsupportedBackendOperationException {
        throw unsupported("stored procedures");
    }

    @Override
    public Optional<String> procedureDefinition(JdbcTemplate jdbcTemplate, String schema, String name)
            throws UnsupportedBackendOperationException {
        throw unsupported("stored procedures");
    }
}
