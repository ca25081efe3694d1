package app.majid.aquifer.db.dialect;

import app.majid.aquifer.db.config.DbType;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * PostgreSQL. DDL is transactional, so the test gate leaves no trace.
 */
public class PostgresDialect extends AbstractSqlDialect {

    private static final Pattern UNQUOTED = Pattern.compile("[a-z_][a-z0-9_$]*");

    @Override
    public DbType type() {
        return DbType.POSTGRESQL;
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
        return true;
    }

    @Override
    public String createSyncLogTable(String tableName) {
        return """
                CREATE TABLE %s (
                    id BIGSERIAL PRIMARY KEY,
                    object_type VARCHAR(32) NOT NULL,
                    object_name VARCHAR(255) NOT NULL,
                    action VARCHAR(16) NOT NULL,
                    source_code_hash VARCHAR(64),
                    sync_direction VARCHAR(32),
                    original_state TEXT,
                    new_state TEXT NOT NULL,
                    rollback_action TEXT NOT NULL,
                    %s TIMESTAMP NOT NULL
                )""".formatted(quote(tableName), quoteAlways("timestamp"));
    }

    @Override
    public List<String> listViews(JdbcTemplate jdbcTemplate, String schema) {
        return jdbcTemplate.queryForList("""
                SELECT viewname FROM pg_catalog.pg_views
                WHERE schemaname = COALESCE(?, current_schema())
                ORDER BY viewname
                """, String.class, schema);
    }

    @Override
    public Optional<String> viewDefinition(JdbcTemplate jdbcTemplate, String schema, String name) {
        List<String> definitions = jdbcTemplate.queryForList("""
                SELECT pg_catalog.pg_get_viewdef(c.oid, true)
                FROM pg_catalog.pg_class c
                JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
                WHERE c.relkind = 'v'
                    AND n.nspname = COALESCE(?, current_schema())
                    AND c.relname = ?
                """, String.class, schema, name);
        return definitions.stream()
                .findFirst()
                .map(body -> "CREATE VIEW " + quote(name) + " AS\n" + body.strip());
    }

    @Override
    public List<String> listProcedures(JdbcTemplate jdbcTemplate, String schema) {
        return jdbcTemplate.queryForList("""
                SELECT p.proname
                FROM pg_catalog.pg_proc p
                JOIN pg_catalog.pg_namespace n ON n.oid = p.pronamespace
                WHERE p.prokind = 'p'
                    AND n.nspname = COALESCE(?, current_schema())
                ORDER BY p.proname
                """, String.class, schema);
    }

    @Override
    public Optional<String> procedureDefinition(JdbcTemplate jdbcTemplate, String schema, String name) {
        List<String> definitions = jdbcTemplate.queryForList("""
                SELECT pg_catalog.pg_get_functiondef(p.oid)
                FROM pg_catalog.pg_proc p
                JOIN pg_catalog.pg_namespace n ON n.oid = p.pronamespace
                WHERE p.prokind = 'p'
                    AND n.nspname = COALESCE(?, current_schema())
                    AND p.proname = ?
                ORDER BY p.oid
                """, String.class, schema, name);
        return definitions.stream().findFirst().map(String::strip);
    }
}
