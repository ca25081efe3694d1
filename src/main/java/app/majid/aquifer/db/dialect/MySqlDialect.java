package app.majid.aquifer.db.dialect;

import app.majid.aquifer.db.config.DbType;
import app.majid.aquifer.synchronizer.model.IndexDefinition;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * MySQL and MariaDB. DDL commits implicitly, so a statement the test gate accepts is already applied
 * when the gate rolls back.
 */
public class MySqlDialect extends AbstractSqlDialect {

    private static final Pattern UNQUOTED = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");

    @Override
    public DbType type() {
        return DbType.MYSQL;
    }

    @Override
    protected String openQuote() {
        return "`";
    }

    @Override
    protected String closeQuote() {
        return "`";
    }

    @Override
    protected Pattern unquotedIdentifier() {
        return UNQUOTED;
    }

    @Override
    protected String dropIndexStatement(IndexDefinition index) {
        return "DROP INDEX " + quote(index.name()) + " ON " + quote(index.table());
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
                    original_state LONGTEXT,
                    new_state LONGTEXT NOT NULL,
                    rollback_action LONGTEXT NOT NULL,
                    %s DATETIME(6) NOT NULL
                )""".formatted(quote(tableName), quoteAlways("timestamp"));
    }

    @Override
    public List<String> listViews(JdbcTemplate jdbcTemplate, String schema) {
        return jdbcTemplate.queryForList("""
                SELECT TABLE_NAME FROM information_schema.VIEWS
                WHERE TABLE_SCHEMA = COALESCE(?, DATABASE())
                ORDER BY TABLE_NAME
                """, String.class, schema);
    }

    @Override
    public Optional<String> viewDefinition(JdbcTemplate jdbcTemplate, String schema, String name) {
        if (!listViews(jdbcTemplate, schema).contains(name)) {
            return Optional.empty();
        }
        return Optional.ofNullable(jdbcTemplate.queryForObject(
                "SHOW CREATE VIEW " + quote(name), (rs, rowNum) -> rs.getString("Create View")));
    }

    @Override
    public List<String> listProcedures(JdbcTemplate jdbcTemplate, String schema) {
        return jdbcTemplate.queryForList("""
                SELECT ROUTINE_NAME FROM information_schema.ROUTINES
                WHERE ROUTINE_SCHEMA = COALESCE(?, DATABASE())
                    AND ROUTINE_TYPE = 'PROCEDURE'
                ORDER BY ROUTINE_NAME
                """, String.class, schema);
    }

    @Override
    public Optional<String> procedureDefinition(JdbcTemplate jdbcTemplate, String schema, String name) {
        if (!listProcedures(jdbcTemplate, schema).contains(name)) {
            return Optional.empty();
        }
        // Null when the user lacks privileges on the routine body
        return Optional.ofNullable(jdbcTemplate.queryForObject(
                "SHOW CREATE PROCEDURE " + quote(name), (rs, rowNum) -> rs.getString("Create Procedure")));
    }
}
