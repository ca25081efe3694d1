package app.majid.aquifer.db.dialect;

import app.majid.aquifer.db.config.DbType;
import app.majid.aquifer.synchronizer.exception.UnsupportedBackendOperationException;
import app.majid.aquifer.synchronizer.model.IndexDefinition;
import app.majid.aquifer.synchronizer.model.SchemaChange;
import app.majid.aquifer.synchronizer.model.TableDefinition;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Engine-specific SQL for a relational backend: identifier quoting, DDL rendering, the sync log
 * table and the catalog queries for views and procedures. Tables, columns and indexes are read
 * through JDBC metadata and need no dialect support beyond type formatting.
 */
public interface SqlDialect {

    DbType type();

    /**
     * Quotes an identifier only when it would not survive unquoted, so that names read from the
     * catalog round-trip with the engine's case folding.
     */
    String quote(String identifier);

    /**
     * Quotes an identifier unconditionally.
     */
    String quoteAlways(String identifier);

    /**
     * Renders a change to the statements that apply it, in order.
     */
    List<String> render(SchemaChange change) throws UnsupportedBackendOperationException;

    String renderCreateTable(TableDefinition table);

    String renderCreateIndex(IndexDefinition index);

    /**
     * Formats a column type as read from {@link java.sql.DatabaseMetaData#getColumns}.
     */
    String formatColumnType(String typeName, int dataType, int columnSize, int decimalDigits);

    /**
     * Whether DDL executed inside a transaction is undone by a rollback. When {@code false} the
     * test gate still detects invalid statements but a valid one stays applied.
     */
    boolean supportsTransactionalDdl();

    /**
     * DDL creating the sync log table with an identity {@code id} column.
     */
    String createSyncLogTable(String tableName);

    List<String> listViews(JdbcTemplate jdbcTemplate, String schema) throws UnsupportedBackendOperationException;

    /**
     * Returns the full, executable definition of a view, starting with {@code CREATE}.
     */
    Optional<String> viewDefinition(JdbcTemplate jdbcTemplate, String schema, String name)
            throws UnsupportedBackendOperationException;

    List<String> listProcedures(JdbcTemplate jdbcTemplate, String schema) throws UnsupportedBackendOperationException;

    /**
     * Returns the full, executable definition of a procedure, starting with {@code CREATE}.
     */
    Optional<String> procedureDefinition(JdbcTemplate jdbcTemplate, String schema, String name)
            throws UnsupportedBackendOperationException;
}
