package app.majid.aquifer.db.service;

import app.majid.aquifer.db.config.DbConfig;
import app.majid.aquifer.db.dialect.SqlDialect;
import app.majid.aquifer.synchronizer.db.BackendVariant;
import app.majid.aquifer.synchronizer.db.SchemaBackend;
import app.majid.aquifer.synchronizer.exception.BackendConnectionException;
import app.majid.aquifer.synchronizer.exception.LogWriteException;
import app.majid.aquifer.synchronizer.exception.ObjectNotFoundException;
import app.majid.aquifer.synchronizer.exception.StatementExecutionException;
import app.majid.aquifer.synchronizer.exception.UnsupportedBackendOperationException;
import app.majid.aquifer.synchronizer.model.ColumnDefinition;
import app.majid.aquifer.synchronizer.model.IndexDefinition;
import app.majid.aquifer.synchronizer.model.ObjectDefinition;
import app.majid.aquifer.synchronizer.model.ObjectKind;
import app.majid.aquifer.synchronizer.model.SchemaChange;
import app.majid.aquifer.synchronizer.model.SchemaObjectRef;
import app.majid.aquifer.synchronizer.model.ScriptDefinition;
import app.majid.aquifer.synchronizer.model.SyncAction;
import app.majid.aquifer.synchronizer.model.SyncLogEntry;
import app.majid.aquifer.synchronizer.model.TableDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static app.majid.aquifer.common.constants.SyncConstants.SYNC_LOG_NAME;

/**
 * Relational backend over a single JDBC connection.
 * <p>
 * Tables, columns and indexes are read through {@link DatabaseMetaData}; views, procedures, quoting
 * and DDL come from the {@link SqlDialect}. Statements run in auto-commit mode except inside the
 * test transaction. Target connections create the {@code sync_log} table when absent; a source
 * connection never writes to its database.
 * <p>
 * Test transactions are only offered on products whose DDL is transactional. Elsewhere a dry run
 * would commit the candidate statement, so the gate reports the operation as unsupported instead.
 */
public class JdbcSchemaBackend implements SchemaBackend {

    private static final Logger logger = LoggerFactory.getLogger(JdbcSchemaBackend.class);

    // H2 2.x reports plain tables as BASE TABLE
    private static final String[] TABLE_TYPES = {"TABLE", "BASE TABLE"};

    private final String name;
    private final SingleConnectionDataSource dataSource;
    private final SqlDialect dialect;
    private final String schema;
    private final JdbcTemplate jdbcTemplate;
    private final DataSourceTransactionManager transactionManager;

    private TransactionStatus testTransaction;

    public JdbcSchemaBackend(String name, SingleConnectionDataSource dataSource, SqlDialect dialect, String schema) {
        this.name = name;
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.schema = schema == null || schema.isBlank() ? null : schema;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionManager = new DataSourceTransactionManager(dataSource);
    }

    /**
     * Opens a target connection and makes sure the sync log table exists.
     *
     * @throws BackendConnectionException if the database cannot be reached
     */
    public static JdbcSchemaBackend connect(String name, DbConfig config, SqlDialect dialect)
            throws BackendConnectionException {
        return connect(name, config, dialect, true);
    }

    /**
     * Opens the connection.
     *
     * @param bootstrapLog whether to create the sync log table when absent; {@code false} for a source
     * @throws BackendConnectionException if the database cannot be reached
     */
    public static JdbcSchemaBackend connect(String name, DbConfig config, SqlDialect dialect, boolean bootstrapLog)
            throws BackendConnectionException {
        SingleConnectionDataSource dataSource =
                new SingleConnectionDataSource(config.url(), config.username(), config.password(), true);
        dataSource.setAutoCommit(true);

        JdbcSchemaBackend backend;
        try {
            if (config.driverClassName() != null && !config.driverClassName().isBlank()) {
                dataSource.setDriverClassName(config.driverClassName());
            }
            backend = new JdbcSchemaBackend(name, dataSource, dialect, config.schema());
            if (bootstrapLog) {
                backend.ensureSyncLog();
            } else {
                // Opened eagerly so bad credentials fail here
                dataSource.getConnection().close();
            }
        } catch (SQLException | DataAccessException | IllegalStateException e) {
            dataSource.destroy();
            throw new BackendConnectionException(name, e);
        }
        logger.info("Connected to '{}' ({})", name, dialect.type());
        return backend;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public BackendVariant variant() {
        return BackendVariant.RELATIONAL;
    }

    public SqlDialect dialect() {
        return dialect;
    }

    void ensureSyncLog() {
        if (findTableName(SYNC_LOG_NAME).isPresent()) {
            return;
        }
        logger.info("Creating {} table on '{}'", SYNC_LOG_NAME, name);
        jdbcTemplate.execute(dialect.createSyncLogTable(SYNC_LOG_NAME));
    }

    @Override
    public List<String> listObjects(ObjectKind kind)
            throws UnsupportedBackendOperationException, BackendConnectionException {
        try {
            return switch (kind) {
                case TABLE -> listTables();
                case VIEW -> dialect.listViews(jdbcTemplate, schema);
                case PROCEDURE -> dialect.listProcedures(jdbcTemplate, schema);
                case INDEX -> throw new UnsupportedBackendOperationException(variant(), "list indexes outside a table");
            };
        } catch (DataAccessResourceFailureException e) {
            throw new BackendConnectionException(name, e);
        }
    }

    @Override
    public ObjectDefinition getDefinition(SchemaObjectRef ref)
            throws ObjectNotFoundException, UnsupportedBackendOperationException, BackendConnectionException {
        try {
            return switch (ref.kind()) {
                case TABLE -> readTable(ref);
                case VIEW -> new ScriptDefinition(ref, dialect.viewDefinition(jdbcTemplate, schema, ref.name())
                        .orElseThrow(() -> notFound(ref)));
                case PROCEDURE -> new ScriptDefinition(ref, dialect.procedureDefinition(jdbcTemplate, schema, ref.name())
                        .orElseThrow(() -> notFound(ref)));
                case INDEX -> throw new UnsupportedBackendOperationException(variant(), "read a single index definition");
            };
        } catch (DataAccessResourceFailureException e) {
            throw new BackendConnectionException(name, e);
        }
    }

    @Override
    public boolean objectExists(SchemaObjectRef ref)
            throws UnsupportedBackendOperationException, BackendConnectionException {
        try {
            return switch (ref.kind()) {
                case TABLE -> findTableName(ref.name()).isPresent();
                case VIEW -> containsName(dialect.listViews(jdbcTemplate, schema), ref.name());
                case PROCEDURE -> containsName(dialect.listProcedures(jdbcTemplate, schema), ref.name());
                case INDEX -> throw new UnsupportedBackendOperationException(variant(), "look up an index outside a table");
            };
        } catch (DataAccessResourceFailureException e) {
            throw new BackendConnectionException(name, e);
        }
    }

    @Override
    public List<IndexDefinition> listIndexes(String table) throws BackendConnectionException {
        try {
            Optional<String> tableName = findTableName(table);
            if (tableName.isEmpty()) {
                return List.of();
            }
            return readIndexes(tableName.get());
        } catch (DataAccessResourceFailureException e) {
            throw new BackendConnectionException(name, e);
        }
    }

    @Override
    public List<String> render(SchemaChange change) throws UnsupportedBackendOperationException {
        return dialect.render(change);
    }

    @Override
    public String renderDefinition(ObjectDefinition definition) {
        if (definition instanceof TableDefinition table) {
            return dialect.renderCreateTable(table);
        }
        if (definition instanceof ScriptDefinition script) {
            return script.text();
        }
        if (definition instanceof IndexDefinition index) {
            return dialect.renderCreateIndex(index);
        }
        throw new IllegalArgumentException("Unknown definition type: " + definition);
    }

    @Override
    public void execute(String statement) throws StatementExecutionException {
        logger.debug("Executing on '{}': {}", name, statement);
        try {
            jdbcTemplate.execute(statement);
        } catch (DataAccessException e) {
            throw new StatementExecutionException(statement, e);
        }
    }

    @Override
    public void beginTestTransaction() throws UnsupportedBackendOperationException, BackendConnectionException {
        if (!dialect.supportsTransactionalDdl()) {
            throw new UnsupportedBackendOperationException(variant(),
                    "dry-run DDL on %s, which commits DDL implicitly".formatted(dialect.type()));
        }
        if (testTransaction != null) {
            throw new IllegalStateException("Test transaction already open on " + name);
        }
        try {
            testTransaction = transactionManager.getTransaction(TransactionDefinition.withDefaults());
        } catch (TransactionException e) {
            throw new BackendConnectionException(name, e);
        }
    }

    @Override
    public void rollbackTestTransaction() throws BackendConnectionException {
        if (testTransaction == null) {
            throw new IllegalStateException("No test transaction open on " + name);
        }
        try {
            transactionManager.rollback(testTransaction);
        } catch (TransactionException e) {
            throw new BackendConnectionException(name, e);
        } finally {
            testTransaction = null;
        }
    }

    @Override
    public void appendLogEntry(SyncLogEntry entry) throws LogWriteException {
        String sql = """
                INSERT INTO %s (object_type, object_name, action, source_code_hash, sync_direction,
                    original_state, new_state, rollback_action, %s)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """.formatted(dialect.quote(SYNC_LOG_NAME), dialect.quoteAlways("timestamp"));
        try {
            jdbcTemplate.update(sql,
                    entry.objectType().label(),
                    entry.objectName(),
                    entry.action().label(),
                    entry.sourceCodeHash(),
                    entry.syncDirection(),
                    entry.originalState(),
                    entry.newState(),
                    entry.rollbackAction(),
                    Timestamp.from(entry.timestamp()));
        } catch (DataAccessException e) {
            throw new LogWriteException(entry.ref(), e);
        }
    }

    @Override
    public Optional<SyncLogEntry> latestLogEntry(SchemaObjectRef ref) throws BackendConnectionException {
        String timestamp = dialect.quoteAlways("timestamp");
        String sql = """
                SELECT object_type, object_name, action, source_code_hash, sync_direction,
                    original_state, new_state, rollback_action, %s AS logged_at
                FROM %s
                WHERE object_type = ? AND object_name = ?
                ORDER BY %s DESC, id DESC
                """.formatted(timestamp, dialect.quote(SYNC_LOG_NAME), timestamp);
        try {
            return jdbcTemplate.query(sql, LOG_ENTRY_MAPPER, ref.kind().label(), ref.name())
                    .stream()
                    .findFirst();
        } catch (DataAccessResourceFailureException e) {
            throw new BackendConnectionException(name, e);
        }
    }

    @Override
    public void close() {
        dataSource.destroy();
        logger.debug("Closed connection to '{}'", name);
    }

    private static final RowMapper<SyncLogEntry> LOG_ENTRY_MAPPER = (rs, rowNum) -> new SyncLogEntry(
            ObjectKind.fromLabel(rs.getString("object_type")),
            rs.getString("object_name"),
            SyncAction.fromLabel(rs.getString("action")),
            rs.getString("source_code_hash"),
            rs.getString("sync_direction"),
            rs.getString("original_state"),
            rs.getString("new_state"),
            rs.getString("rollback_action"),
            rs.getTimestamp("logged_at").toInstant());

    private List<String> listTables() {
        return withMetaData(metaData -> {
            List<String> tables = new ArrayList<>();
            try (ResultSet rs = metaData.getTables(catalog(metaData), schemaPattern(metaData), "%", TABLE_TYPES)) {
                while (rs.next()) {
                    String table = rs.getString("TABLE_NAME");
                    if (!table.equalsIgnoreCase(SYNC_LOG_NAME)) {
                        tables.add(table);
                    }
                }
            }
            return tables;
        });
    }

    /**
     * Resolves a table name as stored in the catalog, trying it as given, then upper and lower case.
     */
    private Optional<String> findTableName(String table) {
        return withMetaData(metaData -> {
            Set<String> candidates = new LinkedHashSet<>(List.of(
                    table, table.toUpperCase(Locale.ROOT), table.toLowerCase(Locale.ROOT)));
            for (String candidate : candidates) {
                try (ResultSet rs = metaData.getTables(catalog(metaData), schemaPattern(metaData),
                    escapePattern(metaData, candidate), TABLE_TYPES)) {
                    if (rs.next()) {
                        return Optional.of(rs.getString("TABLE_NAME"));
                    }
                }
            }
            return Optional.empty();
        });
    }

    private TableDefinition readTable(SchemaObjectRef ref) throws ObjectNotFoundException {
        String table = findTableName(ref.name()).orElseThrow(() -> notFound(ref));
        List<ColumnDefinition> columns = withMetaData(metaData -> {
            List<ColumnDefinition> result = new ArrayList<>();
            try (ResultSet rs = metaData.getColumns(catalog(metaData), schemaPattern(metaData),
                    escapePattern(metaData, table), "%")) {
                while (rs.next()) {
                    String type = dialect.formatColumnType(
                            rs.getString("TYPE_NAME"),
                            rs.getInt("DATA_TYPE"),
                            rs.getInt("COLUMN_SIZE"),
                            rs.getInt("DECIMAL_DIGITS"));
                    result.add(new ColumnDefinition(rs.getString("COLUMN_NAME"), type));
                }
            }
            return result;
        });
        return new TableDefinition(ref.name(), columns);
    }

    private List<IndexDefinition> readIndexes(String table) {
        return withMetaData(metaData -> {
            Set<String> primaryKeys = new LinkedHashSet<>();
            try (ResultSet rs = metaData.getPrimaryKeys(catalog(metaData), schema(metaData), table)) {
                while (rs.next()) {
                    String pkName = rs.getString("PK_NAME");
                    if (pkName != null) {
                        primaryKeys.add(pkName.toLowerCase(Locale.ROOT));
                    }
                }
            }

            Map<String, List<String>> columnsByIndex = new LinkedHashMap<>();
            Map<String, Boolean> uniqueByIndex = new LinkedHashMap<>();
            try (ResultSet rs = metaData.getIndexInfo(catalog(metaData), schema(metaData), table, false, false)) {
                while (rs.next()) {
                    String indexName = rs.getString("INDEX_NAME");
                    String column = rs.getString("COLUMN_NAME");
                    if (indexName == null || column == null || rs.getShort("TYPE") == DatabaseMetaData.tableIndexStatistic) {
                        continue;
                    }
                    String key = indexName.toLowerCase(Locale.ROOT);
                    if (primaryKeys.contains(key) || key.startsWith("primary")) {
                        continue;
                    }
                    columnsByIndex.computeIfAbsent(indexName, k -> new ArrayList<>()).add(column);
                    uniqueByIndex.put(indexName, !rs.getBoolean("NON_UNIQUE"));
                }
            }

            List<IndexDefinition> indexes = new ArrayList<>();
            columnsByIndex.forEach((indexName, columns) ->
                    indexes.add(new IndexDefinition(indexName, table, columns, uniqueByIndex.get(indexName))));
            return indexes;
        });
    }

    private String catalog(DatabaseMetaData metaData) throws SQLException {
        return metaData.getConnection().getCatalog();
    }

    private String schema(DatabaseMetaData metaData) throws SQLException {
        return schema != null ? schema : metaData.getConnection().getSchema();
    }

    private String schemaPattern(DatabaseMetaData metaData) throws SQLException {
        String name = schema(metaData);
        return name == null ? null : escapePattern(metaData, name);
    }

    /**
     * Escapes {@code _} and {@code %} so that catalog lookups match the name literally.
     */
    static String escapePattern(DatabaseMetaData metaData, String name) throws SQLException {
        String escape = metaData.getSearchStringEscape();
        if (escape == null || escape.isEmpty()) {
            return name;
        }
        return name.replace(escape, escape + escape)
                .replace("_", escape + "_")
                .replace("%", escape + "%");
    }

    private <T> T withMetaData(MetaDataCallback<T> callback) {
        return jdbcTemplate.execute((Connection connection) -> callback.apply(connection.getMetaData()));
    }

    private static boolean containsName(List<String> names, String name) {
        return names.stream().anyMatch(n -> n.equalsIgnoreCase(name));
    }

    private static ObjectNotFoundException notFound(SchemaObjectRef ref) {
        return new ObjectNotFoundException(ref, ref + " does not exist");
    }

    @FunctionalInterface
    private interface MetaDataCallback<T> {
        T apply(DatabaseMetaData metaData) throws SQLException;
    }
}
