package app.majid.aquifer.db.graph;

import app.majid.aquifer.db.config.DbConfig;
import app.majid.aquifer.synchronizer.db.BackendVariant;
import app.majid.aquifer.synchronizer.db.SchemaBackend;
import app.majid.aquifer.synchronizer.exception.BackendConnectionException;
import app.majid.aquifer.synchronizer.exception.LogWriteException;
import app.majid.aquifer.synchronizer.exception.UnsupportedBackendOperationException;
import app.majid.aquifer.synchronizer.model.IndexDefinition;
import app.majid.aquifer.synchronizer.model.ObjectDefinition;
import app.majid.aquifer.synchronizer.model.ObjectKind;
import app.majid.aquifer.synchronizer.model.SchemaChange;
import app.majid.aquifer.synchronizer.model.SchemaObjectRef;
import app.majid.aquifer.synchronizer.model.SyncAction;
import app.majid.aquifer.synchronizer.model.SyncLogEntry;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.Neo4jException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static app.majid.aquifer.common.constants.SyncConstants.SYNC_LOG_LABEL;

/**
 * Graph store backend. Node labels are listed as tables; there is no DDL to diff or apply.
 * The sync log is a set of {@code :SyncLog} nodes carrying a monotonically increasing
 * {@code sequence} that orders entries sharing a timestamp.
 */
public class Neo4jSchemaBackend implements SchemaBackend {

    private static final Logger logger = LoggerFactory.getLogger(Neo4jSchemaBackend.class);

    private static final String APPEND_QUERY = """
            OPTIONAL MATCH (previous:%1$s)
            WITH coalesce(max(previous.sequence), 0) + 1 AS next
            CREATE (:%1$s {
                object_type: $object_type,
                object_name: $object_name,
                action: $action,
                source_code_hash: $source_code_hash,
                sync_direction: $sync_direction,
                original_state: $original_state,
                new_state: $new_state,
                rollback_action: $rollback_action,
                timestamp: datetime($timestamp),
                sequence: next
            })
            """.formatted(SYNC_LOG_LABEL);

    private static final String LATEST_QUERY = """
            MATCH (log:%s {object_type: $object_type, object_name: $object_name})
            RETURN log
            ORDER BY log.timestamp DESC, log.sequence DESC
            LIMIT 1
            """.formatted(SYNC_LOG_LABEL);

    private final String name;
    private final Driver driver;
    private final SessionConfig sessionConfig;

    public Neo4jSchemaBackend(String name, Driver driver, String database) {
        this.name = name;
        this.driver = driver;
        this.sessionConfig = database == null || database.isBlank()
                ? SessionConfig.defaultConfig()
                : SessionConfig.forDatabase(database);
    }

    /**
     * Connects and verifies connectivity.
     *
     * @throws BackendConnectionException if the server cannot be reached or rejects the credentials
     */
    public static Neo4jSchemaBackend connect(String name, DbConfig config) throws BackendConnectionException {
        Driver driver = config.username() == null || config.username().isBlank()
                ? GraphDatabase.driver(config.url())
                : GraphDatabase.driver(config.url(), AuthTokens.basic(config.username(), config.password()));
        try {
            driver.verifyConnectivity();
        } catch (Neo4jException e) {
            driver.close();
            throw new BackendConnectionException(name, e);
        }
        logger.info("Connected to '{}' (NEO4J)", name);
        return new Neo4jSchemaBackend(name, driver, config.database());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public BackendVariant variant() {
        return BackendVariant.GRAPH_STORE;
    }

    @Override
    public List<String> listObjects(ObjectKind kind)
            throws UnsupportedBackendOperationException, BackendConnectionException {
        if (kind != ObjectKind.TABLE) {
            throw unsupported("list " + kind.label() + " objects");
        }
        try (Session session = driver.session(sessionConfig)) {
            return session.executeRead(tx -> tx.run("CALL db.labels() YIELD label RETURN label ORDER BY label")
                    .list(record -> record.get("label").asString()))
                    .stream()
                    .filter(label -> !label.equals(SYNC_LOG_LABEL))
                    .toList();
        } catch (Neo4jException e) {
            throw new BackendConnectionException(name, e);
        }
    }

    @Override
    public ObjectDefinition getDefinition(SchemaObjectRef ref) throws UnsupportedBackendOperationException {
        throw unsupported("read the definition of " + ref);
    }

    @Override
    public boolean objectExists(SchemaObjectRef ref)
            throws UnsupportedBackendOperationException, BackendConnectionException {
        return listObjects(ref.kind()).contains(ref.name());
    }

    @Override
    public List<IndexDefinition> listIndexes(String table) throws UnsupportedBackendOperationException {
        throw unsupported("list indexes");
    }

    @Override
    public List<String> render(SchemaChange change) throws UnsupportedBackendOperationException {
        throw unsupported("render DDL");
    }

    @Override
    public String renderDefinition(ObjectDefinition definition) throws UnsupportedBackendOperationException {
        throw unsupported("render definitions");
    }

    @Override
    public void execute(String statement) throws UnsupportedBackendOperationException {
        throw unsupported("execute DDL");
    }

    @Override
    public void beginTestTransaction() throws UnsupportedBackendOperationException {
        throw unsupported("test transactions");
    }

    @Override
    public void rollbackTestTransaction() throws UnsupportedBackendOperationException {
        throw unsupported("test transactions");
    }

    @Override
    public void appendLogEntry(SyncLogEntry entry) throws LogWriteException {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("object_type", entry.objectType().label());
        parameters.put("object_name", entry.objectName());
        parameters.put("action", entry.action().label());
        parameters.put("source_code_hash", entry.sourceCodeHash());
        parameters.put("sync_direction", entry.syncDirection());
        parameters.put("original_state", entry.originalState());
        parameters.put("new_state", entry.newState());
        parameters.put("rollback_action", entry.rollbackAction());
        parameters.put("timestamp", entry.timestamp().toString());

        try (Session session = driver.session(sessionConfig)) {
            session.executeWrite(tx -> tx.run(APPEND_QUERY, parameters).consume());
        } catch (Neo4jException e) {
            throw new LogWriteException(entry.ref(), e);
        }
    }

    @Override
    public Optional<SyncLogEntry> latestLogEntry(SchemaObjectRef ref) throws BackendConnectionException {
        Map<String, Object> parameters = Map.of(
                "object_type", ref.kind().label(),
                "object_name", ref.name());
        try (Session session = driver.session(sessionConfig)) {
            List<Record> records = session.executeRead(tx -> tx.run(LATEST_QUERY, parameters).list());
            return records.stream().findFirst().map(record -> toEntry(record.get("log")));
        } catch (Neo4jException e) {
            throw new BackendConnectionException(name, e);
        }
    }

    @Override
    public void close() {
        driver.close();
    }

    private static SyncLogEntry toEntry(Value node) {
        return new SyncLogEntry(
                ObjectKind.fromLabel(node.get("object_type").asString()),
                node.get("object_name").asString(),
                SyncAction.fromLabel(node.get("action").asString()),
                node.get("source_code_hash").asString(null),
                node.get("sync_direction").asString(null),
                node.get("original_state").asString(null),
                node.get("new_state").asString(),
                node.get("rollback_action").asString(),
                node.get("timestamp").asZonedDateTime().toInstant());
    }

    private static UnsupportedBackendOperationException unsupported(String operation) {
        return new UnsupportedBackendOperationException(BackendVariant.GRAPH_STORE, operation);
    }
}
