package app.majid.aquifer.db.document;

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
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;

import static app.majid.aquifer.common.constants.SyncConstants.SYNC_LOG_NAME;

/**
 * Document store backend. Collections are listed as tables, but there is no DDL to diff or apply:
 * every schema operation is unsupported. The sync log lives in the {@code sync_log} collection.
 */
public class MongoSchemaBackend implements SchemaBackend {

    private static final Logger logger = LoggerFactory.getLogger(MongoSchemaBackend.class);

    private final String name;
    private final MongoClient client;
    private final MongoDatabase database;

    public MongoSchemaBackend(String name, MongoClient client, MongoDatabase database) {
        this.name = name;
        this.client = client;
        this.database = database;
    }

    /**
     * Connects and pings the configured database.
     *
     * @throws BackendConnectionException if the server cannot be reached
     */
    public static MongoSchemaBackend connect(String name, DbConfig config) throws BackendConnectionException {
        if (config.database() == null || config.database().isBlank()) {
            throw new BackendConnectionException(name,
                    new IllegalArgumentException("A database name is required for MongoDB"));
        }

        MongoClient client = MongoClients.create(config.url());
        try {
            MongoDatabase database = client.getDatabase(config.database());
            database.runCommand(new Document("ping", 1));
            logger.info("Connected to '{}' (MONGODB, database {})", name, config.database());
            return new MongoSchemaBackend(name, client, database);
        } catch (MongoException e) {
            client.close();
            throw new BackendConnectionException(name, e);
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public BackendVariant variant() {
        return BackendVariant.DOCUMENT_STORE;
    }

    @Override
    public List<String> listObjects(ObjectKind kind)
            throws UnsupportedBackendOperationException, BackendConnectionException {
        if (kind != ObjectKind.TABLE) {
            throw unsupported("list " + kind.label() + " objects");
        }
        try {
            List<String> collections = new ArrayList<>();
            for (String collection : database.listCollectionNames()) {
                if (!collection.equals(SYNC_LOG_NAME) && !collection.startsWith("system.")) {
                    collections.add(collection);
                }
            }
            return collections;
        } catch (MongoException e) {
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
        Document document = new Document("object_type", entry.objectType().label())
                .append("object_name", entry.objectName())
                .append("action", entry.action().label())
                .append("source_code_hash", entry.sourceCodeHash())
                .append("sync_direction", entry.syncDirection())
                .append("original_state", entry.originalState())
                .append("new_state", entry.newState())
                .append("rollback_action", entry.rollbackAction())
                .append("timestamp", Date.from(entry.timestamp()));
        try {
            logCollection().insertOne(document);
        } catch (MongoException e) {
            throw new LogWriteException(entry.ref(), e);
        }
    }

    @Override
    public Optional<SyncLogEntry> latestLogEntry(SchemaObjectRef ref) throws BackendConnectionException {
        try {
            Document latest = logCollection()
                    .find(Filters.and(
                            Filters.eq("object_type", ref.kind().label()),
                            Filters.eq("object_name", ref.name())))
                    .sort(Sorts.descending("timestamp", "_id"))
                    .first();
            return Optional.ofNullable(latest).map(MongoSchemaBackend::toEntry);
        } catch (MongoException e) {
            throw new BackendConnectionException(name, e);
        }
    }

    @Override
    public void close() {
        if (client != null) {
            client.close();
        }
    }

    private MongoCollection<Document> logCollection() {
        return database.getCollection(SYNC_LOG_NAME);
    }

    private static SyncLogEntry toEntry(Document document) {
        return new SyncLogEntry(
                ObjectKind.fromLabel(document.getString("object_type")),
                document.getString("object_name"),
                SyncAction.fromLabel(document.getString("action")),
                document.getString("source_code_hash"),
                document.getString("sync_direction"),
                document.getString("original_state"),
                document.getString("new_state"),
                document.getString("rollback_action"),
                document.getDate("timestamp").toInstant());
    }

    private static UnsupportedBackendOperationException unsupported(String operation) {
        return new UnsupportedBackendOperationException(BackendVariant.DOCUMENT_STORE, operation);
    }
}
