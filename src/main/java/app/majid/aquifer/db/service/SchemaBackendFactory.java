package app.majid.aquifer.db.service;

import app.majid.aquifer.db.config.DbConfig;
import app.majid.aquifer.db.config.DbType;
import app.majid.aquifer.db.dialect.H2Dialect;
import app.majid.aquifer.db.dialect.MySqlDialect;
import app.majid.aquifer.db.dialect.OracleDialect;
import app.majid.aquifer.db.dialect.PostgresDialect;
import app.majid.aquifer.db.dialect.SqlDialect;
import app.majid.aquifer.db.dialect.SqlServerDialect;
import app.majid.aquifer.db.document.MongoSchemaBackend;
import app.majid.aquifer.db.graph.Neo4jSchemaBackend;
import app.majid.aquifer.synchronizer.db.SchemaBackend;
import app.majid.aquifer.synchronizer.exception.BackendConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Opens a {@link SchemaBackend} for a configured database. Every call opens a new connection
 * owned by the caller. Only target connections prepare the sync log.
 */
@Component
public class SchemaBackendFactory {

    private static final Logger logger = LoggerFactory.getLogger(SchemaBackendFactory.class);

    /**
     * Opens a target, creating its sync log when the product needs one up front.
     */
    public SchemaBackend open(String name, DbConfig config) throws BackendConnectionException {
        logger.debug("Opening target '{}' with {}", name, config);
        return connect(name, config, true);
    }

    /**
     * Opens the source. Nothing is created on it; document and graph stores only write their
     * sync log on the first append, which never happens on a source.
     */
    public SchemaBackend openSource(String name, DbConfig config) throws BackendConnectionException {
        logger.debug("Opening source '{}' with {}", name, config);
        return connect(name, config, false);
    }

    private SchemaBackend connect(String name, DbConfig config, boolean bootstrapLog)
            throws BackendConnectionException {
        return switch (config.type()) {
            case MYSQL, POSTGRESQL, SQLSERVER, ORACLE, H2 ->
                    JdbcSchemaBackend.connect(name, config, dialectFor(config.type()), bootstrapLog);
            case MONGODB -> MongoSchemaBackend.connect(name, config);
            case NEO4J -> Neo4jSchemaBackend.connect(name, config);
        };
    }

    static SqlDialect dialectFor(DbType type) {
        return switch (type) {
            case MYSQL -> new MySqlDialect();
            case POSTGRESQL -> new PostgresDialect();
            case SQLSERVER -> new SqlServerDialect();
            case ORACLE -> new OracleDialect();
            case H2 -> new H2Dialect();
            case MONGODB, NEO4J -> throw new IllegalArgumentException(type + " is not a relational database");
        };
    }
}
