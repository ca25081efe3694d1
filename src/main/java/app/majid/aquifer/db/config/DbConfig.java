package app.majid.aquifer.db.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration for a single database connection.
 *
 * @param url             JDBC URL for relational engines, connection string for MongoDB, bolt/neo4j URI for Neo4j
 * @param driverClassName optional JDBC driver class, resolved from the URL when absent
 * @param database        database name for MongoDB and Neo4j, ignored by relational engines
 * @param schema          schema to introspect for relational engines, the connection's current schema when absent
 */
public record DbConfig(
        @NotNull(message = "Database type is required")
        DbType type,

        @NotBlank(message = "Database URL is required")
        String url,

        String username,

        String password,

        String driverClassName,

        String database,

        String schema
) {

    @Override
    public String toString() {
        // Keep credentials out of logs
        return "DbConfig[type=%s, url=%s, username=%s, database=%s, schema=%s]"
                .formatted(type, url, username, database, schema);
    }
}
