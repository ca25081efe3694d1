package app.majid.aquifer.db.config;

import app.majid.aquifer.synchronizer.db.BackendVariant;

/**
 * Database engines a source or target can be.
 */
public enum DbType {
    MYSQL(BackendVariant.RELATIONAL),
    POSTGRESQL(BackendVariant.RELATIONAL),
    SQLSERVER(BackendVariant.RELATIONAL),
    ORACLE(BackendVariant.RELATIONAL),
    H2(BackendVariant.RELATIONAL),
    MONGODB(BackendVariant.DOCUMENT_STORE),
    NEO4J(BackendVariant.GRAPH_STORE);

    private final BackendVariant variant;

    DbType(BackendVariant variant) {
        this.variant = variant;
    }

    public BackendVariant variant() {
        return variant;
    }
}
