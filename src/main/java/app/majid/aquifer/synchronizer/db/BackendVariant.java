package app.majid.aquifer.synchronizer.db;

public enum BackendVariant {
    RELATIONAL,
    DOCUMENT_STORE,
    GRAPH_STORE
}
