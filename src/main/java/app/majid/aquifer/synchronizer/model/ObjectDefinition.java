package app.majid.aquifer.synchronizer.model;

/**
 * Snapshot of an object's current shape, read fresh from a backend.
 */
public interface ObjectDefinition {

    SchemaObjectRef ref();
}
