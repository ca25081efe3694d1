package app.majid.aquifer.synchronizer.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Append-only record of one applied change, carrying enough state to reverse it.
 *
 * @param originalState target definition before the change, {@code null} when the object did not exist
 * @param rollbackAction literal inverse statement; for {@link SyncAction#SYNC} it equals the original state
 */
public record SyncLogEntry(
        ObjectKind objectType,
        String objectName,
        SyncAction action,
        String sourceCodeHash,
        String syncDirection,
        String originalState,
        String newState,
        String rollbackAction,
        Instant timestamp
) {

    public SyncLogEntry {
        Objects.requireNonNull(objectType, "objectType");
        Objects.requireNonNull(objectName, "objectName");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(newState, "newState");
        Objects.requireNonNull(rollbackAction, "rollbackAction");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public SyncLogEntry withTimestamp(Instant stamped) {
        return new SyncLogEntry(objectType, objectName, action, sourceCodeHash, syncDirection,
                originalState, newState, rollbackAction, stamped);
    }

    public SchemaObjectRef ref() {
        return new SchemaObjectRef(objectType, objectName);
    }

    @Override
    public String toString() {
        return "SyncLogEntry[object=%s:%s, action=%s, timestamp=%s]"
                .formatted(objectType.label(), objectName, action.label(), timestamp);
    }
}
