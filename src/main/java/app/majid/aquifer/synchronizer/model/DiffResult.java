package app.majid.aquifer.synchronizer.model;

import java.util.Objects;

/**
 * One computed, not yet applied change for an object.
 *
 * @param action        what the change does to the target
 * @param change        the forward change
 * @param rollback      the inverse change recorded for rollback
 * @param originalState the target's definition before the change, {@code null} if the object is absent
 * @param newState      the definition the target is expected to hold after the change
 */
public record DiffResult(
        SyncAction action,
        SchemaChange change,
        SchemaChange rollback,
        ObjectDefinition originalState,
        ObjectDefinition newState
) {

    public DiffResult {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(change, "change");
        Objects.requireNonNull(rollback, "rollback");
        Objects.requireNonNull(newState, "newState");
    }

    public SchemaObjectRef ref() {
        return change.target();
    }
}
