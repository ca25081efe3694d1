package app.majid.aquifer.synchronizer.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of diffing one object: the ordered changes to apply (empty for a no-op) and any
 * informational notices raised along the way, such as a missing table when creation is disabled.
 */
public record ObjectDiff(
        SchemaObjectRef ref,
        List<DiffResult> changes,
        List<String> notices
) {

    public ObjectDiff {
        Objects.requireNonNull(ref, "ref");
        changes = List.copyOf(changes);
        notices = List.copyOf(notices);
    }

    public static ObjectDiff noOp(SchemaObjectRef ref) {
        return new ObjectDiff(ref, List.of(), List.of());
    }

    public static ObjectDiff noOp(SchemaObjectRef ref, String notice) {
        return new ObjectDiff(ref, List.of(), List.of(notice));
    }

    public static ObjectDiff of(SchemaObjectRef ref, DiffResult change) {
        return new ObjectDiff(ref, List.of(change), List.of());
    }

    public boolean isNoOp() {
        return changes.isEmpty();
    }
}
