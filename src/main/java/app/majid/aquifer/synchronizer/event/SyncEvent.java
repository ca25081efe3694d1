package app.majid.aquifer.synchronizer.event;

import app.majid.aquifer.synchronizer.model.ErrorKind;
import app.majid.aquifer.synchronizer.model.SchemaObjectRef;

/**
 * Something worth reporting that happened while synchronizing or rolling back an object.
 *
 * @param target    name of the backend the event concerns
 * @param ref       object concerned, {@code null} for target-level events
 * @param errorKind set for failures only
 */
public record SyncEvent(
        Severity severity,
        String target,
        SchemaObjectRef ref,
        ErrorKind errorKind,
        String message
) {

    public static SyncEvent info(String target, SchemaObjectRef ref, String message) {
        return new SyncEvent(Severity.INFO, target, ref, null, message);
    }

    public static SyncEvent warn(String target, SchemaObjectRef ref, ErrorKind errorKind, String message) {
        return new SyncEvent(Severity.WARN, target, ref, errorKind, message);
    }

    public static SyncEvent error(String target, SchemaObjectRef ref, ErrorKind errorKind, String message) {
        return new SyncEvent(Severity.ERROR, target, ref, errorKind, message);
    }

    public static SyncEvent severe(String target, SchemaObjectRef ref, ErrorKind errorKind, String message) {
        return new SyncEvent(Severity.SEVERE, target, ref, errorKind, message);
    }

    public static SyncEvent critical(String target, SchemaObjectRef ref, ErrorKind errorKind, String message) {
        return new SyncEvent(Severity.CRITICAL, target, ref, errorKind, message);
    }
}
