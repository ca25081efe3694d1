package app.majid.aquifer.synchronizer.event;

/**
 * Process-wide sink for synchronization events. A single instance is created at startup and
 * handed to every engine component; implementations must be safe for concurrent use, since
 * targets are synchronized in parallel.
 */
public interface SyncEventListener {

    void onEvent(SyncEvent event);
}
