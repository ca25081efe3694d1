package app.majid.aquifer.synchronizer.event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every event it receives, for assertions.
 */
public class RecordingSyncEventListener implements SyncEventListener {

    private final List<SyncEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(SyncEvent event) {
        events.add(event);
    }

    public List<SyncEvent> events() {
        return List.copyOf(events);
    }

    public List<SyncEvent> withSeverity(Severity severity) {
        return events.stream().filter(e -> e.severity() == severity).toList();
    }
}
