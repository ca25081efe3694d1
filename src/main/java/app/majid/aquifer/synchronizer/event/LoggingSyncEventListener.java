package app.majid.aquifer.synchronizer.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.springframework.stereotype.Component;

/**
 * Default event sink writing every event to the application log.
 * Severe and critical events carry the {@code TARGET_INCONSISTENT} and {@code SYNC_LOG_LOST} markers
 * so they can be routed to a separate appender.
 */
@Component
public class LoggingSyncEventListener implements SyncEventListener {

    private static final Logger logger = LoggerFactory.getLogger(LoggingSyncEventListener.class);

    static final Marker INCONSISTENT_MARKER = MarkerFactory.getMarker("TARGET_INCONSISTENT");
    static final Marker LOG_LOST_MARKER = MarkerFactory.getMarker("SYNC_LOG_LOST");

    @Override
    public void onEvent(SyncEvent event) {
        String object = event.ref() == null ? "-" : event.ref().toString();
        switch (event.severity()) {
            case INFO -> logger.info("[{}] {}: {}", event.target(), object, event.message());
            case WARN -> logger.warn("[{}] {} ({}): {}", event.target(), object, event.errorKind(), event.message());
            case ERROR -> logger.error("[{}] {} ({}): {}", event.target(), object, event.errorKind(), event.message());
            case SEVERE -> logger.error(INCONSISTENT_MARKER, "[{}] {} ({}): {}",
                    event.target(), object, event.errorKind(), event.message());
            case CRITICAL -> logger.error(LOG_LOST_MARKER, "[{}] {} ({}): {}",
                    event.target(), object, event.errorKind(), event.message());
        }
    }
}
