package app.majid.aquifer.common.constants;

/**
 * Constants shared by the synchronization engine and the backends.
 */
public final class SyncConstants {

    private SyncConstants() {
        throw new AssertionError("Cannot instantiate constants class");
    }

    public static final String SYNC_LOG_NAME = "sync_log";
    public static final String SYNC_LOG_LABEL = "SyncLog";
    public static final String SYNC_DIRECTION_SOURCE_TO_TARGET = "source_to_target";
    public static final String OBJECT_SELECTOR_SEPARATOR = ":";
    public static final String SOURCE_NAME = "source";
}
