package app.majid.aquifer.synchronizer.model;

import java.util.Locale;

public enum SyncAction {
    CREATE,
    ALTER,
    SYNC;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SyncAction fromLabel(String label) {
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
