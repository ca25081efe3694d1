package app.majid.aquifer.synchronizer.model;

import java.util.Locale;

/**
 * Kinds of schema objects the engine knows how to synchronize and roll back.
 * {@link #INDEX} is only produced by the table pass when index synchronization is enabled.
 */
public enum ObjectKind {
    TABLE,
    VIEW,
    PROCEDURE,
    INDEX;

    /**
     * Lower-case label used in selectors, ignore patterns and the sync log.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ObjectKind fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Object kind cannot be null or empty");
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported object kind: " + label, e);
        }
    }
}
