package app.majid.aquifer.synchronizer.event;

public enum Severity {
    INFO,
    WARN,
    ERROR,
    /** A statement failed after validation; the target may match neither its old nor its new shape. */
    SEVERE,
    /** A change was applied but can no longer be rolled back. */
    CRITICAL
}
