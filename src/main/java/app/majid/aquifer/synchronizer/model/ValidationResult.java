package app.majid.aquifer.synchronizer.model;

/**
 * Outcome of running candidate statements inside a test transaction.
 *
 * @param rejectedStatement first statement that failed, {@code null} when valid
 * @param error             error reported by the backend, {@code null} when valid
 */
public record ValidationResult(
        boolean valid,
        String rejectedStatement,
        String error
) {

    private static final ValidationResult VALID = new ValidationResult(true, null, null);

    public static ValidationResult accepted() {
        return VALID;
    }

    public static ValidationResult rejected(String statement, String error) {
        return new ValidationResult(false, statement, error);
    }
}
