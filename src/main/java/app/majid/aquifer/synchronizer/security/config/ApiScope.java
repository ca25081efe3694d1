package app.majid.aquifer.synchronizer.security.config;

import java.util.Locale;

/**
 * Operations an API token may call.
 */
public enum ApiScope {
    /** Run and cancel synchronizations. */
    SYNC,
    /** Roll back logged changes on targets. */
    ROLLBACK;

    public String authority() {
        return "SCOPE_" + name().toLowerCase(Locale.ROOT);
    }
}
