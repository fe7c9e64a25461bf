package io.envkeeper.core.driver;

/**
 * Base type for failures that originate in an environment driver call.
 * <p>
 * Checked on purpose: every adapter call site has to decide whether the
 * failure drives a state transition (probing, recovery) or is surfaced to the
 * agent (create, capture).
 */
public abstract class DriverException extends Exception {

    protected DriverException(String message) {
        super(message);
    }

    protected DriverException(String message, Throwable cause) {
        super(message, cause);
    }
}
