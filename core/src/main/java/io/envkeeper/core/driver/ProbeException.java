package io.envkeeper.core.driver;

/**
 * Health check raised an error instead of answering.
 * The monitor counts it exactly like an UNRESPONSIVE result.
 */
public class ProbeException extends DriverException {

    public ProbeException(String message) {
        super(message);
    }

    public ProbeException(String message, Throwable cause) {
        super(message, cause);
    }
}
