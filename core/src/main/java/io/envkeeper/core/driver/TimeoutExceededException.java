package io.envkeeper.core.driver;

import java.time.Duration;

/**
 * Supervisor-side deadline expired while waiting for a driver call.
 * <p>
 * Callers treat it exactly like the driver's own failure for the same
 * operation; the call itself is left to finish on its worker thread.
 */
public class TimeoutExceededException extends DriverException {
    private final String operation;
    private final Duration timeout;

    public TimeoutExceededException(String operation, Duration timeout) {
        super(operation + " exceeded " + timeout.toMillis() + "ms");
        this.operation = operation;
        this.timeout = timeout;
    }

    public String operation() {
        return operation;
    }

    public Duration timeout() {
        return timeout;
    }
}
