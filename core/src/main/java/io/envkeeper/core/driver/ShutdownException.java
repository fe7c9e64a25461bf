package io.envkeeper.core.driver;

/** Driver failed to stop. */
public class ShutdownException extends DriverException {

    public ShutdownException(String message) {
        super(message);
    }

    public ShutdownException(String message, Throwable cause) {
        super(message, cause);
    }
}
