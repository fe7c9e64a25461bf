package io.envkeeper.core.driver;

/** Driver failed to restore state. */
public class RestoreException extends DriverException {

    public RestoreException(String message) {
        super(message);
    }

    public RestoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
