package io.envkeeper.core.driver;

/** Driver failed to start. */
public class StartupException extends DriverException {

    public StartupException(String message) {
        super(message);
    }

    public StartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
