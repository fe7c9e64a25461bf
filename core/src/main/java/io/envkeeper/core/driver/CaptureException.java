package io.envkeeper.core.driver;

/** Driver failed to capture state. */
public class CaptureException extends DriverException {

    public CaptureException(String message) {
        super(message);
    }

    public CaptureException(String message, Throwable cause) {
        super(message, cause);
    }
}
