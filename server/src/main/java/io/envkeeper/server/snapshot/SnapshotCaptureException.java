package io.envkeeper.server.snapshot;

/** State could not be captured; nothing was stored and the session is unchanged. */
public class SnapshotCaptureException extends RuntimeException {
    private final String sessionId;

    public SnapshotCaptureException(String sessionId, Throwable cause) {
        super("capture of " + sessionId + " failed: " + cause.getMessage(), cause);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
