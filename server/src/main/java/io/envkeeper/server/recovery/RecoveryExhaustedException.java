package io.envkeeper.server.recovery;

/**
 * Every restore attempt for a lost session failed. Terminal for that session;
 * the message becomes the detail of its {@code terminal_failure} event.
 */
public class RecoveryExhaustedException extends Exception {
    private final String sessionId;
    private final int attempts;

    public RecoveryExhaustedException(String sessionId, int attempts, Throwable lastError) {
        super("recovery of " + sessionId + " gave up after " + attempts + " attempt(s)"
                + (lastError == null ? "" : ": " + lastError.getMessage()), lastError);
        this.sessionId = sessionId;
        this.attempts = attempts;
    }

    public String sessionId() {
        return sessionId;
    }

    public int attempts() {
        return attempts;
    }
}
