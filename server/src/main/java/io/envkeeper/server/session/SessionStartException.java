package io.envkeeper.server.session;

/**
 * Driver start failed twice for a freshly allocated session. The session stays
 * in the registry as {@code failed}, so its id is reported here.
 */
public class SessionStartException extends RuntimeException {
    private final String sessionId;

    public SessionStartException(String sessionId, Throwable cause) {
        super("session " + sessionId + " failed to start: " + cause.getMessage(), cause);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
