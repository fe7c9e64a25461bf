// file: src/main/java/io/envkeeper/core/SupervisorEvent.java
package io.envkeeper.core;

import java.util.Objects;

/**
 * A single fact about a session's lifecycle.
 * <p>
 * Ordering: eventId starts at 1 for each session and increases by exactly one
 * per emitted event. There is no ordering across sessions.
 * <p>
 * The agent-wide "global" run state uses {@link #GLOBAL_SESSION_ID} as its session id.
 */
public record SupervisorEvent(
        long eventId,
        String sessionId,
        EventKind kind,
        long occurredAtMillis,
        String detail
) {
    public static final String GLOBAL_SESSION_ID = "global";

    public SupervisorEvent {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(kind, "kind");
        if (eventId <= 0) {
            throw new IllegalArgumentException("eventId must be > 0, got " + eventId);
        }
        detail = detail == null ? "" : detail;
    }
}
