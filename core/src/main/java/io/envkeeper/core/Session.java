// file: src/main/java/io/envkeeper/core/Session.java
package io.envkeeper.core;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable view of one supervised environment session.
 * <p>
 * Fields:
 *  - sessionId:          durable id ("sess-&lt;n&gt;"), never reused.
 *  - kind:               which driver owns the live resources.
 *  - state:              lifecycle state, see {@link SessionState}.
 *  - lastSnapshotRef:    id of the last captured snapshot, or null.
 *  - createdAtMillis:    creation time (epoch millis).
 *  - lastHealthAtMillis: time of the last probe, 0 when never probed.
 *  - config:             driver start configuration.
 *  - version:            per-session mutation counter; bumped on every persisted change.
 *  - detail:             human-readable detail of the last transition (may be null).
 * <p>
 * The live driver handle is deliberately not part of this value: the registry
 * keeps it next to the session, never inside the persisted record.
 */
public record Session(
        String sessionId,
        SessionKind kind,
        SessionState state,
        String lastSnapshotRef,
        long createdAtMillis,
        long lastHealthAtMillis,
        Map<String, String> config,
        long version,
        String detail
) {
    public Session {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(state, "state");
        config = config == null ? Map.of() : Map.copyOf(config);
    }

    /** Fresh session in STARTING, version 1. */
    public static Session starting(String sessionId, SessionKind kind, Map<String, String> config, long nowMillis) {
        return new Session(sessionId, kind, SessionState.STARTING, null, nowMillis, 0L, config, 1L, null);
    }

    /**
     * Return a copy in state {@code next}, with bumped version.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public Session transitionTo(SessionState next, String newDetail) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "illegal transition %s -> %s for %s".formatted(state, next, sessionId));
        }
        return new Session(sessionId, kind, next, lastSnapshotRef, createdAtMillis,
                lastHealthAtMillis, config, version + 1, newDetail);
    }

    public Session withSnapshotRef(String snapshotId) {
        return new Session(sessionId, kind, state, snapshotId, createdAtMillis,
                lastHealthAtMillis, config, version + 1, detail);
    }

    /** Probe timestamps are not a persisted mutation on their own, so the version stays. */
    public Session withLastHealthAt(long millis) {
        return new Session(sessionId, kind, state, lastSnapshotRef, createdAtMillis,
                millis, config, version, detail);
    }

    public boolean isActive() {
        return !state.isTerminal();
    }
}
