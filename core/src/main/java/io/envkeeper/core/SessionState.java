// file: src/main/java/io/envkeeper/core/SessionState.java
package io.envkeeper.core;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle state of a session.
 * <p>
 * Transition table:
 * <pre>
 *   STARTING -> RUNNING | FAILED | TERMINATED
 *   RUNNING  -> DEGRADED | TERMINATED
 *   DEGRADED -> RUNNING | LOST | TERMINATED
 *   LOST     -> RUNNING | TERMINAL_FAILURE | TERMINATED
 * </pre>
 * TERMINATED, TERMINAL_FAILURE and FAILED are absorbing.
 * <p>
 * Who drives what:
 *  - Health monitor: RUNNING <-> DEGRADED -> LOST.
 *  - Recovery coordinator: LOST -> RUNNING | TERMINAL_FAILURE.
 *  - Agent teardown: any non-terminal state -> TERMINATED.
 *  - Registry create: STARTING -> RUNNING | FAILED.
 */
public enum SessionState {
    STARTING,
    RUNNING,
    DEGRADED,
    LOST,
    TERMINATED,
    TERMINAL_FAILURE,
    FAILED;

    public boolean isTerminal() {
        return this == TERMINATED || this == TERMINAL_FAILURE || this == FAILED;
    }

    /** States the health monitor probes. */
    public boolean isProbed() {
        return this == RUNNING || this == DEGRADED;
    }

    public boolean canTransitionTo(SessionState next) {
        return successors().contains(next);
    }

    public Set<SessionState> successors() {
        return switch (this) {
            case STARTING -> EnumSet.of(RUNNING, FAILED, TERMINATED);
            case RUNNING -> EnumSet.of(DEGRADED, TERMINATED);
            case DEGRADED -> EnumSet.of(RUNNING, LOST, TERMINATED);
            case LOST -> EnumSet.of(RUNNING, TERMINAL_FAILURE, TERMINATED);
            case TERMINATED, TERMINAL_FAILURE, FAILED -> EnumSet.noneOf(SessionState.class);
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SessionState fromWire(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("session state must not be empty");
        }
        return SessionState.valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
