package io.envkeeper.core;

import java.util.Locale;

/** Tag of a {@link SupervisorEvent}. */
public enum EventKind {
    STARTED,
    START_FAILED,
    DEGRADED,
    LOST,
    RECOVERED,
    TERMINAL_FAILURE,
    SNAPSHOT_CAPTURED,
    TERMINATED,
    STOP_FAILED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EventKind fromWire(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("event kind must not be empty");
        }
        return EventKind.valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
