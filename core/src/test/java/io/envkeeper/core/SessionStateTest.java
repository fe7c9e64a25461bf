package io.envkeeper.core;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lifecycle table checks: we describe the allowed moves, then assert them.
 */
class SessionStateTest {

    @Test
    void monitor_path_running_degraded_lost_is_allowed() {
        assertTrue(SessionState.RUNNING.canTransitionTo(SessionState.DEGRADED));
        assertTrue(SessionState.DEGRADED.canTransitionTo(SessionState.RUNNING));
        assertTrue(SessionState.DEGRADED.canTransitionTo(SessionState.LOST));
        assertTrue(SessionState.LOST.canTransitionTo(SessionState.RUNNING));
        assertTrue(SessionState.LOST.canTransitionTo(SessionState.TERMINAL_FAILURE));
    }

    @Test
    void running_never_jumps_straight_to_lost() {
        // a single missed probe only degrades; loss always goes through DEGRADED
        assertFalse(SessionState.RUNNING.canTransitionTo(SessionState.LOST));
    }

    @Test
    void every_non_terminal_state_can_be_torn_down() {
        for (SessionState s : SessionState.values()) {
            if (!s.isTerminal()) {
                assertTrue(s.canTransitionTo(SessionState.TERMINATED), s + " -> TERMINATED");
            }
        }
    }

    @Test
    void terminal_states_are_absorbing() {
        for (SessionState s : new SessionState[]{
                SessionState.TERMINATED, SessionState.TERMINAL_FAILURE, SessionState.FAILED}) {
            assertTrue(s.isTerminal());
            assertTrue(s.successors().isEmpty(), s + " must have no successors");
        }
    }

    @Test
    void session_transition_bumps_version_and_rejects_illegal_moves() {
        Session s = Session.starting("sess-1", SessionKind.BROWSER, Map.of("url", "about:blank"), 1000L);
        assertEquals(1L, s.version());

        Session running = s.transitionTo(SessionState.RUNNING, "started");
        assertEquals(SessionState.RUNNING, running.state());
        assertEquals(2L, running.version());
        assertEquals("about:blank", running.config().get("url"));

        assertThrows(IllegalStateException.class, () -> running.transitionTo(SessionState.LOST, "nope"));
        assertThrows(IllegalStateException.class,
                () -> running.transitionTo(SessionState.TERMINATED, null)
                        .transitionTo(SessionState.RUNNING, null));
    }

    @Test
    void health_timestamp_is_not_a_versioned_mutation() {
        Session s = Session.starting("sess-2", SessionKind.OTHER, null, 1L)
                .transitionTo(SessionState.RUNNING, null);
        Session probed = s.withLastHealthAt(42L);
        assertEquals(s.version(), probed.version());
        assertEquals(42L, probed.lastHealthAtMillis());
        assertTrue(probed.config().isEmpty());
    }

    @Test
    void wire_names_roundtrip_case_insensitively() {
        assertEquals(SessionKind.NOTEBOOK, SessionKind.fromWire("Notebook"));
        assertEquals("terminal_failure", SessionState.TERMINAL_FAILURE.wireName());
        assertEquals(SessionState.TERMINAL_FAILURE, SessionState.fromWire("terminal_failure"));
        assertEquals(EventKind.SNAPSHOT_CAPTURED, EventKind.fromWire("snapshot_captured"));
        assertThrows(IllegalArgumentException.class, () -> SessionKind.fromWire("toaster"));
        assertThrows(IllegalArgumentException.class, () -> SessionKind.fromWire(" "));
    }
}
