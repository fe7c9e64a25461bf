package io.envkeeper.storage;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BoundedEmissionDeduperTest {

    @Test
    void first_time_is_true_once_per_key() {
        var d = new BoundedEmissionDeduper(16);
        assertTrue(d.firstTime("sess-1@3"));
        assertFalse(d.firstTime("sess-1@3"));
        assertTrue(d.firstTime("sess-1@4"));
    }

    @Test
    void remembered_keys_are_not_first_time() {
        var d = new BoundedEmissionDeduper(16);
        d.remember("sess-2@7");
        assertFalse(d.firstTime("sess-2@7"));
    }

    @Test
    void oldest_keys_are_evicted_past_capacity() {
        var d = new BoundedEmissionDeduper(2);
        d.remember("a");
        d.remember("b");
        d.remember("c");
        assertEquals(2, d.size());
        assertTrue(d.firstTime("a"));
        assertFalse(d.firstTime("c"));
    }

    @Test
    void a_forgotten_key_is_first_time_again() {
        var d = new BoundedEmissionDeduper(16);
        assertTrue(d.firstTime("sess-1@2:started"));
        d.forget("sess-1@2:started");
        assertTrue(d.firstTime("sess-1@2:started"));
        assertFalse(d.firstTime("sess-1@2:started"));
    }
}
