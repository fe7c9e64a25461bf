package io.envkeeper.server;

import io.envkeeper.core.EventKind;
import io.envkeeper.core.SessionKind;
import io.envkeeper.core.SessionState;
import io.envkeeper.core.SupervisorEvent;
import io.envkeeper.server.driver.AdapterInvoker;
import io.envkeeper.server.driver.DriverRegistry;
import io.envkeeper.server.events.EventNotifier;
import io.envkeeper.server.events.FlakyEventLog;
import io.envkeeper.server.session.SessionEntry;
import io.envkeeper.server.session.SessionRegistry;
import io.envkeeper.storage.BoundedEmissionDeduper;
import io.envkeeper.storage.CheckpointPolicy;
import io.envkeeper.storage.FileEventLog;
import io.envkeeper.storage.FileSessionJournal;
import io.envkeeper.storage.FileSessionTableCheckpointer;
import io.envkeeper.storage.FileWal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/** Session mutations whose event cannot be written to the event log. */
class SessionEmissionFailureTest {

    @TempDir Path dir;

    private final FakeDriver driver = new FakeDriver();
    private Stack stack;

    /** Registry wired over files in {@code dir}, with an event log that can be made to fail. */
    private final class Stack implements AutoCloseable {
        final FileSessionJournal journal = new FileSessionJournal(
                new FileWal(dir.resolve("journal"), 1L << 20),
                new FileSessionTableCheckpointer(dir.resolve("table")),
                new CheckpointPolicy(100));
        final FlakyEventLog eventLog = new FlakyEventLog(
                new FileEventLog(new FileWal(dir.resolve("events"), 1L << 20)));
        final AdapterInvoker invoker = new AdapterInvoker();
        final EventNotifier notifier = new EventNotifier(eventLog, new BoundedEmissionDeduper(64), Clock.systemUTC());
        final SessionRegistry registry = new SessionRegistry(journal,
                new DriverRegistry().register(SessionKind.OTHER, driver),
                invoker, Duration.ofSeconds(2), notifier, Clock.systemUTC());

        @Override
        public void close() {
            invoker.close();
            journal.close();
            eventLog.close();
            notifier.close();
        }
    }

    @AfterEach
    void closeStack() {
        if (stack != null) {
            stack.close();
        }
    }

    private Stack reopen() {
        if (stack != null) {
            stack.close();
        }
        stack = new Stack();
        return stack;
    }

    private static List<EventKind> kinds(List<SupervisorEvent> events) {
        return events.stream().map(SupervisorEvent::kind).toList();
    }

    @Test
    void a_start_that_cannot_be_logged_stops_the_environment_and_owes_its_event() {
        Stack first = reopen();
        first.eventLog.failing = true;

        assertThrows(UncheckedIOException.class, () -> first.registry.create(SessionKind.OTHER, Map.of()));
        assertEquals(1, driver.stops.get());
        assertEquals(List.of(), first.notifier.events("sess-1", 0));

        first.eventLog.failing = false;
        first.registry.settleOwedEvents();
        var events = first.notifier.events("sess-1", 0);
        assertEquals(List.of(EventKind.STARTED), kinds(events));
        assertEquals(1L, events.get(0).eventId());

        // the journal still owes the event; a restart must see it was already emitted
        Stack second = reopen();
        second.registry.settleOwedEvents();
        assertEquals(List.of(EventKind.STARTED), kinds(second.notifier.events("sess-1", 0)));
        assertEquals(SessionState.RUNNING, second.registry.get("sess-1").state());
    }

    @Test
    void an_owed_event_is_emitted_before_the_next_one_of_its_session() {
        Stack s = reopen();
        String id = s.registry.create(SessionKind.OTHER, Map.of());
        SessionEntry entry = s.registry.entry(id);

        entry.lock().lock();
        try {
            s.eventLog.failing = true;
            assertThrows(UncheckedIOException.class,
                    () -> s.registry.transition(entry, SessionState.DEGRADED, "unresponsive", EventKind.DEGRADED));
            assertEquals(SessionState.DEGRADED, entry.session().state());

            s.eventLog.failing = false;
            s.registry.transition(entry, SessionState.LOST, "3 consecutive failures", EventKind.LOST);
        } finally {
            entry.lock().unlock();
        }

        var events = s.notifier.events(id, 0);
        assertEquals(List.of(EventKind.STARTED, EventKind.DEGRADED, EventKind.LOST), kinds(events));
        assertEquals(List.of(1L, 2L, 3L), events.stream().map(SupervisorEvent::eventId).toList());
        assertEquals("unresponsive", events.get(1).detail());
    }

    @Test
    void a_failed_emission_does_not_suppress_its_retry_after_restart() {
        Stack first = reopen();
        String id = first.registry.create(SessionKind.OTHER, Map.of());
        SessionEntry entry = first.registry.entry(id);
        entry.lock().lock();
        try {
            first.eventLog.failing = true;
            assertThrows(UncheckedIOException.class,
                    () -> first.registry.transition(entry, SessionState.DEGRADED, "unresponsive", EventKind.DEGRADED));
        } finally {
            entry.lock().unlock();
        }

        Stack second = reopen();
        second.registry.settleOwedEvents();
        assertEquals(List.of(EventKind.STARTED, EventKind.DEGRADED), kinds(second.notifier.events(id, 0)));
        assertEquals(SessionState.DEGRADED, second.registry.get(id).state());
    }
}
