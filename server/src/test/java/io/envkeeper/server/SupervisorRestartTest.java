package io.envkeeper.server;

import io.envkeeper.core.EventKind;
import io.envkeeper.core.SessionKind;
import io.envkeeper.core.SessionState;
import io.envkeeper.core.SupervisorEvent;
import io.envkeeper.server.driver.DriverRegistry;
import io.envkeeper.server.recovery.RecoveryCoordinator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class SupervisorRestartTest {

    @TempDir Path dir;

    private Supervisor openWith(FakeDriver driver) {
        var drivers = new DriverRegistry().register(SessionKind.OTHER, driver);
        return new Supervisor(TestConfigs.manualProbes(dir), drivers, null).open();
    }

    private static List<EventKind> kinds(List<SupervisorEvent> events) {
        return events.stream().map(SupervisorEvent::kind).toList();
    }

    @Test
    void live_sessions_are_recovered_and_history_continues_after_restart() {
        String live;
        String gone;
        String snap;
        try (Supervisor first = openWith(new FakeDriver())) {
            live = first.createSession(SessionKind.OTHER, Map.of("command", "sleep 1000")).sessionId();
            gone = first.createSession(SessionKind.OTHER, Map.of()).sessionId();
            snap = first.captureSnapshot(live);
            first.teardownSession(gone);
        }

        FakeDriver driver = new FakeDriver();
        try (Supervisor second = openWith(driver)) {
            Await.until("live session recovered", () -> second.getSession(live).state() == SessionState.RUNNING);

            var s = second.getSession(live);
            assertEquals(snap, s.lastSnapshotRef());
            assertEquals("sleep 1000", s.config().get("command"));
            assertEquals(SessionState.TERMINATED, second.getSession(gone).state());

            var events = second.events(live, 0);
            assertEquals(List.of(EventKind.STARTED, EventKind.SNAPSHOT_CAPTURED,
                    EventKind.DEGRADED, EventKind.LOST, EventKind.RECOVERED), kinds(events));
            for (int i = 0; i < events.size(); i++) {
                assertEquals(i + 1L, events.get(i).eventId());
            }
            assertEquals(Supervisor.RESTART_DETAIL, events.get(2).detail());
            assertEquals(1, driver.restores.get());

            assertEquals(List.of(EventKind.STARTED, EventKind.TERMINATED), kinds(second.events(gone, 0)));
            assertEquals("sess-3", second.createSession(SessionKind.OTHER, Map.of()).sessionId());
        }
    }

    @Test
    void a_live_session_without_snapshot_cannot_be_recovered() {
        String id;
        try (Supervisor first = openWith(new FakeDriver())) {
            id = first.createSession(SessionKind.OTHER, Map.of()).sessionId();
        }
        try (Supervisor second = openWith(new FakeDriver())) {
            Await.until("terminal failure", () -> second.getSession(id).state() == SessionState.TERMINAL_FAILURE);
            var events = second.events(id, 0);
            assertEquals(EventKind.TERMINAL_FAILURE, events.get(events.size() - 1).kind());
        }
    }

    @Test
    void reopening_twice_does_not_duplicate_events() {
        String id;
        try (Supervisor first = openWith(new FakeDriver())) {
            id = first.createSession(SessionKind.OTHER, Map.of()).sessionId();
            first.captureSnapshot(id);
        }
        try (Supervisor second = openWith(new FakeDriver())) {
            Await.until("recovered", () -> second.getSession(id).state() == SessionState.RUNNING);
        }
        try (Supervisor third = openWith(new FakeDriver())) {
            Await.until("recovered again", () -> third.getSession(id).state() == SessionState.RUNNING);
            var events = third.events(id, 0);
            assertEquals(8, events.size());
            for (int i = 0; i < events.size(); i++) {
                assertEquals(i + 1L, events.get(i).eventId());
            }
        }
    }

    @Test
    void close_lets_a_running_recovery_attempt_finish() throws Exception {
        List<LogRecord> severe = new CopyOnWriteArrayList<>();
        Handler collect = new Handler() {
            @Override
            public void publish(LogRecord r) {
                if (r.getLevel().intValue() >= Level.SEVERE.intValue()) severe.add(r);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        Logger recoveryLog = Logger.getLogger(RecoveryCoordinator.class.getName());
        recoveryLog.addHandler(collect);

        String id;
        try {
            FakeDriver driver = new FakeDriver();
            CountDownLatch release = new CountDownLatch(1);
            Supervisor first = openWith(driver);
            id = first.createSession(SessionKind.OTHER, Map.of()).sessionId();
            first.captureSnapshot(id);

            driver.restoreGate = release;
            driver.healthy = false;
            for (int i = 0; i < 3; i++) {
                first.monitor().probeOnce(id);
            }
            Await.until("restore in progress", () -> driver.restores.get() == 1);

            Thread releaser = new Thread(() -> {
                try {
                    Thread.sleep(300);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                release.countDown();
            });
            releaser.start();
            first.close();
            releaser.join();
        } finally {
            recoveryLog.removeHandler(collect);
        }
        assertEquals(List.of(), severe);

        try (Supervisor second = openWith(new FakeDriver())) {
            assertEquals(List.of(EventKind.STARTED, EventKind.SNAPSHOT_CAPTURED, EventKind.DEGRADED,
                    EventKind.LOST, EventKind.RECOVERED), kinds(second.events(id, 0)).subList(0, 5));
        }
    }
}
