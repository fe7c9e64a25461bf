package io.envkeeper.server;

import io.envkeeper.core.EventKind;
import io.envkeeper.core.SessionKind;
import io.envkeeper.core.SessionNotFoundException;
import io.envkeeper.core.Snapshot;
import io.envkeeper.core.SnapshotNotFoundException;
import io.envkeeper.core.SupervisorEvent;
import io.envkeeper.core.driver.StatePayload;
import io.envkeeper.server.driver.DriverRegistry;
import io.envkeeper.server.monitor.HealthMonitor.ProbeOutcome;
import io.envkeeper.server.snapshot.SnapshotCaptureException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotCaptureTest {

    @TempDir Path dir;

    private FakeDriver driver;
    private Supervisor sup;
    private final AtomicInteger memoryVersion = new AtomicInteger();

    @BeforeEach
    void open() {
        driver = new FakeDriver();
        var drivers = new DriverRegistry()
                .register(SessionKind.BROWSER, driver)
                .register(SessionKind.NOTEBOOK, new FakeDriver());
        sup = new Supervisor(TestConfigs.manualProbes(dir), drivers,
                () -> StatePayload.utf8("{\"memory\":" + memoryVersion.incrementAndGet() + "}", StatePayload.JSON)
        ).open();
    }

    @AfterEach
    void close() {
        sup.close();
    }

    @Test
    void capture_then_restore_returns_the_captured_payload() {
        String id = sup.createSession(SessionKind.BROWSER, Map.of()).sessionId();
        driver.state = "{\"tabs\":[\"https://example.org\"],\"cookies\":3}";

        String snapId = sup.captureSnapshot(id);
        Snapshot back = sup.restoreSnapshot(snapId);

        assertEquals(driver.state, new String(back.payload(), StandardCharsets.UTF_8));
        assertEquals(StatePayload.JSON, back.encoding());
        assertEquals(id, back.sessionId());
        assertEquals(snapId, sup.getSession(id).lastSnapshotRef());
    }

    @Test
    void successive_captures_form_a_chain_to_the_root() {
        String id = sup.createSession(SessionKind.BROWSER, Map.of()).sessionId();
        String a = sup.captureSnapshot(id);
        String b = sup.captureSnapshot(id); // same state, different parent
        driver.state = "{\"tabs\":[]}";
        String c = sup.captureSnapshot(id);

        assertNotEquals(a, b);
        var chain = sup.snapshotChain(c);
        assertEquals(List.of(c, b, a), chain.stream().map(m -> m.snapshotId).toList());
        assertNull(chain.get(2).parentSnapshotId);
    }

    @Test
    void global_run_state_has_its_own_chain() {
        String first = sup.captureSnapshot(SupervisorEvent.GLOBAL_SESSION_ID);
        String second = sup.captureGlobal(StatePayload.utf8("goals: ship it", StatePayload.TEXT));

        Snapshot s = sup.restoreSnapshot(second);
        assertEquals(first, s.parentSnapshotId());
        assertEquals(StatePayload.TEXT, s.encoding());

        var events = sup.events(SupervisorEvent.GLOBAL_SESSION_ID, 0);
        assertEquals(2, events.size());
        assertEquals(EventKind.SNAPSHOT_CAPTURED, events.get(1).kind());
        assertEquals(second, events.get(1).detail());
    }

    @Test
    void failed_capture_changes_nothing() {
        String id = sup.createSession(SessionKind.BROWSER, Map.of()).sessionId();
        driver.captureFails = true;

        assertThrows(SnapshotCaptureException.class, () -> sup.captureSnapshot(id));
        assertNull(sup.getSession(id).lastSnapshotRef());
        assertEquals(1, sup.events(id, 0).size());
    }

    @Test
    void capture_requires_a_live_environment() {
        String id = sup.createSession(SessionKind.BROWSER, Map.of()).sessionId();
        sup.teardownSession(id);

        assertThrows(IllegalStateException.class, () -> sup.captureSnapshot(id));
        assertThrows(SessionNotFoundException.class, () -> sup.captureSnapshot("sess-404"));
        assertThrows(SnapshotNotFoundException.class, () -> sup.restoreSnapshot("e".repeat(64)));
    }

    @Test
    void concurrent_captures_across_sessions_keep_every_chain_consistent() throws Exception {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            ids.add(sup.createSession(i % 2 == 0 ? SessionKind.BROWSER : SessionKind.NOTEBOOK, Map.of()).sessionId());
        }

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int round = 0; round < 5; round++) {
                for (String id : ids) {
                    futures.add(pool.submit(() -> sup.captureSnapshot(id)));
                }
            }
            for (Future<String> f : futures) {
                assertNotNull(f.get());
            }
        } finally {
            pool.shutdownNow();
        }

        for (String id : ids) {
            String head = sup.getSession(id).lastSnapshotRef();
            assertEquals(5, sup.snapshotChain(head).size(), "every capture of " + id + " is on one chain");
            var events = sup.events(id, 0);
            assertEquals(6, events.size());
            for (int i = 0; i < events.size(); i++) {
                assertEquals(i + 1L, events.get(i).eventId());
            }
        }
    }

    @Test
    void a_health_check_waits_for_a_capture_of_the_same_session() throws Exception {
        String id = sup.createSession(SessionKind.BROWSER, Map.of()).sessionId();
        CountDownLatch release = new CountDownLatch(1);
        driver.captureGate = release;

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<String> capture = pool.submit(() -> sup.captureSnapshot(id));
            Await.until("capture in progress", () -> driver.captures.get() == 1);

            int checksBefore = driver.probes.get();
            Future<ProbeOutcome> check = pool.submit(() -> sup.monitor().probeOnce(id));
            Thread.sleep(200);
            assertFalse(check.isDone());
            assertEquals(checksBefore, driver.probes.get());

            release.countDown();
            assertNotNull(capture.get(5, TimeUnit.SECONDS));
            assertEquals(ProbeOutcome.HEALTHY, check.get(5, TimeUnit.SECONDS));
            assertEquals(checksBefore + 1, driver.probes.get());
        } finally {
            driver.captureGate = null;
            pool.shutdownNow();
        }
    }
}
