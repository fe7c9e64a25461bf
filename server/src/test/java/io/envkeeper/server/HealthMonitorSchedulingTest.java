package io.envkeeper.server;

import io.envkeeper.core.EventKind;
import io.envkeeper.core.SessionKind;
import io.envkeeper.core.SessionState;
import io.envkeeper.core.SupervisorEvent;
import io.envkeeper.server.driver.DriverRegistry;
import io.envkeeper.server.monitor.HealthMonitor.ProbeOutcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/** The same lifecycle as the scenario tests, but driven by the real probe schedule. */
class HealthMonitorSchedulingTest {

    @TempDir Path dir;

    @Test
    void scheduled_probes_detect_loss_and_recovery_restarts_probing() {
        var cfg = new SupervisorConfig(0, dir.toString(), Duration.ofMillis(20), Duration.ofMillis(200),
                3, 3, Duration.ofMillis(10), Duration.ofSeconds(2), 100);
        FakeDriver driver = new FakeDriver();

        try (Supervisor sup = new Supervisor(cfg, new DriverRegistry().register(SessionKind.NOTEBOOK, driver), null).open()) {
            String id = sup.createSession(SessionKind.NOTEBOOK, Map.of("kernel", "python3")).sessionId();
            sup.captureSnapshot(id);
            Await.until("first probes", () -> sup.getSession(id).lastHealthAtMillis() > 0);

            // the started environment dies; anything restored from a snapshot is fine
            driver.sickOrigin = "start";
            Await.until("recovered from snapshot", () -> sup.events(id, 0).stream()
                    .anyMatch(e -> e.kind() == EventKind.RECOVERED && e.detail().startsWith("restored")));

            int probes = driver.probes.get();
            Await.until("probing resumed", () -> driver.probes.get() > probes + 2);
            assertEquals(SessionState.RUNNING, sup.getSession(id).state());
            assertEquals(1, sup.events(id, 0).stream().filter(e -> e.kind() == EventKind.LOST).count());
            assertEquals(1, driver.restores.get());
        }
    }

    @Test
    void a_slow_probe_counts_as_a_failure() {
        var cfg = new SupervisorConfig(0, dir.toString(), Duration.ofHours(1), Duration.ofMillis(30),
                3, 3, Duration.ofMillis(10), Duration.ofSeconds(2), 100);
        FakeDriver driver = new FakeDriver();
        driver.probeDelayMillis = 500;

        try (Supervisor sup = new Supervisor(cfg, new DriverRegistry().register(SessionKind.OTHER, driver), null).open()) {
            String id = sup.createSession(SessionKind.OTHER, Map.of()).sessionId();
            assertEquals(ProbeOutcome.DEGRADED, sup.monitor().probeOnce(id));

            var s = sup.getSession(id);
            assertEquals(SessionState.DEGRADED, s.state());
            assertTrue(s.detail().contains("healthCheck"), s.detail());
        }
    }

    @Test
    void hung_environments_do_not_hold_up_checks_of_a_healthy_one() {
        var cfg = new SupervisorConfig(0, dir.toString(), Duration.ofMillis(50), Duration.ofMillis(1500),
                100, 3, Duration.ofMillis(10), Duration.ofSeconds(2), 100);
        FakeDriver driver = new FakeDriver();
        driver.hangingHandles.addAll(Set.of(1, 2));

        try (Supervisor sup = new Supervisor(cfg, new DriverRegistry().register(SessionKind.BROWSER, driver), null).open()) {
            for (int i = 0; i < 3; i++) {
                sup.createSession(SessionKind.BROWSER, Map.of());
            }
            // handles 1 and 2 block their checks for the whole timeout
            Await.until("healthy session keeps being checked", Duration.ofMillis(1200),
                    () -> checksOf(driver, 3) >= 10);
            assertEquals(1, checksOf(driver, 1));
            assertEquals(1, checksOf(driver, 2));
        }
    }

    @Test
    void a_threshold_of_one_loses_the_session_on_the_first_failure() {
        var cfg = new SupervisorConfig(0, dir.toString(), Duration.ofHours(1), Duration.ofMillis(500),
                1, 3, Duration.ofMillis(10), Duration.ofSeconds(2), 100);
        FakeDriver driver = new FakeDriver();

        try (Supervisor sup = new Supervisor(cfg, new DriverRegistry().register(SessionKind.OTHER, driver), null).open()) {
            String id = sup.createSession(SessionKind.OTHER, Map.of()).sessionId();
            sup.captureSnapshot(id);

            driver.healthy = false;
            assertEquals(ProbeOutcome.LOST, sup.monitor().probeOnce(id));
            driver.healthy = true;

            Await.until("recovered", () -> sup.getSession(id).state() == SessionState.RUNNING);
            assertEquals(List.of(EventKind.STARTED, EventKind.SNAPSHOT_CAPTURED, EventKind.DEGRADED,
                    EventKind.LOST, EventKind.RECOVERED),
                    sup.events(id, 0).stream().map(SupervisorEvent::kind).toList());
        }
    }

    private static int checksOf(FakeDriver driver, int handle) {
        AtomicInteger n = driver.probesByHandle.get(handle);
        return n == null ? 0 : n.get();
    }
}
