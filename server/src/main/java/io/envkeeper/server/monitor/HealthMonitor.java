package io.envkeeper.server.monitor;

import io.envkeeper.core.EventKind;
import io.envkeeper.core.Session;
import io.envkeeper.core.SessionState;
import io.envkeeper.core.driver.DriverException;
import io.envkeeper.core.driver.EnvironmentDriver;
import io.envkeeper.core.driver.EnvironmentHandle;
import io.envkeeper.core.driver.HealthStatus;
import io.envkeeper.server.driver.AdapterInvoker;
import io.envkeeper.server.driver.DriverRegistry;
import io.envkeeper.server.session.SessionEntry;
import io.envkeeper.server.session.SessionRegistry;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic liveness probing, one fixed-delay task per watched session.
 * <p>
 * The scheduler threads ("health-monitor-N") only trigger probes. Each probe
 * runs on a cached worker ("health-probe-N") and at most one probe per session
 * is in flight, so a hung environment delays its own probes and nobody else's.
 * <p>
 * One probe, under the session lock:
 *  - healthy:   failure counter reset; degraded -> running (+ recovered).
 *  - unhealthy: UNRESPONSIVE, a driver error or a timeout. Counter + 1, then
 *               running -> degraded on the first failure, and
 *               degraded -> lost once the counter reaches the threshold
 *               (in the same probe when the threshold is 1).
 * On lost the session is unwatched and handed to the {@link LossHandler}
 * exactly once.
 * <p>
 * Sessions that are not running/degraded are skipped; terminal ones are unwatched.
 */
public final class HealthMonitor implements AutoCloseable {
    private static final Logger log = Logger.getLogger(HealthMonitor.class.getName());

    /** Receives sessions that just became lost. */
    @FunctionalInterface
    public interface LossHandler {
        void onLost(String sessionId);
    }

    /** What a single probe did. */
    public enum ProbeOutcome { HEALTHY, FAILED, DEGRADED, LOST, RECOVERED, SKIPPED }

    private final SessionRegistry registry;
    private final DriverRegistry drivers;
    private final AdapterInvoker invoker;
    private final Duration interval;
    private final Duration probeTimeout;
    private final int failureThreshold;
    private final LossHandler lossHandler;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService probers;
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();
    private final Set<String> probing = ConcurrentHashMap.newKeySet();
    // consecutive failures per session, updated under the session lock
    private final Map<String, Integer> failures = new ConcurrentHashMap<>();

    public HealthMonitor(SessionRegistry registry,
                         DriverRegistry drivers,
                         AdapterInvoker invoker,
                         Duration interval,
                         Duration probeTimeout,
                         int failureThreshold,
                         int threads,
                         LossHandler lossHandler,
                         Clock clock) {
        if (failureThreshold <= 0) throw new IllegalArgumentException("failureThreshold must be > 0");
        this.registry = registry;
        this.drivers = drivers;
        this.invoker = invoker;
        this.interval = interval;
        this.probeTimeout = probeTimeout;
        this.failureThreshold = failureThreshold;
        this.lossHandler = lossHandler;
        this.clock = clock;
        AtomicInteger n = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(threads, r -> {
            Thread t = new Thread(r, "health-monitor-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        AtomicInteger p = new AtomicInteger();
        this.probers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "health-probe-" + p.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Start probing a session. No-op if it is already watched. */
    public void watch(String sessionId) {
        tasks.computeIfAbsent(sessionId, id -> {
            log.fine(() -> "watching " + id + " every " + interval.toMillis() + "ms");
            return scheduler.scheduleWithFixedDelay(
                    () -> trigger(id),
                    interval.toMillis(),
                    interval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
        });
    }

    /** Stop probing. A probe already running finishes; later ones never start. */
    public void unwatch(String sessionId) {
        ScheduledFuture<?> task = tasks.remove(sessionId);
        if (task != null) {
            task.cancel(false);
        }
        failures.remove(sessionId);
    }

    public boolean isWatched(String sessionId) {
        return tasks.containsKey(sessionId);
    }

    /**
     * Run one probe cycle for a session right now, on the calling thread.
     * Uses the same failure counter as the scheduled probes.
     */
    public ProbeOutcome probeOnce(String sessionId) {
        Optional<SessionEntry> found = registry.find(sessionId);
        if (found.isEmpty()) {
            unwatch(sessionId);
            return ProbeOutcome.SKIPPED;
        }
        SessionEntry entry = found.get();

        ProbeOutcome outcome;
        entry.lock().lock();
        try {
            Session s = entry.session();
            if (!s.state().isProbed()) {
                outcome = ProbeOutcome.SKIPPED;
            } else {
                outcome = probeLocked(entry, s);
            }
        } finally {
            entry.lock().unlock();
        }

        if (outcome == ProbeOutcome.SKIPPED || outcome == ProbeOutcome.LOST) {
            unwatch(sessionId);
        }
        if (outcome == ProbeOutcome.LOST) {
            lossHandler.onLost(sessionId);
        }
        return outcome;
    }

    /** Stops scheduling and waits up to {@code probeTimeout} for probes in flight. */
    @Override
    public void close() {
        scheduler.shutdownNow();
        probers.shutdown();
        try {
            if (!probers.awaitTermination(probeTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS)) {
                log.warning("health probes still running at close");
                probers.shutdownNow();
            }
        } catch (InterruptedException e) {
            probers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        tasks.clear();
        failures.clear();
    }

    // ---------- internals ----------

    private ProbeOutcome probeLocked(SessionEntry entry, Session s) {
        String id = s.sessionId();
        String failure = check(entry, s);
        registry.touchHealth(entry, clock.millis());

        if (failure == null) {
            failures.remove(id);
            if (s.state() == SessionState.DEGRADED) {
                registry.transition(entry, SessionState.RUNNING, "probe healthy again", EventKind.RECOVERED);
                return ProbeOutcome.RECOVERED;
            }
            return ProbeOutcome.HEALTHY;
        }

        int count = failures.merge(id, 1, Integer::sum);
        if (s.state() == SessionState.RUNNING) {
            registry.transition(entry, SessionState.DEGRADED, failure, EventKind.DEGRADED);
            if (count < failureThreshold) {
                return ProbeOutcome.DEGRADED;
            }
        }
        if (count >= failureThreshold) {
            registry.transition(entry, SessionState.LOST,
                    failure + " (" + count + " consecutive failures)", EventKind.LOST);
            return ProbeOutcome.LOST;
        }
        return ProbeOutcome.FAILED;
    }

    /** Null when healthy, otherwise why the probe failed. */
    private String check(SessionEntry entry, Session s) {
        EnvironmentHandle handle = entry.handle();
        if (handle == null) {
            return "no live environment";
        }
        EnvironmentDriver driver = drivers.driverFor(s.kind());
        try {
            HealthStatus status = invoker.call("healthCheck", probeTimeout,
                    () -> driver.healthCheck(handle, probeTimeout));
            return status == HealthStatus.HEALTHY ? null : "environment unresponsive";
        } catch (DriverException e) {
            return e.getMessage();
        } catch (RuntimeException e) {
            if (scheduler.isShutdown()) throw e;
            log.log(Level.WARNING, "health check of " + s.sessionId() + " crashed", e);
            return "health check crashed: " + e;
        }
    }

    /** Hand one probe to a worker unless the previous probe of this session is still running. */
    private void trigger(String sessionId) {
        if (!probing.add(sessionId)) {
            log.fine(() -> "previous probe of " + sessionId + " still running, skipping");
            return;
        }
        try {
            probers.execute(() -> {
                try {
                    probeSafe(sessionId);
                } finally {
                    probing.remove(sessionId);
                }
            });
        } catch (RejectedExecutionException e) {
            probing.remove(sessionId);
            log.fine(() -> "probe of " + sessionId + " not started, monitor closing");
        }
    }

    private void probeSafe(String sessionId) {
        try {
            probeOnce(sessionId);
        } catch (RuntimeException e) {
            if (scheduler.isShutdown()) {
                log.fine(() -> "probe of " + sessionId + " interrupted by shutdown");
                return;
            }
            log.log(Level.WARNING, "probe of " + sessionId + " failed", e);
        }
    }
}
