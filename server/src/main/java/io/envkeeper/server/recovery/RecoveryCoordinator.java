package io.envkeeper.server.recovery;

import io.envkeeper.core.CorruptSnapshotException;
import io.envkeeper.core.EventKind;
import io.envkeeper.core.Session;
import io.envkeeper.core.SessionState;
import io.envkeeper.core.Snapshot;
import io.envkeeper.core.SnapshotNotFoundException;
import io.envkeeper.core.driver.DriverException;
import io.envkeeper.core.driver.EnvironmentDriver;
import io.envkeeper.core.driver.EnvironmentHandle;
import io.envkeeper.core.driver.RestoreException;
import io.envkeeper.core.driver.StatePayload;
import io.envkeeper.server.driver.AdapterInvoker;
import io.envkeeper.server.driver.DriverRegistry;
import io.envkeeper.server.session.SessionEntry;
import io.envkeeper.server.session.SessionRegistry;
import io.envkeeper.storage.SnapshotStore;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Restarts lost environments from their last snapshot, a bounded number of times.
 * <p>
 * Sequence for one lost session:
 *  1) Best-effort stop of the old handle (a failure becomes a stop_failed event).
 *  2) Up to {@link RecoveryPolicy#maxAttempts()} restore attempts, spaced by
 *     {@link RecoveryPolicy#delayAfter(int)}. An attempt reads lastSnapshotRef,
 *     loads the snapshot and calls the driver's restoreState. A missing ref or
 *     a missing/corrupt snapshot counts as a failed attempt.
 *  3) Success: install the handle, lost -> running, emit recovered, tell the
 *     listener so probing resumes.
 *  4) All attempts failed: lost -> terminal_failure with the last error.
 * <p>
 * A session is never enqueued twice. Teardown is observed between attempts;
 * a handle restored after teardown is stopped right away.
 * <p>
 * The scheduler ("recovery-N") only times the backoff. Attempts block in the
 * driver, so they run on cached workers ("recovery-worker-N") and one slow
 * restore never holds up another session's recovery.
 */
public final class RecoveryCoordinator implements AutoCloseable {
    private static final Logger log = Logger.getLogger(RecoveryCoordinator.class.getName());

    /** Told when a session is running again. */
    @FunctionalInterface
    public interface RecoveryListener {
        void onRecovered(String sessionId);
    }

    private final SessionRegistry registry;
    private final DriverRegistry drivers;
    private final AdapterInvoker invoker;
    private final Duration adapterTimeout;
    private final SnapshotStore snapshots;
    private final RecoveryPolicy policy;
    private final RecoveryListener listener;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private volatile boolean closing;

    public RecoveryCoordinator(SessionRegistry registry,
                               DriverRegistry drivers,
                               AdapterInvoker invoker,
                               Duration adapterTimeout,
                               SnapshotStore snapshots,
                               RecoveryPolicy policy,
                               RecoveryListener listener) {
        this.registry = registry;
        this.drivers = drivers;
        this.invoker = invoker;
        this.adapterTimeout = adapterTimeout;
        this.snapshots = snapshots;
        this.policy = policy;
        this.listener = listener;
        AtomicInteger n = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(1, r -> {
            Thread t = new Thread(r, "recovery-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        AtomicInteger w = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "recovery-worker-" + w.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the recovery sequence for a lost session.
     *
     * @return false if that session is already being recovered
     */
    public boolean recover(String sessionId) {
        if (!inFlight.add(sessionId)) {
            log.fine(() -> sessionId + " already under recovery");
            return false;
        }
        log.info(() -> "recovering " + sessionId + " (up to " + policy.maxAttempts() + " attempts)");
        submit(sessionId, () -> {
            releaseOldHandle(sessionId);
            attempt(sessionId, 1);
        });
        return true;
    }

    public boolean inProgress(String sessionId) {
        return inFlight.contains(sessionId);
    }

    /**
     * Drops attempts still waiting out their backoff and waits for running ones
     * to finish, up to {@code adapterTimeout} plus a second. Sessions left lost
     * are picked up again by the next open.
     */
    @Override
    public void close() {
        closing = true;
        scheduler.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(adapterTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS)) {
                log.warning("recovery attempts still running at close");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ---------- internals ----------

    private void releaseOldHandle(String sessionId) {
        SessionEntry entry = registry.entry(sessionId);
        entry.lock().lock();
        try {
            EnvironmentHandle old = entry.takeHandle();
            if (old != null) {
                String error = registry.stopQuietly(entry.session(), old);
                if (error != null) {
                    registry.note(entry, EventKind.STOP_FAILED, error);
                }
            }
        } finally {
            entry.lock().unlock();
        }
    }

    private void attempt(String sessionId, int n) {
        SessionEntry entry = registry.entry(sessionId);
        if (abandoned(entry)) {
            finish(sessionId, "cancelled before attempt " + n);
            return;
        }

        Session session = entry.session();
        EnvironmentDriver driver = drivers.driverFor(session.kind());
        EnvironmentHandle restored = null;
        DriverException failure = null;
        try {
            StatePayload payload = loadPayload(session);
            restored = invoker.call("restoreState", adapterTimeout, () -> driver.restoreState(payload));
        } catch (DriverException e) {
            failure = e;
            String msg = e.getMessage();
            log.warning(() -> "recovery attempt " + n + "/" + policy.maxAttempts() + " for " + sessionId + " failed: " + msg);
        }

        if (restored != null) {
            install(entry, restored, n);
            return;
        }
        if (n < policy.maxAttempts()) {
            Duration delay = policy.delayAfter(n);
            try {
                scheduler.schedule(() -> submit(sessionId, () -> attempt(sessionId, n + 1)),
                        delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                finish(sessionId, "closing before attempt " + (n + 1));
            }
            return;
        }
        giveUp(entry, n, failure);
    }

    private StatePayload loadPayload(Session session) throws RestoreException {
        String ref = session.lastSnapshotRef();
        if (ref == null) {
            throw new RestoreException("no snapshot to restore " + session.sessionId() + " from");
        }
        try {
            Snapshot snap = snapshots.get(ref);
            return new StatePayload(snap.payload(), snap.encoding());
        } catch (SnapshotNotFoundException | CorruptSnapshotException e) {
            throw new RestoreException("snapshot " + ref + " unusable: " + e.getMessage(), e);
        }
    }

    private void install(SessionEntry entry, EnvironmentHandle restored, int attempt) {
        String sessionId = entry.sessionId();
        boolean resumed = false;
        entry.lock().lock();
        try {
            if (abandoned(entry)) {
                log.info(() -> sessionId + " was torn down during recovery, stopping restored environment");
                registry.stopQuietly(entry.session(), restored);
            } else {
                entry.installHandle(restored);
                registry.transition(entry, SessionState.RUNNING,
                        "restored from " + entry.session().lastSnapshotRef() + " on attempt " + attempt,
                        EventKind.RECOVERED);
                resumed = true;
            }
        } finally {
            entry.lock().unlock();
            inFlight.remove(sessionId);
        }
        if (resumed) {
            listener.onRecovered(sessionId);
        }
    }

    private void giveUp(SessionEntry entry, int attempts, DriverException last) {
        RecoveryExhaustedException exhausted = new RecoveryExhaustedException(entry.sessionId(), attempts, last);
        entry.lock().lock();
        try {
            if (!abandoned(entry)) {
                log.log(Level.WARNING, exhausted.getMessage(), exhausted);
                registry.transition(entry, SessionState.TERMINAL_FAILURE, exhausted.getMessage(),
                        EventKind.TERMINAL_FAILURE);
            }
        } finally {
            entry.lock().unlock();
            inFlight.remove(entry.sessionId());
        }
    }

    private static boolean abandoned(SessionEntry entry) {
        return entry.cancelled() || entry.session().state() != SessionState.LOST;
    }

    private void finish(String sessionId, String why) {
        inFlight.remove(sessionId);
        log.info(() -> "recovery of " + sessionId + " ended: " + why);
    }

    private void submit(String sessionId, Runnable step) {
        try {
            workers.execute(() -> runSafe(sessionId, step));
        } catch (RejectedExecutionException e) {
            finish(sessionId, "closing");
        }
    }

    private void runSafe(String sessionId, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            inFlight.remove(sessionId);
            if (closing) {
                log.log(Level.FINE, "recovery of " + sessionId + " cut short by close", e);
                return;
            }
            log.log(Level.SEVERE, "recovery of " + sessionId + " aborted", e);
        }
    }
}
