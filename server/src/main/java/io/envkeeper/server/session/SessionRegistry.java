package io.envkeeper.server.session;

import io.envkeeper.core.EventKind;
import io.envkeeper.core.Session;
import io.envkeeper.core.SessionKind;
import io.envkeeper.core.SessionNotFoundException;
import io.envkeeper.core.SessionState;
import io.envkeeper.core.driver.DriverException;
import io.envkeeper.core.driver.EnvironmentDriver;
import io.envkeeper.core.driver.EnvironmentHandle;
import io.envkeeper.server.driver.AdapterInvoker;
import io.envkeeper.server.driver.DriverRegistry;
import io.envkeeper.server.events.EventNotifier;
import io.envkeeper.storage.SessionJournal;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Table of sessions bound to durable ids.
 * <p>
 * Responsibilities:
 *  - Allocate ids ("sess-N", never reused) and start environments through their driver.
 *  - Apply state transitions: validate, journal, publish, then emit the event.
 *  - Tear sessions down idempotently.
 * <p>
 * Every mutation goes through {@link #transition}, {@link #recordSnapshot} or
 * {@link #note} while the caller holds the session's lock. A mutation is
 * journaled before it becomes visible in memory, together with the event it
 * owes. When that emission fails the event stays owed: the next mutation of
 * the session emits it first, and {@link #settleOwedEvents()} emits it after a
 * restart. A session therefore never moves on while an event is missing.
 * <p>
 * The registry is rebuilt from the {@link SessionJournal} on construction.
 * Handles never survive a restart; reconciling recovered sessions is up to the
 * owner (see {@code Supervisor.open()}).
 */
public final class SessionRegistry {
    private static final Logger log = Logger.getLogger(SessionRegistry.class.getName());
    private static final String ID_PREFIX = "sess-";

    private static final Comparator<Session> CREATION_ORDER =
            Comparator.comparingLong(Session::createdAtMillis)
                    .thenComparingLong(s -> idNumber(s.sessionId()));

    private final Map<String, SessionEntry> entries = new ConcurrentHashMap<>();
    private final AtomicLong lastId = new AtomicLong();
    private final SessionJournal journal;
    private final DriverRegistry drivers;
    private final AdapterInvoker invoker;
    private final Duration adapterTimeout;
    private final EventNotifier notifier;
    private final Clock clock;

    public SessionRegistry(SessionJournal journal,
                           DriverRegistry drivers,
                           AdapterInvoker invoker,
                           Duration adapterTimeout,
                           EventNotifier notifier,
                           Clock clock) {
        this.journal = journal;
        this.drivers = drivers;
        this.invoker = invoker;
        this.adapterTimeout = adapterTimeout;
        this.notifier = notifier;
        this.clock = clock;

        for (Session s : journal.sessions().values()) {
            entries.put(s.sessionId(), new SessionEntry(s));
            lastId.accumulateAndGet(idNumber(s.sessionId()), Math::max);
        }
        if (!entries.isEmpty()) {
            log.info(() -> "loaded " + entries.size() + " sessions, last id " + ID_PREFIX + lastId.get());
        }
    }

    /**
     * Create a session and start its environment.
     * <p>
     * The driver's start is retried exactly once. On the second failure the
     * session is left {@code failed} and a {@code start_failed} event is emitted.
     *
     * @return the new session id, already {@code running}
     * @throws IllegalArgumentException if no driver handles {@code kind}
     * @throws SessionStartException    if the environment could not be started
     */
    public String create(SessionKind kind, Map<String, String> config) {
        EnvironmentDriver driver = drivers.driverFor(kind);
        String id = ID_PREFIX + lastId.incrementAndGet();
        SessionEntry entry = new SessionEntry(Session.starting(id, kind, config, clock.millis()));

        entry.lock().lock();
        try {
            journal.record(entry.session());
            entries.put(id, entry);

            EnvironmentHandle handle;
            try {
                handle = startWithOneRetry(driver, entry.session());
            } catch (DriverException e) {
                transition(entry, SessionState.FAILED, e.getMessage(), EventKind.START_FAILED);
                throw new SessionStartException(id, e);
            }
            entry.installHandle(handle);
            try {
                transition(entry, SessionState.RUNNING, handle.describe(), EventKind.STARTED);
            } catch (RuntimeException e) {
                abandonStart(entry, e);
                throw e;
            }
            return id;
        } finally {
            entry.lock().unlock();
        }
    }

    /** @throws SessionNotFoundException if the id was never allocated */
    public Session get(String sessionId) {
        return entry(sessionId).session();
    }

    /** @throws SessionNotFoundException if the id was never allocated */
    public SessionEntry entry(String sessionId) {
        SessionEntry e = sessionId == null ? null : entries.get(sessionId);
        if (e == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return e;
    }

    public Optional<SessionEntry> find(String sessionId) {
        return Optional.ofNullable(entries.get(sessionId));
    }

    /**
     * Stop the environment and mark the session {@code terminated}.
     * <p>
     * Idempotent: a session that is already terminal is returned unchanged and
     * nothing is emitted. A failing driver stop does not keep the session
     * alive; it is reported as an extra {@code stop_failed} event.
     */
    public Session teardown(String sessionId) {
        SessionEntry entry = entry(sessionId);
        entry.lock().lock();
        try {
            Session current = entry.session();
            if (!current.isActive()) {
                return current;
            }
            entry.cancel();

            EnvironmentHandle handle = entry.takeHandle();
            String stopError = null;
            if (handle != null) {
                stopError = stopQuietly(current, handle);
            }
            Session done = transition(entry, SessionState.TERMINATED, "torn down", EventKind.TERMINATED);
            if (stopError != null) {
                note(entry, EventKind.STOP_FAILED, stopError);
            }
            return done;
        } finally {
            entry.lock().unlock();
        }
    }

    /** Non-terminal sessions, oldest first. */
    public List<Session> listActive() {
        return entries.values().stream()
                .map(SessionEntry::session)
                .filter(Session::isActive)
                .sorted(CREATION_ORDER)
                .toList();
    }

    /** All sessions including tombstones, oldest first. */
    public List<Session> listAll() {
        return entries.values().stream()
                .map(SessionEntry::session)
                .sorted(CREATION_ORDER)
                .toList();
    }

    /**
     * Move a session to {@code next}, journal it and emit {@code kind} (if not null).
     * Caller must hold the entry's lock.
     *
     * @throws IllegalStateException if the transition is not allowed; nothing is persisted then
     */
    public Session transition(SessionEntry entry, SessionState next, String detail, EventKind kind) {
        requireLocked(entry);
        settleOwed(entry);
        Session before = entry.session();
        Session after = before.transitionTo(next, detail);
        journal.record(after, kind);
        entry.update(after);
        if (!after.isActive()) {
            entry.cancel();
        }
        log.info(() -> after.sessionId() + " " + before.state().wireName() + " -> " + next.wireName()
                + (detail == null ? "" : " (" + detail + ")"));
        if (kind != null) {
            emit(entry, after, kind, detail);
        }
        return after;
    }

    /** Point lastSnapshotRef at a freshly stored snapshot and emit {@code snapshot_captured}. */
    public Session recordSnapshot(SessionEntry entry, String snapshotId) {
        requireLocked(entry);
        settleOwed(entry);
        Session after = entry.session().withSnapshotRef(snapshotId);
        journal.record(after, EventKind.SNAPSHOT_CAPTURED);
        entry.update(after);
        emit(entry, after, EventKind.SNAPSHOT_CAPTURED, snapshotId);
        return after;
    }

    /** Emit an informational event that does not change the session. */
    public void note(SessionEntry entry, EventKind kind, String detail) {
        requireLocked(entry);
        settleOwed(entry);
        emit(entry, entry.session(), kind, detail);
    }

    /**
     * Emit the events that journaled mutations still owe, typically because the
     * event log failed before the previous process stopped. Call once after
     * construction, before anything else mutates sessions.
     */
    public void settleOwedEvents() {
        journal.owedEvents().forEach((id, kind) -> {
            SessionEntry entry = entries.get(id);
            if (entry == null) return;
            entry.lock().lock();
            try {
                Session s = entry.session();
                if (emittedAtOrAfter(s)) return;
                String detail = kind == EventKind.SNAPSHOT_CAPTURED ? s.lastSnapshotRef() : s.detail();
                entry.owe(new SessionEntry.OwedEvent(kind, detail, emissionKey(s, kind)));
                settleOwed(entry);
                log.info(() -> "settled owed " + kind.wireName() + " event of " + id);
            } finally {
                entry.lock().unlock();
            }
        });
    }

    /** Refresh lastHealthAt in memory; it is persisted with the next journaled mutation. */
    public void touchHealth(SessionEntry entry, long millis) {
        requireLocked(entry);
        entry.update(entry.session().withLastHealthAt(millis));
    }

    /** Write a full table snapshot and compact the journal. */
    public void checkpoint() {
        journal.checkpoint();
    }

    /** Best-effort driver stop. Returns the failure message, or null if the stop succeeded. */
    public String stopQuietly(Session session, EnvironmentHandle handle) {
        EnvironmentDriver driver = drivers.driverFor(session.kind());
        try {
            invoker.run("stop", adapterTimeout, () -> {
                driver.stop(handle);
                return null;
            });
            return null;
        } catch (DriverException | RuntimeException e) {
            log.log(Level.WARNING, "stop failed for " + session.sessionId() + " (" + handle.describe() + ")", e);
            return "stop failed: " + e.getMessage();
        }
    }

    // ---------- internals ----------

    private EnvironmentHandle startWithOneRetry(EnvironmentDriver driver, Session s) throws DriverException {
        try {
            return invoker.call("start", adapterTimeout, () -> driver.start(s.config()));
        } catch (DriverException first) {
            log.log(Level.WARNING, "start failed for " + s.sessionId() + ", retrying once", first);
            return invoker.call("start", adapterTimeout, () -> driver.start(s.config()));
        }
    }

    /**
     * A start whose RUNNING transition could not be recorded: the caller never
     * learns the id, so stop the environment and close the session if possible.
     */
    private void abandonStart(SessionEntry entry, RuntimeException cause) {
        log.log(Level.WARNING, "could not record start of " + entry.sessionId() + ", stopping its environment", cause);
        entry.cancel();
        EnvironmentHandle handle = entry.takeHandle();
        String stopError = stopQuietly(entry.session(), handle);
        if (stopError != null) {
            cause.addSuppressed(new IllegalStateException(stopError));
        }
        boolean neverRan = entry.session().state() == SessionState.STARTING;
        try {
            transition(entry,
                    neverRan ? SessionState.FAILED : SessionState.TERMINATED,
                    "start not recorded: " + cause.getMessage(),
                    neverRan ? EventKind.START_FAILED : EventKind.TERMINATED);
        } catch (RuntimeException again) {
            // the journal still says what happened last; restart reconciliation takes it from there
            cause.addSuppressed(again);
        }
    }

    private void emit(SessionEntry entry, Session s, EventKind kind, String detail) {
        SessionEntry.OwedEvent event = new SessionEntry.OwedEvent(kind, detail, emissionKey(s, kind));
        entry.owe(event);
        notifier.emit(s.sessionId(), kind, detail, event.dedupKey());
        entry.owe(null);
    }

    private void settleOwed(SessionEntry entry) {
        SessionEntry.OwedEvent owed = entry.owed();
        if (owed != null) {
            notifier.emit(entry.sessionId(), owed.kind(), owed.detail(), owed.dedupKey());
            entry.owe(null);
        }
    }

    /** True if the newest logged event of the session was emitted at its current version or later. */
    private boolean emittedAtOrAfter(Session s) {
        return notifier.lastEmissionKey(s.sessionId())
                .map(SessionRegistry::keyVersion)
                .map(v -> v >= s.version())
                .orElse(false);
    }

    static String emissionKey(Session s, EventKind kind) {
        return s.sessionId() + "@" + s.version() + ":" + kind.wireName();
    }

    /** Version embedded in an emission key, or -1 if the key has another shape. */
    static long keyVersion(String key) {
        int at = key.lastIndexOf('@');
        int colon = key.indexOf(':', at + 1);
        if (at < 0 || colon < 0) return -1;
        try {
            return Long.parseLong(key.substring(at + 1, colon));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static void requireLocked(SessionEntry entry) {
        if (!entry.lock().isHeldByCurrentThread()) {
            throw new IllegalStateException("session lock not held for " + entry.sessionId());
        }
    }

    private static long idNumber(String sessionId) {
        if (sessionId.startsWith(ID_PREFIX)) {
            try {
                return Long.parseLong(sessionId.substring(ID_PREFIX.length()));
            } catch (NumberFormatException ignored) {
                // foreign id, sorts first
            }
        }
        return 0;
    }
}
