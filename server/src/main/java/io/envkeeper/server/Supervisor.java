package io.envkeeper.server;

import io.envkeeper.core.EventKind;
import io.envkeeper.core.Session;
import io.envkeeper.core.SessionKind;
import io.envkeeper.core.SessionState;
import io.envkeeper.core.Snapshot;
import io.envkeeper.core.SupervisorEvent;
import io.envkeeper.core.driver.StatePayload;
import io.envkeeper.server.driver.AdapterInvoker;
import io.envkeeper.server.driver.DriverRegistry;
import io.envkeeper.server.events.EventListener;
import io.envkeeper.server.events.EventNotifier;
import io.envkeeper.server.monitor.HealthMonitor;
import io.envkeeper.server.recovery.RecoveryCoordinator;
import io.envkeeper.server.recovery.RecoveryPolicy;
import io.envkeeper.server.session.SessionEntry;
import io.envkeeper.server.session.SessionRegistry;
import io.envkeeper.server.snapshot.RunStateSerializer;
import io.envkeeper.server.snapshot.SnapshotService;
import io.envkeeper.storage.BoundedEmissionDeduper;
import io.envkeeper.storage.CheckpointPolicy;
import io.envkeeper.storage.FileEventLog;
import io.envkeeper.storage.FileSessionJournal;
import io.envkeeper.storage.FileSessionTableCheckpointer;
import io.envkeeper.storage.FileSnapshotStore;
import io.envkeeper.storage.FileWal;
import io.envkeeper.storage.SessionJournal;
import io.envkeeper.storage.EventLog;
import io.envkeeper.storage.record.SnapshotManifest;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Agent-facing entry point: owns the session table, the snapshot store and
 * the background supervision.
 * <p>
 * Wiring:
 *  - storage: session journal (WAL + table snapshots), event log, snapshot store.
 *  - runtime: SessionRegistry, EventNotifier, SnapshotService,
 *             HealthMonitor -> RecoveryCoordinator -> HealthMonitor.
 * <p>
 * Lifecycle: construct (loads persisted state), {@link #open()} (reconciles
 * sessions that were live when the previous process stopped), {@link #close()}.
 * Environments are not stopped on close; they cannot outlive the process
 * handles anyway and are reconciled on the next open.
 */
public final class Supervisor implements AutoCloseable {
    private static final Logger log = Logger.getLogger(Supervisor.class.getName());
    private static final long WAL_ROTATE_BYTES = 16L * 1024 * 1024;
    private static final int DEDUP_CAPACITY = 65_536;
    // probe triggers only; probes themselves run on the monitor's cached workers
    private static final int MONITOR_SCHEDULER_THREADS = 1;
    static final String RESTART_DETAIL = "supervisor restarted";

    private final SupervisorConfig config;
    private final SessionJournal journal;
    private final EventLog eventLog;
    private final AdapterInvoker invoker;
    private final EventNotifier notifier;
    private final SessionRegistry registry;
    private final SnapshotService snapshots;
    private final RecoveryCoordinator recovery;
    private final HealthMonitor monitor;
    private volatile boolean open;

    public Supervisor(SupervisorConfig config, DriverRegistry drivers, RunStateSerializer runState) {
        this(config, drivers, runState, Clock.systemUTC());
    }

    public Supervisor(SupervisorConfig config, DriverRegistry drivers, RunStateSerializer runState, Clock clock) {
        this.config = config;
        Path data = config.dataPath();

        // ------ storage ------
        this.journal = new FileSessionJournal(
                new FileWal(data.resolve("sessions").resolve("journal"), WAL_ROTATE_BYTES),
                new FileSessionTableCheckpointer(data.resolve("sessions").resolve("table")),
                new CheckpointPolicy(config.journalSnapshotEvery()));
        this.eventLog = new FileEventLog(new FileWal(data.resolve("events"), WAL_ROTATE_BYTES));
        var store = new FileSnapshotStore(data.resolve("snapshots"));

        // ------ runtime ------
        this.invoker = new AdapterInvoker();
        this.notifier = new EventNotifier(eventLog, new BoundedEmissionDeduper(DEDUP_CAPACITY), clock);
        this.registry = new SessionRegistry(journal, drivers, invoker, config.adapterTimeout(), notifier, clock);
        this.snapshots = new SnapshotService(registry, drivers, invoker, config.adapterTimeout(),
                store, notifier, runState, clock);
        this.recovery = new RecoveryCoordinator(registry, drivers, invoker, config.adapterTimeout(), store,
                RecoveryPolicy.of(config.recoveryAttempts(), config.recoveryBackoff()),
                this::onRecovered);
        this.monitor = new HealthMonitor(registry, drivers, invoker, config.probeInterval(),
                config.probeTimeout(), config.failureThreshold(), MONITOR_SCHEDULER_THREADS, this::onLost, clock);
    }

    /**
     * Emit events that journaled mutations still owe, then reconcile sessions
     * found on disk. No handle survives a restart, so:
     *  - starting           -> failed (+ start_failed)
     *  - running / degraded -> degraded -> lost, then recovery
     *  - lost               -> recovery resumes
     */
    public synchronized Supervisor open() {
        if (open) return this;
        registry.settleOwedEvents();
        List<String> toRecover = new ArrayList<>();
        for (Session s : registry.listActive()) {
            SessionEntry entry = registry.entry(s.sessionId());
            entry.lock().lock();
            try {
                switch (entry.session().state()) {
                    case STARTING -> registry.transition(entry, SessionState.FAILED, RESTART_DETAIL, EventKind.START_FAILED);
                    case RUNNING -> {
                        registry.transition(entry, SessionState.DEGRADED, RESTART_DETAIL, EventKind.DEGRADED);
                        registry.transition(entry, SessionState.LOST, RESTART_DETAIL, EventKind.LOST);
                        toRecover.add(s.sessionId());
                    }
                    case DEGRADED -> {
                        registry.transition(entry, SessionState.LOST, RESTART_DETAIL, EventKind.LOST);
                        toRecover.add(s.sessionId());
                    }
                    case LOST -> toRecover.add(s.sessionId());
                    default -> { }
                }
            } finally {
                entry.lock().unlock();
            }
        }
        open = true;
        toRecover.forEach(recovery::recover);
        log.info(() -> "supervisor open on " + config.dataDir() + ": " + registry.listActive().size()
                + " active sessions, " + toRecover.size() + " under recovery");
        return this;
    }

    // ---------- sessions ----------

    /** Create and start a session; probing starts right after. */
    public Session createSession(SessionKind kind, Map<String, String> config) {
        requireOpen();
        String id = registry.create(kind, config == null ? Map.of() : config);
        monitor.watch(id);
        return registry.get(id);
    }

    public Session teardownSession(String sessionId) {
        requireOpen();
        Session s = registry.teardown(sessionId);
        monitor.unwatch(sessionId);
        return s;
    }

    public Session getSession(String sessionId) {
        return registry.get(sessionId);
    }

    public List<Session> listSessions() {
        return registry.listActive();
    }

    public List<Session> listAllSessions() {
        return registry.listAll();
    }

    // ---------- snapshots ----------

    /** Capture a session, or agent-wide run state through the registered serializer for "global". */
    public String captureSnapshot(String sessionId) {
        requireOpen();
        return snapshots.capture(sessionId);
    }

    /** Capture agent-wide run state supplied by the caller. */
    public String captureGlobal(StatePayload state) {
        requireOpen();
        return snapshots.captureGlobal(state);
    }

    public Snapshot restoreSnapshot(String snapshotId) {
        return snapshots.restore(snapshotId);
    }

    public SnapshotManifest snapshotManifest(String snapshotId) {
        return snapshots.manifest(snapshotId);
    }

    public List<SnapshotManifest> snapshotChain(String snapshotId) {
        return snapshots.chain(snapshotId);
    }

    // ---------- events ----------

    /**
     * Events of a session after {@code afterEventId}.
     *
     * @throws io.envkeeper.core.SessionNotFoundException for unknown sessions other than "global"
     */
    public List<SupervisorEvent> events(String sessionId, long afterEventId) {
        if (!SupervisorEvent.GLOBAL_SESSION_ID.equals(sessionId)) {
            registry.get(sessionId);
        }
        return notifier.events(sessionId, afterEventId);
    }

    public void subscribe(EventListener listener) {
        notifier.subscribe(listener);
    }

    public void unsubscribe(EventListener listener) {
        notifier.unsubscribe(listener);
    }

    // ---------- lifecycle ----------

    public SupervisorConfig config() {
        return config;
    }

    HealthMonitor monitor() {
        return monitor;
    }

    RecoveryCoordinator recovery() {
        return recovery;
    }

    /**
     * Stops probing, lets running recovery attempts finish, then closes the
     * adapter pool and storage in that order.
     */
    @Override
    public synchronized void close() {
        open = false;
        monitor.close();
        recovery.close();
        invoker.close();
        try {
            registry.checkpoint();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "final session table snapshot failed; the journal still has every mutation", e);
        }
        journal.close();
        eventLog.close();
        notifier.close();
        log.info("supervisor closed");
    }

    private void onLost(String sessionId) {
        if (open) {
            recovery.recover(sessionId);
        }
    }

    private void onRecovered(String sessionId) {
        if (open) {
            monitor.watch(sessionId);
        }
    }

    private void requireOpen() {
        if (!open) {
            throw new IllegalStateException("supervisor is not open");
        }
    }
}
