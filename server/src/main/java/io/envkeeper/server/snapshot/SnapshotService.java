package io.envkeeper.server.snapshot;

import io.envkeeper.core.EventKind;
import io.envkeeper.core.Session;
import io.envkeeper.core.Snapshot;
import io.envkeeper.core.SupervisorEvent;
import io.envkeeper.core.driver.DriverException;
import io.envkeeper.core.driver.EnvironmentDriver;
import io.envkeeper.core.driver.EnvironmentHandle;
import io.envkeeper.core.driver.StatePayload;
import io.envkeeper.server.driver.AdapterInvoker;
import io.envkeeper.server.driver.DriverRegistry;
import io.envkeeper.server.events.EventNotifier;
import io.envkeeper.server.session.SessionEntry;
import io.envkeeper.server.session.SessionRegistry;
import io.envkeeper.storage.SnapshotStore;
import io.envkeeper.storage.record.SnapshotManifest;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Point-in-time capture and read-back of run state.
 * <p>
 * Capture for a session runs under that session's lock, the same lock probes
 * and recovery take, so the state seen by the driver is never mid-transition.
 * Other sessions are not blocked.
 * <p>
 * The agent-wide chain ({@value SupervisorEvent#GLOBAL_SESSION_ID}) has its own
 * lock; its head lives in the store's "global" ref.
 */
public final class SnapshotService {
    private static final Logger log = Logger.getLogger(SnapshotService.class.getName());
    private static final String GLOBAL = SupervisorEvent.GLOBAL_SESSION_ID;

    private final SessionRegistry registry;
    private final DriverRegistry drivers;
    private final AdapterInvoker invoker;
    private final Duration adapterTimeout;
    private final SnapshotStore store;
    private final EventNotifier notifier;
    private final RunStateSerializer runState; // may be null
    private final Clock clock;
    private final ReentrantLock globalLock = new ReentrantLock();

    public SnapshotService(SessionRegistry registry,
                           DriverRegistry drivers,
                           AdapterInvoker invoker,
                           Duration adapterTimeout,
                           SnapshotStore store,
                           EventNotifier notifier,
                           RunStateSerializer runState,
                           Clock clock) {
        this.registry = registry;
        this.drivers = drivers;
        this.invoker = invoker;
        this.adapterTimeout = adapterTimeout;
        this.store = store;
        this.notifier = notifier;
        this.runState = runState;
        this.clock = clock;
    }

    /**
     * Capture the current state of a session, or of the agent when
     * {@code sessionId} is "global".
     *
     * @return id of the stored snapshot, now the session's lastSnapshotRef
     * @throws io.envkeeper.core.SessionNotFoundException if the session is unknown
     * @throws IllegalStateException      if the session has no live environment
     * @throws SnapshotCaptureException   if the driver could not produce state
     */
    public String capture(String sessionId) {
        if (GLOBAL.equals(sessionId)) {
            return captureGlobal(null);
        }
        SessionEntry entry = registry.entry(sessionId);
        entry.lock().lock();
        try {
            Session s = entry.session();
            EnvironmentHandle handle = entry.handle();
            if (!s.state().isProbed() || handle == null) {
                throw new IllegalStateException("cannot capture " + sessionId + " in state " + s.state().wireName());
            }
            EnvironmentDriver driver = drivers.driverFor(s.kind());
            StatePayload payload;
            try {
                payload = invoker.call("captureState", adapterTimeout, () -> driver.captureState(handle));
            } catch (DriverException e) {
                throw new SnapshotCaptureException(sessionId, e);
            }

            Snapshot snap = Snapshot.of(sessionId, clock.millis(), payload.encoding(), payload.bytes(), s.lastSnapshotRef());
            boolean written = store.put(snap);
            registry.recordSnapshot(entry, snap.snapshotId());
            log.info(() -> "captured " + sessionId + " -> " + snap.snapshotId()
                    + " (" + snap.payloadSize() + " bytes" + (written ? "" : ", already stored") + ")");
            return snap.snapshotId();
        } finally {
            entry.lock().unlock();
        }
    }

    /**
     * Capture agent-wide run state. Uses {@code supplied} when given, otherwise
     * the registered {@link RunStateSerializer}.
     */
    public String captureGlobal(StatePayload supplied) {
        globalLock.lock();
        try {
            StatePayload payload = supplied;
            if (payload == null) {
                if (runState == null) {
                    throw new IllegalStateException("no run-state serializer registered and no state supplied");
                }
                try {
                    payload = runState.serialize();
                } catch (DriverException e) {
                    throw new SnapshotCaptureException(GLOBAL, e);
                }
            }

            String parent = store.readRef(GLOBAL);
            Snapshot snap = Snapshot.of(GLOBAL, clock.millis(), payload.encoding(), payload.bytes(), parent);
            store.put(snap);
            store.writeRef(GLOBAL, snap.snapshotId());
            notifier.emit(GLOBAL, EventKind.SNAPSHOT_CAPTURED, snap.snapshotId(),
                    GLOBAL + ":" + EventKind.SNAPSHOT_CAPTURED.wireName() + ":" + snap.snapshotId());
            log.info(() -> "captured global run state -> " + snap.snapshotId());
            return snap.snapshotId();
        } finally {
            globalLock.unlock();
        }
    }

    /** Head of the global chain, or null before the first global capture. */
    public String globalHead() {
        return store.readRef(GLOBAL);
    }

    /**
     * Read a snapshot back. Never changes it or any session.
     *
     * @throws io.envkeeper.core.SnapshotNotFoundException if unknown
     * @throws io.envkeeper.core.CorruptSnapshotException  if the bytes no longer match the id
     */
    public Snapshot restore(String snapshotId) {
        return store.get(snapshotId);
    }

    public SnapshotManifest manifest(String snapshotId) {
        return store.manifest(snapshotId);
    }

    /** Manifests from {@code snapshotId} back to its root. */
    public List<SnapshotManifest> chain(String snapshotId) {
        return store.chain(snapshotId);
    }
}
