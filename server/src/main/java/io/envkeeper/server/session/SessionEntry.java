package io.envkeeper.server.session;

import io.envkeeper.core.EventKind;
import io.envkeeper.core.Session;
import io.envkeeper.core.driver.EnvironmentHandle;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry slot for one session: the current {@link Session} value, the live
 * driver handle and the lock that serializes everything done to the session.
 * <p>
 * The session value is volatile so listings never take the lock. The handle
 * and every state change are guarded by {@link #lock()}.
 */
public final class SessionEntry {

    /** An event whose mutation is journaled but whose emission has not succeeded yet. */
    record OwedEvent(EventKind kind, String detail, String dedupKey) {}

    private final ReentrantLock lock = new ReentrantLock();
    private volatile Session session;
    private volatile boolean cancelled;
    private EnvironmentHandle handle;
    private OwedEvent owed;

    SessionEntry(Session session) {
        this.session = session;
        this.cancelled = !session.isActive();
    }

    public ReentrantLock lock() {
        return lock;
    }

    public Session session() {
        return session;
    }

    public String sessionId() {
        return session.sessionId();
    }

    void update(Session next) {
        this.session = next;
    }

    /** Set by teardown; background work checks it between driver calls. */
    public boolean cancelled() {
        return cancelled;
    }

    void cancel() {
        this.cancelled = true;
    }

    public EnvironmentHandle handle() {
        requireLocked();
        return handle;
    }

    public void installHandle(EnvironmentHandle h) {
        requireLocked();
        this.handle = h;
    }

    /** Detach and return the live handle; the caller now owns stopping it. */
    public EnvironmentHandle takeHandle() {
        requireLocked();
        EnvironmentHandle h = handle;
        handle = null;
        return h;
    }

    OwedEvent owed() {
        requireLocked();
        return owed;
    }

    void owe(OwedEvent event) {
        requireLocked();
        this.owed = event;
    }

    private void requireLocked() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("session lock not held for " + sessionId());
        }
    }
}
