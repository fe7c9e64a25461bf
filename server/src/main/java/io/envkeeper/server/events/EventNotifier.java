package io.envkeeper.server.events;

import io.envkeeper.core.EventKind;
import io.envkeeper.core.SupervisorEvent;
import io.envkeeper.storage.EmissionDeduper;
import io.envkeeper.storage.EventLog;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns session transitions into an ordered, deduplicated, durable event stream.
 * <p>
 * Emission protocol (see {@link #emit}):
 *  1) Drop the emission if its key was seen before.
 *  2) Assign the next event id for the session.
 *  3) Append the event to the durable {@link EventLog}. If that fails the key
 *     is forgotten again, so the caller can retry the same emission.
 *  4) Publish to the in-memory history (pull) and to listeners (push).
 * <p>
 * Callers must hold the owning session's lock while emitting. That lock is
 * what makes ids strictly increasing and gap-free per session; this class
 * does no per-session locking of its own.
 * <p>
 * Memory holds only the newest {@code tailSize} events of each session. Older
 * pages are read back from the log.
 * <p>
 * On construction the log is replayed: id counters, history and the deduper
 * are all seeded from it, so numbering continues across restarts.
 */
public final class EventNotifier implements AutoCloseable {
    private static final Logger log = Logger.getLogger(EventNotifier.class.getName());
    static final int DEFAULT_TAIL_SIZE = 1024;

    /** Newest events of one session plus its id counter; guarded by itself. */
    private static final class History {
        final ArrayDeque<SupervisorEvent> tail = new ArrayDeque<>();
        long lastId;
        String lastKey;

        void add(SupervisorEvent e, String key, int tailSize) {
            tail.addLast(e);
            if (tail.size() > tailSize) {
                tail.removeFirst();
            }
            lastId = e.eventId();
            lastKey = key;
        }

        /** First id still in memory, or lastId + 1 when nothing is. */
        long firstHeldId() {
            return tail.isEmpty() ? lastId + 1 : tail.peekFirst().eventId();
        }
    }

    private final EventLog eventLog;
    private final EmissionDeduper deduper;
    private final Clock clock;
    private final int tailSize;
    private final Map<String, History> history = new ConcurrentHashMap<>();
    private final List<EventListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService dispatcher;

    public EventNotifier(EventLog eventLog, EmissionDeduper deduper, Clock clock) {
        this(eventLog, deduper, clock, DEFAULT_TAIL_SIZE);
    }

    public EventNotifier(EventLog eventLog, EmissionDeduper deduper, Clock clock, int tailSize) {
        if (tailSize <= 0) throw new IllegalArgumentException("tailSize must be > 0");
        this.eventLog = eventLog;
        this.deduper = deduper;
        this.clock = clock;
        this.tailSize = tailSize;
        this.dispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "event-dispatch");
            t.setDaemon(true);
            return t;
        });
        replay();
    }

    /**
     * Emit one event unless {@code dedupKey} was already emitted.
     *
     * @return the emitted event, or empty if it was a duplicate
     * @throws RuntimeException from the event log; nothing was emitted then and
     *                          the same emission may be retried
     */
    public Optional<SupervisorEvent> emit(String sessionId, EventKind kind, String detail, String dedupKey) {
        Objects.requireNonNull(dedupKey, "dedupKey");
        if (!deduper.firstTime(dedupKey)) {
            log.fine(() -> "suppressed duplicate emission " + dedupKey);
            return Optional.empty();
        }

        History h = history.computeIfAbsent(sessionId, k -> new History());
        SupervisorEvent event;
        synchronized (h) {
            event = new SupervisorEvent(h.lastId + 1, sessionId, kind, clock.millis(), detail);
            try {
                // durable before visible
                eventLog.append(event, dedupKey);
            } catch (RuntimeException e) {
                deduper.forget(dedupKey);
                throw e;
            }
            h.add(event, dedupKey, tailSize);
        }

        log.info(() -> "event " + sessionId + "#" + event.eventId() + " " + kind.wireName()
                + (event.detail().isEmpty() ? "" : " (" + event.detail() + ")"));
        publish(event);
        return Optional.of(event);
    }

    /** Events of a session with id greater than {@code afterEventId}, in order. */
    public List<SupervisorEvent> events(String sessionId, long afterEventId) {
        History h = history.get(sessionId);
        if (h == null) {
            return List.of();
        }
        synchronized (h) {
            if (afterEventId + 1 >= h.firstHeldId()) {
                return h.tail.stream().filter(e -> e.eventId() > afterEventId).toList();
            }
        }
        return fromLog(sessionId, afterEventId);
    }

    public long lastEventId(String sessionId) {
        History h = history.get(sessionId);
        if (h == null) return 0;
        synchronized (h) {
            return h.lastId;
        }
    }

    /** Dedup key of the newest event of a session, if it has any. */
    public Optional<String> lastEmissionKey(String sessionId) {
        History h = history.get(sessionId);
        if (h == null) return Optional.empty();
        synchronized (h) {
            return Optional.ofNullable(h.lastKey);
        }
    }

    public void subscribe(EventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void unsubscribe(EventListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() {
        dispatcher.shutdown();
    }

    private void publish(SupervisorEvent event) {
        if (listeners.isEmpty()) return;
        dispatcher.execute(() -> {
            for (EventListener l : listeners) {
                try {
                    l.onEvent(event);
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, "event listener failed on " + event, e);
                }
            }
        });
    }

    private List<SupervisorEvent> fromLog(String sessionId, long afterEventId) {
        List<SupervisorEvent> out = new ArrayList<>();
        for (EventLog.Entry entry : eventLog.readAll()) {
            SupervisorEvent e = entry.event();
            if (e.sessionId().equals(sessionId) && e.eventId() > afterEventId) {
                out.add(e);
            }
        }
        return out;
    }

    private void replay() {
        int count = 0;
        for (EventLog.Entry entry : eventLog.readAll()) {
            SupervisorEvent e = entry.event();
            History h = history.computeIfAbsent(e.sessionId(), k -> new History());
            if (e.eventId() != h.lastId + 1) {
                // ids are assigned under the session lock, so a mismatch means a foreign or damaged log
                throw new IllegalStateException("event log out of sequence at " + e.sessionId()
                        + "#" + e.eventId() + ", expected #" + (h.lastId + 1));
            }
            h.add(e, entry.opId(), tailSize);
            if (entry.opId() != null) {
                deduper.remember(entry.opId());
            }
            count++;
        }
        if (count > 0) {
            int replayed = count;
            log.info(() -> "replayed " + replayed + " events for " + history.size() + " sessions");
        }
    }
}
