package io.envkeeper.storage.record;

import io.envkeeper.core.EventKind;
import io.envkeeper.core.SupervisorEvent;

/**
 * JSON shape of an event in the event log.
 * <p>
 * {@code opId} is the emission key the notifier deduplicated on; it is stored
 * so a restarted notifier still refuses a replayed emission.
 */
public class EventRecord {
    public long eventId;
    public String sessionId;
    public String kind;
    public long occurredAtMillis;
    public String detail;
    public String opId;

    public static EventRecord from(SupervisorEvent e, String opId) {
        EventRecord r = new EventRecord();
        r.eventId = e.eventId();
        r.sessionId = e.sessionId();
        r.kind = e.kind().wireName();
        r.occurredAtMillis = e.occurredAtMillis();
        r.detail = e.detail();
        r.opId = opId;
        return r;
    }

    public SupervisorEvent toEvent() {
        return new SupervisorEvent(eventId, sessionId, EventKind.fromWire(kind), occurredAtMillis, detail);
    }
}
