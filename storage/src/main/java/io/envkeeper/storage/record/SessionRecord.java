// file: src/main/java/io/envkeeper/storage/record/SessionRecord.java
package io.envkeeper.storage.record;

import io.envkeeper.core.EventKind;
import io.envkeeper.core.Session;
import io.envkeeper.core.SessionKind;
import io.envkeeper.core.SessionState;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON shape of a session in the journal and in table checkpoints.
 * Example:
 *   {
 *     "sessionId": "sess-3",
 *     "kind": "browser",
 *     "state": "running",
 *     "lastSnapshotRef": "9f86d0...",
 *     "createdAtMillis": 1700000000000,
 *     "lastHealthAtMillis": 1700000004000,
 *     "config": { "url": "https://example.org" },
 *     "version": 4,
 *     "detail": "started",
 *     "pendingEvent": "started"
 *   }
 * "pendingEvent" is the event this version of the session owes the event log.
 */
public class SessionRecord {
    public String sessionId;
    public String kind;
    public String state;
    public String lastSnapshotRef;
    public long createdAtMillis;
    public long lastHealthAtMillis;
    public Map<String, String> config;
    public long version;
    public String detail;
    public String pendingEvent;

    public static SessionRecord from(Session s) {
        return from(s, null);
    }

    public static SessionRecord from(Session s, EventKind pending) {
        SessionRecord r = new SessionRecord();
        r.pendingEvent = pending == null ? null : pending.wireName();
        r.sessionId = s.sessionId();
        r.kind = s.kind().wireName();
        r.state = s.state().wireName();
        r.lastSnapshotRef = s.lastSnapshotRef();
        r.createdAtMillis = s.createdAtMillis();
        r.lastHealthAtMillis = s.lastHealthAtMillis();
        r.config = new TreeMap<>(s.config());
        r.version = s.version();
        r.detail = s.detail();
        return r;
    }

    /** Null when this version emits nothing. */
    public EventKind pendingEventKind() {
        return pendingEvent == null ? null : EventKind.fromWire(pendingEvent);
    }

    public Session toSession() {
        return new Session(
                sessionId,
                SessionKind.fromWire(kind),
                SessionState.fromWire(state),
                lastSnapshotRef,
                createdAtMillis,
                lastHealthAtMillis,
                config == null ? Map.of() : new LinkedHashMap<>(config),
                version,
                detail
        );
    }
}
