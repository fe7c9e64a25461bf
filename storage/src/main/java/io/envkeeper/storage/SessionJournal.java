// file: src/main/java/io/envkeeper/storage/SessionJournal.java
package io.envkeeper.storage;

import io.envkeeper.core.EventKind;
import io.envkeeper.core.Session;

import java.util.Map;

/**
 * Durable record of the session table.
 * <p>
 * Semantics:
 *  - record() must be durable before returning (WAL + fsync).
 *  - For each session the record with the highest version wins; a record with
 *    the same version as the current one replaces it (later in log order).
 *  - sessions() reflects everything recorded so far, including what was
 *    recovered from disk at construction.
 *  - A record may name the event its version owes the event log. The owed
 *    event of each session's latest record survives checkpoints, so an
 *    emission that failed after the record was written can be settled later.
 */
public interface SessionJournal extends AutoCloseable {

    default void record(Session session) {
        record(session, null);
    }

    /** Record a session version together with the event it owes (null for none). */
    void record(Session session, EventKind owedEvent);

    /** Immutable copy of sessionId -> latest session. */
    Map<String, Session> sessions();

    /** sessionId -> event owed by its latest record, for sessions whose latest record owes one. */
    Map<String, EventKind> owedEvents();

    /**
     * Write the full table as a checkpoint and drop the journal segments it covers.
     */
    void checkpoint();

    @Override
    void close();
}
