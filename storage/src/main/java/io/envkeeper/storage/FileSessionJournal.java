// file: src/main/java/io/envkeeper/storage/FileSessionJournal.java
package io.envkeeper.storage;

import io.envkeeper.core.EventKind;
import io.envkeeper.core.Session;
import io.envkeeper.storage.record.SessionRecord;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable session table.
 * <p>
 * Responsibilities:
 *  - Maintain an in-memory map: sessionId -> latest Session.
 *  - On record:
 *      1) Serialize the session to a framed JSON record.
 *      2) Append + fsync to the WAL.
 *      3) Apply to memory if its version is not older than what we hold,
 *         together with the event that version owes.
 *      4) Rotate the WAL segment if needed.
 *      5) Checkpoint the whole table when the CheckpointPolicy says so.
 * <p>
 *  - On startup:
 *      1) Load the latest checkpoint (if any) into memory.
 *      2) Replay WAL records, newest version per session wins.
 * <p>
 * Appends are serialized on this object; they are short (one fsync) and the
 * callers already hold their own per-session locks.
 */
public class FileSessionJournal implements SessionJournal {
    private final Map<String, Session> latest = new ConcurrentHashMap<>();
    // owed event of the record held in 'latest'; updated only while applying
    private final Map<String, EventKind> owed = new ConcurrentHashMap<>();
    private final Wal wal;
    private final SessionTableCheckpointer checkpoints;
    private final CheckpointPolicy policy;

    public FileSessionJournal(Wal wal, SessionTableCheckpointer checkpoints, CheckpointPolicy policy) {
        this.wal = wal;
        this.checkpoints = checkpoints;
        this.policy = policy;
        recover();
    }

    @Override
    public synchronized void record(Session session, EventKind owedEvent) {
        // 1) + 2) durable first; a crash after this line still replays the record
        wal.append(JournalCodec.encodeSession(session, owedEvent));

        // 3) memory
        applyIfNotOlder(session, owedEvent);

        // 4) + 5)
        wal.rotateIfNeeded();
        if (policy.mutationRecorded()) {
            checkpoint();
        }
    }

    @Override
    public Map<String, Session> sessions() {
        return Map.copyOf(latest);
    }

    @Override
    public Map<String, EventKind> owedEvents() {
        return Map.copyOf(owed);
    }

    @Override
    public synchronized void checkpoint() {
        checkpoints.write(latest.values(), owed);
        wal.compact();
        policy.reset();
    }

    @Override
    public void close() {
        wal.close();
    }

    /**
     * Recovery procedure called from the constructor:
     *  1) Seed memory from the latest checkpoint.
     *  2) Replay the WAL in order.
     */
    private void recover() {
        SessionTableCheckpointer.LoadedTable loaded = checkpoints.loadLatest();
        if (loaded != null) {
            for (Session s : loaded.sessions()) {
                latest.put(s.sessionId(), s);
            }
            owed.putAll(loaded.owedEvents());
        }

        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                SessionRecord rec = JournalCodec.decodeSessionRecord(payload);
                applyIfNotOlder(rec.toSession(), rec.pendingEventKind());
            }
        } catch (RuntimeException e) {
            throw new IllegalStateException("session journal recovery failed", e);
        }
    }

    private void applyIfNotOlder(Session s, EventKind owedEvent) {
        latest.compute(s.sessionId(), (id, old) -> {
            if (old != null && s.version() < old.version()) {
                return old;
            }
            if (owedEvent == null) {
                owed.remove(id);
            } else {
                owed.put(id, owedEvent);
            }
            return s;
        });
    }
}
