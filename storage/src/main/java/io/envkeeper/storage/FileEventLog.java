package io.envkeeper.storage;

import io.envkeeper.core.SupervisorEvent;
import io.envkeeper.storage.record.EventRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link EventLog} over a {@link Wal}. Each record is one framed JSON
 * {@link EventRecord}. Segments rotate by size and are never compacted.
 */
public class FileEventLog implements EventLog {
    private final Wal wal;

    public FileEventLog(Wal wal) {
        this.wal = wal;
    }

    @Override
    public synchronized void append(SupervisorEvent event, String opId) {
        wal.append(JournalCodec.encodeEvent(event, opId));
        wal.rotateIfNeeded();
    }

    @Override
    public List<Entry> readAll() {
        List<Entry> out = new ArrayList<>();
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                EventRecord rec = JournalCodec.decodeEvent(payload);
                out.add(new Entry(rec.toEvent(), rec.opId));
            }
        }
        return out;
    }

    @Override
    public void close() {
        wal.close();
    }
}
