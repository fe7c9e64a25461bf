// file: src/main/java/io/envkeeper/storage/FileSessionTableCheckpointer.java
package io.envkeeper.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.envkeeper.core.EventKind;
import io.envkeeper.core.Session;
import io.envkeeper.storage.record.SessionRecord;
import io.envkeeper.storage.record.SessionTableRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * JSON checkpoints of the session table, one file per checkpoint.
 * <p>
 * Naming: "sessions-&lt;13-digit millis&gt;.json", strictly increasing so
 * lexical order is write order.
 * <p>
 * Atomicity:
 *   - We write to "&lt;name&gt;.tmp" first,
 *   - then move to "&lt;name&gt;" using ATOMIC_MOVE.
 * Only the newest {@code retain} checkpoints are kept.
 */
public final class FileSessionTableCheckpointer implements SessionTableCheckpointer {
    private static final String PREFIX = "sessions-";
    private static final String SUFFIX = ".json";

    private final Path dir;
    private final int retain;
    private final ObjectMapper json = JournalCodec.MAPPER.copy().enable(SerializationFeature.INDENT_OUTPUT);
    private long lastMillis;

    public FileSessionTableCheckpointer(Path dir) {
        this(dir, 2);
    }

    public FileSessionTableCheckpointer(Path dir, int retain) {
        if (retain <= 0) throw new IllegalArgumentException("retain must be > 0");
        this.dir = dir;
        this.retain = retain;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public synchronized String write(Collection<Session> sessions, Map<String, EventKind> owedEvents) {
        long now = Math.max(System.currentTimeMillis(), lastMillis + 1);
        lastMillis = now;
        String name = String.format("%s%013d%s", PREFIX, now, SUFFIX);
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        SessionTableRecord table = new SessionTableRecord();
        table.writtenAtMillis = now;
        table.sessions = sessions.stream()
                .sorted(Comparator.comparing(Session::sessionId))
                .map(s -> SessionRecord.from(s, owedEvents.get(s.sessionId())))
                .toList();
        try {
            json.writeValue(tmp.toFile(), table);
            Files.move(tmp, dst, ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write session checkpoint " + dst, e);
        }
        prune();
        return name;
    }

    @Override
    public LoadedTable loadLatest() {
        List<Path> all = checkpoints();
        if (all.isEmpty()) return null;
        Path latest = all.get(all.size() - 1);
        try {
            SessionTableRecord table = json.readValue(latest.toFile(), SessionTableRecord.class);
            List<SessionRecord> records = table.sessions == null ? List.of() : table.sessions;
            Map<String, EventKind> owed = new HashMap<>();
            for (SessionRecord r : records) {
                if (r.pendingEvent != null) {
                    owed.put(r.sessionId, r.pendingEventKind());
                }
            }
            return new LoadedTable(latest.getFileName().toString(),
                    records.stream().map(SessionRecord::toSession).toList(), owed);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read session checkpoint " + latest, e);
        }
    }

    private void prune() {
        List<Path> all = checkpoints();
        for (int i = 0; i < all.size() - retain; i++) {
            try {
                Files.deleteIfExists(all.get(i));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }

    private List<Path> checkpoints() {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith(PREFIX) && n.endsWith(SUFFIX);
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
