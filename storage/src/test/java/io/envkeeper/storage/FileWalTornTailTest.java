package io.envkeeper.storage;

import io.envkeeper.core.Session;
import io.envkeeper.core.SessionKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class FileWalTornTailTest {

    @TempDir Path walDir;

    private static byte[] rec(String id) {
        return JournalCodec.encodeSession(Session.starting(id, SessionKind.OTHER, Map.of(), 1000L));
    }

    private static List<String> replayIds(Wal wal) {
        List<String> ids = new ArrayList<>();
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] p; (p = r.next()) != null; ) {
                ids.add(JournalCodec.decodeSession(p).sessionId());
            }
        }
        return ids;
    }

    @Test
    void replay_ignores_truncated_tail_and_keeps_prior_records() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(rec("sess-1"));
        wal.append(rec("sess-2"));
        wal.close();

        byte[] torn = rec("sess-3");
        try (OutputStream out = Files.newOutputStream(walDir.resolve("00000001.log"), APPEND)) {
            out.write(torn, 0, torn.length - 5);
        }

        var reopened = new FileWal(walDir, 1L << 60);
        assertEquals(List.of("sess-1", "sess-2"), replayIds(reopened));
        reopened.close();
    }

    @Test
    void appends_after_recovering_from_a_torn_tail_stay_readable() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(rec("sess-1"));
        wal.close();

        try (OutputStream out = Files.newOutputStream(walDir.resolve("00000001.log"), APPEND)) {
            out.write(new byte[]{(byte) 0xC5, (byte) 0xE4, 1, 42});
        }

        var reopened = new FileWal(walDir, 1L << 60);
        reopened.append(rec("sess-2"));
        reopened.close();

        assertEquals(List.of("sess-1", "sess-2"), replayIds(new FileWal(walDir, 1L << 60)));
    }

    @Test
    void reader_walks_every_segment_and_compact_drops_old_ones() {
        var wal = new FileWal(walDir, 1); // rotate after every record
        for (int i = 1; i <= 3; i++) {
            wal.append(rec("sess-" + i));
            wal.rotateIfNeeded();
        }
        assertEquals(List.of("sess-1", "sess-2", "sess-3"), replayIds(wal));

        wal.compact();
        assertTrue(replayIds(wal).isEmpty());
        wal.append(rec("sess-4"));
        assertEquals(List.of("sess-4"), replayIds(wal));
        wal.close();
    }
}
