package io.envkeeper.storage;

import io.envkeeper.core.EventKind;
import io.envkeeper.core.SupervisorEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileEventLogTest {

    @TempDir Path dir;

    @Test
    void events_and_their_op_ids_survive_restart_in_order() {
        var log = new FileEventLog(new FileWal(dir, 256));
        log.append(new SupervisorEvent(1, "sess-1", EventKind.STARTED, 100L, null), "sess-1@2");
        log.append(new SupervisorEvent(2, "sess-1", EventKind.DEGRADED, 200L, "probe timed out"), "sess-1@3");
        log.append(new SupervisorEvent(1, "sess-2", EventKind.START_FAILED, 300L, "boom"), "sess-2@2");
        log.close();

        var entries = new FileEventLog(new FileWal(dir, 256)).readAll();
        assertEquals(3, entries.size());

        var second = entries.get(1);
        assertEquals(2, second.event().eventId());
        assertEquals(EventKind.DEGRADED, second.event().kind());
        assertEquals("probe timed out", second.event().detail());
        assertEquals("sess-1@3", second.opId());

        assertEquals("sess-2", entries.get(2).event().sessionId());
        assertEquals("", entries.get(0).event().detail());
    }
}
