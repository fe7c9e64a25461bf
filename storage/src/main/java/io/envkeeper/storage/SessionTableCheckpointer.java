package io.envkeeper.storage;

import io.envkeeper.core.EventKind;
import io.envkeeper.core.Session;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Full copies of the session table, used to bound journal replay on restart.
 * <p>
 * On restart the journal loads the latest checkpoint, then replays the
 * records written after it.
 */
public interface SessionTableCheckpointer {

    /**
     * Persist a full copy of the table.
     *
     * @return checkpoint identifier (file name)
     */
    String write(Collection<Session> sessions, Map<String, EventKind> owedEvents);

    /** Latest checkpoint, or null if none was written yet. */
    LoadedTable loadLatest();

    record LoadedTable(String id, List<Session> sessions, Map<String, EventKind> owedEvents) {}
}
