package io.envkeeper.storage.record;

import java.util.List;

/** JSON shape of a session table checkpoint ("sessions-&lt;millis&gt;.json"). */
public class SessionTableRecord {
    public long writtenAtMillis;
    public List<SessionRecord> sessions;
}
