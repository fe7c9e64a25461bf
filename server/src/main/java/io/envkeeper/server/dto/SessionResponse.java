package io.envkeeper.server.dto;

import io.envkeeper.core.Session;

import java.util.Map;

public class SessionResponse {
    public String sessionId;
    public String kind;
    public String state;
    public String lastSnapshotRef;
    public long createdAtMillis;
    public long lastHealthAtMillis;
    public Map<String, String> config;
    public long version;
    public String detail;

    public static SessionResponse from(Session s) {
        var dto = new SessionResponse();
        dto.sessionId = s.sessionId();
        dto.kind = s.kind().wireName();
        dto.state = s.state().wireName();
        dto.lastSnapshotRef = s.lastSnapshotRef();
        dto.createdAtMillis = s.createdAtMillis();
        dto.lastHealthAtMillis = s.lastHealthAtMillis();
        dto.config = s.config();
        dto.version = s.version();
        dto.detail = s.detail();
        return dto;
    }
}
