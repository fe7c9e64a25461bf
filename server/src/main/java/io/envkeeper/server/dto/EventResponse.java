package io.envkeeper.server.dto;

import io.envkeeper.core.SupervisorEvent;

public class EventResponse {
    public long eventId;
    public String sessionId;
    public String kind;
    public long occurredAtMillis;
    public String detail;

    public static EventResponse from(SupervisorEvent e) {
        var dto = new EventResponse();
        dto.eventId = e.eventId();
        dto.sessionId = e.sessionId();
        dto.kind = e.kind().wireName();
        dto.occurredAtMillis = e.occurredAtMillis();
        dto.detail = e.detail();
        return dto;
    }
}
