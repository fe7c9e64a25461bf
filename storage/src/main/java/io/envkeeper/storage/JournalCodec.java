package io.envkeeper.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.envkeeper.core.EventKind;
import io.envkeeper.core.Session;
import io.envkeeper.core.SupervisorEvent;
import io.envkeeper.storage.record.EventRecord;
import io.envkeeper.storage.record.SessionRecord;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON payloads for journal records, framed by {@link RecordCodec}.
 */
final class JournalCodec {
    static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JournalCodec() {
    }

    static byte[] encodeSession(Session s) {
        return encodeSession(s, null);
    }

    static byte[] encodeSession(Session s, EventKind pending) {
        return RecordCodec.frame(write(SessionRecord.from(s, pending)));
    }

    static Session decodeSession(byte[] payload) {
        return decodeSessionRecord(payload).toSession();
    }

    static SessionRecord decodeSessionRecord(byte[] payload) {
        return read(payload, SessionRecord.class);
    }

    static byte[] encodeEvent(SupervisorEvent e, String opId) {
        return RecordCodec.frame(write(EventRecord.from(e, opId)));
    }

    static EventRecord decodeEvent(byte[] payload) {
        return read(payload, EventRecord.class);
    }

    private static byte[] write(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    private static <T> T read(byte[] payload, Class<T> type) {
        try {
            return MAPPER.readValue(payload, type);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to decode " + type.getSimpleName(), e);
        }
    }
}
