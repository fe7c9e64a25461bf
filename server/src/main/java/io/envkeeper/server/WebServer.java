package io.envkeeper.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.envkeeper.core.Session;
import io.envkeeper.core.SessionKind;
import io.envkeeper.core.SessionNotFoundException;
import io.envkeeper.core.Snapshot;
import io.envkeeper.core.SnapshotNotFoundException;
import io.envkeeper.core.SupervisorEvent;
import io.envkeeper.core.driver.StatePayload;
import io.envkeeper.server.dto.CaptureResponse;
import io.envkeeper.server.dto.CreateSessionRequest;
import io.envkeeper.server.dto.EventResponse;
import io.envkeeper.server.dto.SessionResponse;
import io.envkeeper.server.dto.SnapshotResponse;
import io.envkeeper.server.session.SessionStartException;
import io.envkeeper.server.snapshot.SnapshotCaptureException;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin HTTP adapter over the {@link Supervisor}.
 * <p>
 * Responsibilities:
 *  - Parse method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Log every request through {@link RequestLogger}.
 * <p>
 * Path layout:
 *   - POST   /sessions                      create {kind, config}            201
 *   - GET    /sessions[?all=true]           list active (or all) sessions
 *   - GET    /sessions/{id}                 one session
 *   - DELETE /sessions/{id}                 teardown (idempotent)
 *   - POST   /sessions/{id}/snapshots       capture; for "global" the body, if any, is the state
 *   - GET    /sessions/{id}/events?after=n  events with id &gt; n
 *   - GET    /snapshots/{id}                payload (base64) + manifest
 *   - GET    /snapshots/{id}/chain          manifests back to the root
 *   - GET    /admin/health                  liveness
 * <p>
 * Status mapping: bad input 400, unknown id 404, wrong state 409, body too
 * large 413, driver failure on start/capture 502, anything else 500.
 * <p>
 * Supervisor calls block on driver calls, so requests run on Undertow worker
 * threads in blocking mode.
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final Supervisor supervisor;

    /** Result of one operation: status code and JSON body. */
    private record Reply(int status, Object body) {}

    @FunctionalInterface
    private interface Op {
        Reply run(byte[] body) throws Exception;
    }

    private static final class BodyTooLargeException extends RuntimeException {
        BodyTooLargeException() {
            super("request body too large");
        }
    }

    public WebServer(int port, Supervisor supervisor) {
        this.supervisor = supervisor;
        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(new BlockingHandler(this::route))
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    /** Bound port; useful when constructed with port 0. */
    public int port() {
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    // ---------- routing ----------

    private void route(HttpServerExchange ex) {
        String method = ex.getRequestMethod().toString();
        String path = ex.getRequestPath();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        String[] parts = path.replaceAll("^/+|/+$", "").split("/+");
        String p0 = parts.length > 0 ? parts[0] : "";

        if (parts.length == 2 && "admin".equals(p0) && "health".equals(parts[1])) {
            handle(ex, method, path, "GET", body -> new Reply(200, Map.of(
                    "status", "ok",
                    "activeSessions", supervisor.listSessions().size())));
        } else if ("sessions".equals(p0) && parts.length == 1) {
            if ("POST".equals(method)) {
                handle(ex, method, path, "POST", this::create);
            } else {
                handle(ex, method, path, "GET", body -> list(ex));
            }
        } else if ("sessions".equals(p0) && parts.length == 2) {
            String id = parts[1];
            if ("DELETE".equals(method)) {
                handle(ex, method, path, "DELETE", body -> new Reply(200, SessionResponse.from(supervisor.teardownSession(id))));
            } else {
                handle(ex, method, path, "GET", body -> new Reply(200, SessionResponse.from(supervisor.getSession(id))));
            }
        } else if ("sessions".equals(p0) && parts.length == 3 && "snapshots".equals(parts[2])) {
            handle(ex, method, path, "POST", body -> capture(ex, parts[1], body));
        } else if ("sessions".equals(p0) && parts.length == 3 && "events".equals(parts[2])) {
            handle(ex, method, path, "GET", body -> events(ex, parts[1]));
        } else if ("snapshots".equals(p0) && parts.length == 2) {
            handle(ex, method, path, "GET", body -> {
                Snapshot s = supervisor.restoreSnapshot(parts[1]);
                return new Reply(200, SnapshotResponse.from(s, supervisor.snapshotManifest(parts[1])));
            });
        } else if ("snapshots".equals(p0) && parts.length == 3 && "chain".equals(parts[2])) {
            handle(ex, method, path, "GET", body -> new Reply(200, supervisor.snapshotChain(parts[1])));
        } else {
            send(ex, 404, Map.of("error", "not found"));
            RequestLogger.logRequest(method, path, 404, 0, -1, null);
        }
    }

    // ---------- handlers ----------

    /** POST /sessions */
    private Reply create(byte[] body) throws Exception {
        CreateSessionRequest req = json.readValue(body, CreateSessionRequest.class);
        if (req == null) {
            throw new IllegalArgumentException("request body must be a JSON object");
        }
        SessionKind kind = SessionKind.fromWire(req.kind);
        Session s = supervisor.createSession(kind, req.config);
        return new Reply(201, SessionResponse.from(s));
    }

    /** GET /sessions[?all=true] */
    private Reply list(HttpServerExchange ex) {
        boolean all = Boolean.parseBoolean(firstOrNull(ex.getQueryParameters().get("all")));
        List<Session> sessions = all ? supervisor.listAllSessions() : supervisor.listSessions();
        return new Reply(200, sessions.stream().map(SessionResponse::from).toList());
    }

    /** POST /sessions/{id}/snapshots */
    private Reply capture(HttpServerExchange ex, String sessionId, byte[] body) {
        String snapshotId;
        if (SupervisorEvent.GLOBAL_SESSION_ID.equals(sessionId) && body.length > 0) {
            String contentType = ex.getRequestHeaders().getFirst(Headers.CONTENT_TYPE);
            snapshotId = supervisor.captureGlobal(new StatePayload(body, contentType));
        } else {
            snapshotId = supervisor.captureSnapshot(sessionId);
        }
        var dto = new CaptureResponse();
        dto.sessionId = sessionId;
        dto.snapshotId = snapshotId;
        return new Reply(201, dto);
    }

    /** GET /sessions/{id}/events?after=n */
    private Reply events(HttpServerExchange ex, String sessionId) {
        String afterStr = firstOrNull(ex.getQueryParameters().get("after"));
        long after = 0;
        if (afterStr != null && !afterStr.isBlank()) {
            after = Long.parseLong(afterStr.trim());
            if (after < 0) {
                throw new IllegalArgumentException("after must be >= 0");
            }
        }
        return new Reply(200, supervisor.events(sessionId, after).stream().map(EventResponse::from).toList());
    }

    // ---------- plumbing ----------

    private void handle(HttpServerExchange ex, String method, String path, String allowed, Op op) {
        if (!allowed.equals(method)) {
            send(ex, 405, Map.of("error", "method not allowed"));
            RequestLogger.logRequest(method, path, 405, 0, -1, null);
            return;
        }
        long start = System.nanoTime();
        int status;
        long opMs = -1L;
        Throwable error = null;
        try {
            byte[] body = readBody(ex);
            long opStart = System.nanoTime();
            Reply reply = op.run(body);
            opMs = (System.nanoTime() - opStart) / 1_000_000L;
            status = reply.status();
            send(ex, status, reply.body());
        } catch (Exception e) {
            status = statusFor(e);
            error = e;
            send(ex, status, errorBody(e));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(method, path, ex.getStatusCode(), totalMs, opMs, error);
        }
    }

    private static byte[] readBody(HttpServerExchange ex) throws IOException {
        InputStream in = ex.getInputStream();
        byte[] data = in.readNBytes(MAX_BODY_BYTES + 1);
        if (data.length > MAX_BODY_BYTES) {
            throw new BodyTooLargeException();
        }
        return data;
    }

    static int statusFor(Throwable e) {
        if (e instanceof SessionNotFoundException || e instanceof SnapshotNotFoundException) return 404;
        if (e instanceof BodyTooLargeException) return 413;
        if (e instanceof JsonProcessingException || e instanceof IllegalArgumentException) return 400;
        if (e instanceof IllegalStateException) return 409;
        if (e instanceof SessionStartException || e instanceof SnapshotCaptureException) return 502;
        return 500;
    }

    private static Map<String, Object> errorBody(Throwable e) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (e instanceof JsonProcessingException) {
            body.put("error", "invalid JSON");
        } else {
            body.put("error", e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        body.put("type", e.getClass().getSimpleName());
        if (e instanceof SessionStartException sse) {
            body.put("sessionId", sse.sessionId());
        }
        return body;
    }

    private static String firstOrNull(Deque<String> deque) {
        return (deque == null || deque.isEmpty()) ? null : deque.getFirst();
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
