package io.envkeeper.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.envkeeper.core.SessionKind;
import io.envkeeper.server.driver.DriverRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class WebServerTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir Path dir;

    private FakeDriver driver;
    private Supervisor supervisor;
    private WebServer web;
    private HttpClient http;
    private String base;

    @BeforeEach
    void start() {
        driver = new FakeDriver();
        supervisor = new Supervisor(TestConfigs.manualProbes(dir),
                new DriverRegistry().register(SessionKind.BROWSER, driver), null).open();
        web = new WebServer(0, supervisor);
        web.start();
        http = HttpClient.newHttpClient();
        base = "http://127.0.0.1:" + web.port();
    }

    @AfterEach
    void stop() {
        web.stop();
        supervisor.close();
    }

    @Test
    void session_lifecycle_over_http() throws Exception {
        var created = send("POST", "/sessions", "{\"kind\":\"browser\",\"config\":{\"profile\":\"default\"}}", null);
        assertEquals(201, created.statusCode());
        JsonNode s = JSON.readTree(created.body());
        String id = s.get("sessionId").asText();
        assertEquals("running", s.get("state").asText());
        assertEquals("default", s.get("config").get("profile").asText());

        var got = send("GET", "/sessions/" + id, null, null);
        assertEquals(200, got.statusCode());
        assertEquals(id, JSON.readTree(got.body()).get("sessionId").asText());

        assertEquals(1, JSON.readTree(send("GET", "/sessions", null, null).body()).size());

        var first = send("DELETE", "/sessions/" + id, null, null);
        assertEquals(200, first.statusCode());
        assertEquals("terminated", JSON.readTree(first.body()).get("state").asText());
        assertEquals(200, send("DELETE", "/sessions/" + id, null, null).statusCode());
        assertEquals(1, driver.stops.get());

        assertEquals(0, JSON.readTree(send("GET", "/sessions", null, null).body()).size());
        assertEquals(1, JSON.readTree(send("GET", "/sessions?all=true", null, null).body()).size());

        JsonNode events = JSON.readTree(send("GET", "/sessions/" + id + "/events", null, null).body());
        assertEquals("started", events.get(0).get("kind").asText());
        assertEquals("terminated", events.get(events.size() - 1).get("kind").asText());
        long firstId = events.get(0).get("eventId").asLong();
        JsonNode later = JSON.readTree(send("GET", "/sessions/" + id + "/events?after=" + firstId, null, null).body());
        assertEquals(events.size() - 1, later.size());
    }

    @Test
    void capture_then_fetch_snapshot_and_chain() throws Exception {
        String id = JSON.readTree(send("POST", "/sessions", "{\"kind\":\"browser\"}", null).body())
                .get("sessionId").asText();

        var cap1 = send("POST", "/sessions/" + id + "/snapshots", null, null);
        assertEquals(201, cap1.statusCode());
        String snap1 = JSON.readTree(cap1.body()).get("snapshotId").asText();
        driver.state = "{\"tabs\":[\"https://example.org\"]}";
        String snap2 = JSON.readTree(send("POST", "/sessions/" + id + "/snapshots", null, null).body())
                .get("snapshotId").asText();

        JsonNode snap = JSON.readTree(send("GET", "/snapshots/" + snap2, null, null).body());
        assertEquals(snap1, snap.get("parentSnapshotId").asText());
        assertEquals(driver.state,
                new String(Base64.getDecoder().decode(snap.get("payloadBase64").asText()), StandardCharsets.UTF_8));

        JsonNode chain = JSON.readTree(send("GET", "/snapshots/" + snap2 + "/chain", null, null).body());
        assertEquals(2, chain.size());

        assertEquals(404, send("GET", "/snapshots/" + "0".repeat(64), null, null).statusCode());
    }

    @Test
    void global_capture_takes_the_request_body() throws Exception {
        var resp = send("POST", "/sessions/global/snapshots", "open sessions: 0", "text/plain");
        assertEquals(201, resp.statusCode());
        String snapId = JSON.readTree(resp.body()).get("snapshotId").asText();

        JsonNode snap = JSON.readTree(send("GET", "/snapshots/" + snapId, null, null).body());
        assertEquals("global", snap.get("sessionId").asText());
        assertEquals("text/plain", snap.get("encoding").asText());

        JsonNode events = JSON.readTree(send("GET", "/sessions/global/events", null, null).body());
        assertEquals("snapshot_captured", events.get(events.size() - 1).get("kind").asText());
    }

    @Test
    void errors_map_to_status_codes() throws Exception {
        assertEquals(404, send("GET", "/sessions/sess-99", null, null).statusCode());
        assertEquals(404, send("GET", "/nowhere", null, null).statusCode());
        assertEquals(405, send("PUT", "/sessions/sess-1", "{}", null).statusCode());

        var badJson = send("POST", "/sessions", "{not json", null);
        assertEquals(400, badJson.statusCode());
        assertEquals("invalid JSON", JSON.readTree(badJson.body()).get("error").asText());

        assertEquals(400, send("POST", "/sessions", "{\"kind\":\"spaceship\"}", null).statusCode());
        // valid kind without a registered driver
        assertEquals(400, send("POST", "/sessions", "{\"kind\":\"notebook\"}", null).statusCode());

        driver.startFailures.set(2);
        var failed = send("POST", "/sessions", "{\"kind\":\"browser\"}", null);
        assertEquals(502, failed.statusCode());
        assertTrue(JSON.readTree(failed.body()).has("sessionId"));

        String id = JSON.readTree(send("POST", "/sessions", "{\"kind\":\"browser\"}", null).body())
                .get("sessionId").asText();
        driver.captureFails = true;
        assertEquals(502, send("POST", "/sessions/" + id + "/snapshots", null, null).statusCode());

        send("DELETE", "/sessions/" + id, null, null);
        assertEquals(409, send("POST", "/sessions/" + id + "/snapshots", null, null).statusCode());
        assertEquals(400, send("GET", "/sessions/" + id + "/events?after=-1", null, null).statusCode());
    }

    @Test
    void health_reports_active_sessions() throws Exception {
        send("POST", "/sessions", "{\"kind\":\"browser\"}", null);
        var resp = send("GET", "/admin/health", null, null);
        assertEquals(200, resp.statusCode());
        JsonNode body = JSON.readTree(resp.body());
        assertEquals("ok", body.get("status").asText());
        assertEquals(1, body.get("activeSessions").asInt());
    }

    @Test
    void status_mapping_covers_unexpected_errors() {
        assertEquals(500, WebServer.statusFor(new RuntimeException("boom")));
        assertEquals(409, WebServer.statusFor(new IllegalStateException("closed")));
    }

    private HttpResponse<String> send(String method, String path, String body, String contentType) throws Exception {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(base + path));
        b.method(method, body == null ? HttpRequest.BodyPublishers.noBody() : HttpRequest.BodyPublishers.ofString(body));
        b.header("Content-Type", contentType == null ? "application/json" : contentType);
        return http.send(b.build(), HttpResponse.BodyHandlers.ofString());
    }
}
