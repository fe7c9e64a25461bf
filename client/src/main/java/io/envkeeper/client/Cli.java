package io.envkeeper.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command-line client for a running EnvKeeper supervisor.
 *
 * Usage:
 *   envkeeper-cli [--base-url http://host:port] create <kind> [key=value ...]
 *   envkeeper-cli [--base-url http://host:port] get <sessionId>
 *   envkeeper-cli [--base-url http://host:port] list [--all]
 *   envkeeper-cli [--base-url http://host:port] teardown <sessionId>
 *   envkeeper-cli [--base-url http://host:port] capture <sessionId|global>
 *   envkeeper-cli [--base-url http://host:port] restore <snapshotId>
 *   envkeeper-cli [--base-url http://host:port] chain <snapshotId>
 *   envkeeper-cli [--base-url http://host:port] events <sessionId|global> [afterEventId]
 *
 * Examples:
 *   envkeeper-cli create notebook kernel=python3
 *   envkeeper-cli capture sess-1
 *   envkeeper-cli events sess-1 4
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";
    private static final ObjectMapper JSON = new ObjectMapper();

    private final HttpClient http;
    private final String baseUrl;

    private Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                usageAndExit("missing command");
            }

            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String baseUrl = parsed.getKey();
            String[] rest = parsed.getValue();

            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            String cmd = rest[0];
            Cli cli = new Cli(baseUrl);

            switch (cmd) {
                case "create" -> {
                    if (rest.length < 2) {
                        usageAndExit("create requires <kind>");
                    }
                    cli.create(rest[1], parseConfig(Arrays.copyOfRange(rest, 2, rest.length)));
                }
                case "get" -> {
                    requireArgs(rest, 2, "get requires <sessionId>");
                    cli.print(cli.call("GET", "/sessions/" + segment(rest[1]), null, null, 200));
                }
                case "list" -> {
                    boolean all = rest.length == 2 && "--all".equals(rest[1]);
                    if (rest.length > 2 || (rest.length == 2 && !all)) {
                        usageAndExit("list takes only --all");
                    }
                    cli.print(cli.call("GET", all ? "/sessions?all=true" : "/sessions", null, null, 200));
                }
                case "teardown" -> {
                    requireArgs(rest, 2, "teardown requires <sessionId>");
                    cli.print(cli.call("DELETE", "/sessions/" + segment(rest[1]), null, null, 200));
                }
                case "capture" -> {
                    requireArgs(rest, 2, "capture requires <sessionId|global>");
                    cli.print(cli.call("POST", "/sessions/" + segment(rest[1]) + "/snapshots", null, null, 201));
                }
                case "restore" -> {
                    requireArgs(rest, 2, "restore requires <snapshotId>");
                    cli.restore(rest[1]);
                }
                case "chain" -> {
                    requireArgs(rest, 2, "chain requires <snapshotId>");
                    cli.print(cli.call("GET", "/snapshots/" + segment(rest[1]) + "/chain", null, null, 200));
                }
                case "events" -> {
                    if (rest.length != 2 && rest.length != 3) {
                        usageAndExit("events requires <sessionId|global> [afterEventId]");
                    }
                    String query = rest.length == 3 ? "?after=" + parseAfter(rest[2]) : "";
                    cli.print(cli.call("GET", "/sessions/" + segment(rest[1]) + "/events" + query, null, null, 200));
                }
                default -> usageAndExit("unknown command: " + cmd);
            }
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 3) {
                usageAndExit("--base-url requires a value");
            }
            String baseUrl = args[1];
            String[] rest = new String[args.length - 2];
            System.arraycopy(args, 2, rest, 0, rest.length);
            return Map.entry(baseUrl, rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    /** "key=value" pairs into a start config; later keys win. */
    static Map<String, String> parseConfig(String[] pairs) {
        Map<String, String> config = new LinkedHashMap<>();
        for (String pair : pairs) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                throw new CliException("config entries must look like key=value: " + pair);
            }
            config.put(pair.substring(0, eq), pair.substring(eq + 1));
        }
        return config;
    }

    static long parseAfter(String s) {
        try {
            long after = Long.parseLong(s);
            if (after < 0) {
                throw new CliException("afterEventId must be >= 0");
            }
            return after;
        } catch (NumberFormatException e) {
            throw new CliException("afterEventId must be a number: " + s);
        }
    }

    private void create(String kind, Map<String, String> config) throws Exception {
        ObjectNode body = JSON.createObjectNode();
        body.put("kind", kind);
        ObjectNode cfg = body.putObject("config");
        config.forEach(cfg::put);
        print(call("POST", "/sessions", JSON.writeValueAsString(body), "application/json", 201));
    }

    /** Fetch a snapshot and print its state as text when it is textual. */
    private void restore(String snapshotId) throws Exception {
        JsonNode snap = call("GET", "/snapshots/" + segment(snapshotId), null, null, 200);
        String encoding = snap.path("encoding").asText("");
        byte[] payload = Base64.getDecoder().decode(snap.path("payloadBase64").asText(""));
        System.out.println("snapshot " + snap.path("snapshotId").asText()
                + " of " + snap.path("sessionId").asText() + " (" + encoding + ", " + payload.length + " bytes)");
        if (encoding.startsWith("text/") || encoding.equals("application/json")) {
            System.out.println(new String(payload, StandardCharsets.UTF_8));
        }
    }

    private JsonNode call(String method, String path, String body, String contentType, int expected) throws Exception {
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body));
        if (contentType != null) {
            b.header("Content-Type", contentType);
        }

        HttpResponse<String> resp = http.send(b.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != expected) {
            throw new CliException(method + " " + path + " failed (" + resp.statusCode() + "): " + errorOf(resp.body()));
        }
        return JSON.readTree(resp.body());
    }

    private void print(JsonNode node) throws Exception {
        System.out.println(JSON.writerWithDefaultPrettyPrinter().writeValueAsString(node));
    }

    private static String errorOf(String body) {
        try {
            JsonNode n = JSON.readTree(body);
            return n.hasNonNull("error") ? n.get("error").asText() : body;
        } catch (Exception e) {
            return body;
        }
    }

    private static String segment(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static void requireArgs(String[] rest, int n, String msg) {
        if (rest.length != n) {
            usageAndExit(msg);
        }
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  envkeeper-cli [--base-url http://host:port] create <kind> [key=value ...]
                  envkeeper-cli [--base-url http://host:port] get <sessionId>
                  envkeeper-cli [--base-url http://host:port] list [--all]
                  envkeeper-cli [--base-url http://host:port] teardown <sessionId>
                  envkeeper-cli [--base-url http://host:port] capture <sessionId|global>
                  envkeeper-cli [--base-url http://host:port] restore <snapshotId>
                  envkeeper-cli [--base-url http://host:port] chain <snapshotId>
                  envkeeper-cli [--base-url http://host:port] events <sessionId|global> [afterEventId]
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
