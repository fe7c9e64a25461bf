package io.envkeeper.server;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.envkeeper.server.dto.JsonSupervisorConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Supervisor process configuration.
 * <p>
 * Sources, later wins:
 *  1) built-in defaults (good for local dev),
 *  2) the JSON file named by --config,
 *  3) explicit command-line flags.
 * <p>
 *  - httpPort:             HTTP API port
 *  - dataDir:              root of journals, event log and snapshot store
 *  - probeInterval:        delay between health probes of one session
 *  - probeTimeout:         deadline of a single health check
 *  - failureThreshold:     consecutive failed probes that make a degraded session lost
 *  - recoveryAttempts:     restore attempts before terminal failure
 *  - recoveryBackoff:      delay after the first failed attempt, doubled each time
 *  - adapterTimeout:       deadline for start/stop/capture/restore driver calls
 *  - journalSnapshotEvery: session mutations between full table snapshots
 */
public record SupervisorConfig(
        int httpPort,
        String dataDir,
        Duration probeInterval,
        Duration probeTimeout,
        int failureThreshold,
        int recoveryAttempts,
        Duration recoveryBackoff,
        Duration adapterTimeout,
        int journalSnapshotEvery
) {

    public SupervisorConfig {
        if (httpPort < 0 || httpPort > 65535) throw new IllegalArgumentException("http-port out of range: " + httpPort);
        if (dataDir == null || dataDir.isBlank()) throw new IllegalArgumentException("data-dir must not be empty");
        requirePositive("probe-interval-ms", probeInterval);
        requirePositive("probe-timeout-ms", probeTimeout);
        if (failureThreshold <= 0) throw new IllegalArgumentException("failure-threshold must be > 0");
        if (recoveryAttempts <= 0) throw new IllegalArgumentException("recovery-attempts must be > 0");
        if (recoveryBackoff.isNegative()) throw new IllegalArgumentException("recovery-backoff-ms must be >= 0");
        requirePositive("adapter-timeout-ms", adapterTimeout);
        if (journalSnapshotEvery <= 0) throw new IllegalArgumentException("journal-snapshot-every must be > 0");
    }

    public static SupervisorConfig defaults() {
        return new SupervisorConfig(
                8080,
                "./data",
                Duration.ofSeconds(5),
                Duration.ofSeconds(2),
                3,
                3,
                Duration.ofSeconds(1),
                Duration.ofSeconds(30),
                100
        );
    }

    public Path dataPath() {
        return Path.of(dataDir);
    }

    public SupervisorConfig withDataDir(String dir) {
        return new SupervisorConfig(httpPort, dir, probeInterval, probeTimeout, failureThreshold,
                recoveryAttempts, recoveryBackoff, adapterTimeout, journalSnapshotEvery);
    }

    /**
     * CLI entry: parse, print help or errors and exit like a normal command.
     */
    public static SupervisorConfig fromArgs(String[] args) {
        for (String a : args) {
            if ("--help".equals(a) || "-h".equals(a)) {
                printHelpAndExit();
            }
        }
        try {
            return parse(args);
        } catch (IllegalArgumentException | UncheckedIOException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
            return null; // unreachable
        }
    }

    /**
     * Parse flags on top of defaults and the optional --config file.
     *
     * @throws IllegalArgumentException for unknown flags, missing or invalid values
     */
    public static SupervisorConfig parse(String[] args) {
        Builder b = new Builder(defaults());

        // the file sits below explicit flags, so load it first
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i]) || "-c".equals(args[i])) {
                b.apply(readJson(Path.of(value(args, i))));
            }
        }

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config", "-c" -> i++;
                case "--http-port", "-p" -> b.httpPort = parseInt(args[i], value(args, i++));
                case "--data-dir", "-d" -> b.dataDir = value(args, i++);
                case "--probe-interval-ms" -> b.probeInterval = millis(args[i], value(args, i++));
                case "--probe-timeout-ms" -> b.probeTimeout = millis(args[i], value(args, i++));
                case "--failure-threshold" -> b.failureThreshold = parseInt(args[i], value(args, i++));
                case "--recovery-attempts" -> b.recoveryAttempts = parseInt(args[i], value(args, i++));
                case "--recovery-backoff-ms" -> b.recoveryBackoff = millis(args[i], value(args, i++));
                case "--adapter-timeout-ms" -> b.adapterTimeout = millis(args[i], value(args, i++));
                case "--journal-snapshot-every" -> b.journalSnapshotEvery = parseInt(args[i], value(args, i++));
                default -> throw new IllegalArgumentException("unknown option: " + args[i]);
            }
        }
        return b.build();
    }

    static JsonSupervisorConfig readJson(Path path) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        try {
            return mapper.readValue(path.toFile(), JsonSupervisorConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to load config from " + path + ": " + e.getMessage(), e);
        }
    }

    private static final class Builder {
        int httpPort;
        String dataDir;
        Duration probeInterval;
        Duration probeTimeout;
        int failureThreshold;
        int recoveryAttempts;
        Duration recoveryBackoff;
        Duration adapterTimeout;
        int journalSnapshotEvery;

        Builder(SupervisorConfig base) {
            httpPort = base.httpPort();
            dataDir = base.dataDir();
            probeInterval = base.probeInterval();
            probeTimeout = base.probeTimeout();
            failureThreshold = base.failureThreshold();
            recoveryAttempts = base.recoveryAttempts();
            recoveryBackoff = base.recoveryBackoff();
            adapterTimeout = base.adapterTimeout();
            journalSnapshotEvery = base.journalSnapshotEvery();
        }

        void apply(JsonSupervisorConfig j) {
            if (j.httpPort != null) httpPort = j.httpPort;
            if (j.dataDir != null) dataDir = j.dataDir;
            if (j.probeIntervalMs != null) probeInterval = Duration.ofMillis(j.probeIntervalMs);
            if (j.probeTimeoutMs != null) probeTimeout = Duration.ofMillis(j.probeTimeoutMs);
            if (j.failureThreshold != null) failureThreshold = j.failureThreshold;
            if (j.recoveryAttempts != null) recoveryAttempts = j.recoveryAttempts;
            if (j.recoveryBackoffMs != null) recoveryBackoff = Duration.ofMillis(j.recoveryBackoffMs);
            if (j.adapterTimeoutMs != null) adapterTimeout = Duration.ofMillis(j.adapterTimeoutMs);
            if (j.journalSnapshotEvery != null) journalSnapshotEvery = j.journalSnapshotEvery;
        }

        SupervisorConfig build() {
            return new SupervisorConfig(httpPort, dataDir, probeInterval, probeTimeout, failureThreshold,
                    recoveryAttempts, recoveryBackoff, adapterTimeout, journalSnapshotEvery);
        }
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("missing value for option: " + args[i]);
        }
        return args[i + 1];
    }

    private static int parseInt(String flag, String v) {
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + flag.substring(2) + ": " + v, e);
        }
    }

    private static Duration millis(String flag, String v) {
        try {
            return Duration.ofMillis(Long.parseLong(v));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + flag.substring(2) + ": " + v, e);
        }
    }

    private static void requirePositive(String name, Duration d) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: envkeeper-server [options]

            Options:
              --http-port,      -p   HTTP port (default: 8080)
              --data-dir,       -d   Data directory (default: ./data)
              --probe-interval-ms    Delay between health probes (default: 5000)
              --probe-timeout-ms     Deadline of one health check (default: 2000)
              --failure-threshold    Failed probes before a session is lost (default: 3)
              --recovery-attempts    Restore attempts before terminal failure (default: 3)
              --recovery-backoff-ms  First delay between restore attempts, doubled each time (default: 1000)
              --adapter-timeout-ms   Deadline for start/stop/capture/restore (default: 30000)
              --journal-snapshot-every
                                     Session mutations between table snapshots (default: 100)
              --config,         -c   JSON file with any of the above (flags win)
              --help,           -h   Show this help message
            """);
        System.exit(0);
    }
}
