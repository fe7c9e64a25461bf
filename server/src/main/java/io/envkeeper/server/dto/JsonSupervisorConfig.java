package io.envkeeper.server.dto;

/**
 * Shape of the optional --config JSON file. Absent fields keep their defaults.
 * Example:
 *   {
 *     "httpPort": 8080,
 *     "dataDir": "./data",
 *     "probeIntervalMs": 5000,
 *     "failureThreshold": 3
 *   }
 */
public class JsonSupervisorConfig {
    public Integer httpPort;
    public String dataDir;
    public Long probeIntervalMs;
    public Long probeTimeoutMs;
    public Integer failureThreshold;
    public Integer recoveryAttempts;
    public Long recoveryBackoffMs;
    public Long adapterTimeoutMs;
    public Integer journalSnapshotEvery;
}
