package io.envkeeper.core.driver;

/** Outcome of a single health probe that returned in time. */
public enum HealthStatus {
    HEALTHY,
    UNRESPONSIVE
}
