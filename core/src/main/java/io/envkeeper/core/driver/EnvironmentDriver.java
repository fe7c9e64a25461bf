// file: src/main/java/io/envkeeper/core/driver/EnvironmentDriver.java
package io.envkeeper.core.driver;

import java.time.Duration;
import java.util.Map;

/**
 * Capability contract every dynamic environment (browser, notebook kernel,
 * shell, ...) implements to be supervised.
 * <p>
 * Contract:
 *  - start(): may be retried once by the caller when it failed without
 *    returning a handle, so it must tolerate a second attempt.
 *  - stop(): best effort. The supervisor treats a failure as "already gone".
 *  - captureState(): returns the full state as bytes plus an encoding tag.
 *  - restoreState(): builds a fresh live instance from a captured payload.
 *  - healthCheck(): must not block past {@code timeout}. The supervisor also
 *    enforces a hard deadline of its own, whatever the driver does.
 * <p>
 * Implementations are registered per {@code SessionKind} at process startup.
 * One handle owns one environment's live resources.
 */
public interface EnvironmentDriver {

    EnvironmentHandle start(Map<String, String> config) throws StartupException;

    void stop(EnvironmentHandle handle) throws ShutdownException;

    StatePayload captureState(EnvironmentHandle handle) throws CaptureException;

    EnvironmentHandle restoreState(StatePayload payload) throws RestoreException;

    HealthStatus healthCheck(EnvironmentHandle handle, Duration timeout) throws ProbeException;
}
