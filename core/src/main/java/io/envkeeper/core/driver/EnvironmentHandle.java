package io.envkeeper.core.driver;

/**
 * Opaque reference to one live environment instance.
 * <p>
 * Drivers implement this with whatever they need (process, websocket, kernel id).
 * The supervisor only passes it back to the driver that produced it.
 */
public interface EnvironmentHandle {

    /** Short human-readable description used in logs and event details. */
    String describe();
}
