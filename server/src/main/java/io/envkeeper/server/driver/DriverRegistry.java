package io.envkeeper.server.driver;

import io.envkeeper.core.SessionKind;
import io.envkeeper.core.driver.EnvironmentDriver;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Lookup table from session kind to the driver that owns environments of that kind.
 * Filled once at process startup, read concurrently afterwards.
 */
public final class DriverRegistry {
    private final Map<SessionKind, EnvironmentDriver> drivers = new EnumMap<>(SessionKind.class);

    public DriverRegistry register(SessionKind kind, EnvironmentDriver driver) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(driver, "driver");
        synchronized (drivers) {
            if (drivers.putIfAbsent(kind, driver) != null) {
                throw new IllegalStateException("driver already registered for kind " + kind.wireName());
            }
        }
        return this;
    }

    /**
     * @throws IllegalArgumentException if no driver handles this kind
     */
    public EnvironmentDriver driverFor(SessionKind kind) {
        EnvironmentDriver d;
        synchronized (drivers) {
            d = drivers.get(kind);
        }
        if (d == null) {
            throw new IllegalArgumentException("no driver registered for kind " + kind.wireName());
        }
        return d;
    }

    public Set<SessionKind> kinds() {
        synchronized (drivers) {
            return Set.copyOf(drivers.keySet());
        }
    }
}
