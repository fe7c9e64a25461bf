// file: src/main/java/io/envkeeper/storage/BoundedEmissionDeduper.java
package io.envkeeper.storage;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Capacity-bounded emission deduper.
 * <p>
 * Semantics:
 *  - firstTime(key) returns true exactly once per key while the key is among
 *    the most recent {@code capacity} keys.
 *  - Oldest keys are evicted first (insertion order).
 * <p>
 * Keys embed a session version, and versions only grow, so a key old enough to
 * be evicted can no longer be produced by a live transition. Capacity only has
 * to cover the window in which retries and races happen.
 */
public final class BoundedEmissionDeduper implements EmissionDeduper {

    private final int capacity;
    private final Map<String, Boolean> seen;

    public BoundedEmissionDeduper(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        this.seen = new LinkedHashMap<>(Math.min(capacity, 1024), 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > BoundedEmissionDeduper.this.capacity;
            }
        };
    }

    @Override
    public synchronized boolean firstTime(String key) {
        Objects.requireNonNull(key, "key");
        return seen.putIfAbsent(key, Boolean.TRUE) == null;
    }

    @Override
    public synchronized void remember(String key) {
        Objects.requireNonNull(key, "key");
        seen.put(key, Boolean.TRUE);
    }

    @Override
    public synchronized void forget(String key) {
        seen.remove(key);
    }

    public synchronized int size() {
        return seen.size();
    }
}
