// file: src/main/java/io/envkeeper/storage/EventLog.java
package io.envkeeper.storage;

import io.envkeeper.core.SupervisorEvent;

import java.util.List;

/**
 * Append-only, durable log of supervisor events.
 * <p>
 * Semantics:
 *  - append() is durable before returning.
 *  - Events are never removed or rewritten; consumers read, they do not take.
 *  - readAll() returns entries in append order, which per session is eventId order.
 */
public interface EventLog extends AutoCloseable {

    void append(SupervisorEvent event, String opId);

    List<Entry> readAll();

    @Override
    void close();

    /** A logged event and the emission key it was deduplicated on. */
    record Entry(SupervisorEvent event, String opId) {}
}
