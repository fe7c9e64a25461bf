// file: src/main/java/io/envkeeper/core/Snapshot.java
package io.envkeeper.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable, content-addressed serialization of run state at one instant.
 * <p>
 * Fields:
 *  - snapshotId:       {@link SnapshotIds#compute} over (sessionId, encoding, parent, payload).
 *  - sessionId:        owning session, or "global" for agent-wide memory.
 *  - capturedAtMillis: capture time; not part of the id.
 *  - encoding:         declared encoding tag of the payload (e.g. "application/json").
 *  - payload:          opaque bytes.
 *  - parentSnapshotId: previous snapshot of the same owner, or null for a root.
 * <p>
 * Invariants:
 *  - Payload bytes are copied on the way in and on the way out.
 *  - Snapshots are write-once; nothing in this codebase mutates one after creation.
 */
public final class Snapshot {
    private final String snapshotId;
    private final String sessionId;
    private final long capturedAtMillis;
    private final String encoding;
    private final byte[] payload;
    private final String parentSnapshotId;

    public Snapshot(String snapshotId,
                    String sessionId,
                    long capturedAtMillis,
                    String encoding,
                    byte[] payload,
                    String parentSnapshotId) {
        this.snapshotId = Objects.requireNonNull(snapshotId, "snapshotId");
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.capturedAtMillis = capturedAtMillis;
        this.encoding = Objects.requireNonNull(encoding, "encoding");
        Objects.requireNonNull(payload, "payload");
        this.payload = Arrays.copyOf(payload, payload.length);
        this.parentSnapshotId = parentSnapshotId;
    }

    /** Build a snapshot and derive its id from the contents. */
    public static Snapshot of(String sessionId, long capturedAtMillis, String encoding,
                              byte[] payload, String parentSnapshotId) {
        String id = SnapshotIds.compute(sessionId, encoding, parentSnapshotId, payload);
        return new Snapshot(id, sessionId, capturedAtMillis, encoding, payload, parentSnapshotId);
    }

    public String snapshotId() { return snapshotId; }

    public String sessionId() { return sessionId; }

    public long capturedAtMillis() { return capturedAtMillis; }

    public String encoding() { return encoding; }

    public byte[] payload() { return Arrays.copyOf(payload, payload.length); }

    public int payloadSize() { return payload.length; }

    public String parentSnapshotId() { return parentSnapshotId; }

    /** True if the stored id still matches the contents. */
    public boolean verify() {
        return snapshotId.equals(SnapshotIds.compute(sessionId, encoding, parentSnapshotId, payload));
    }

    @Override
    public String toString() {
        return "Snapshot{" + snapshotId + ", session=" + sessionId + ", encoding=" + encoding
                + ", bytes=" + payload.length + ", parent=" + parentSnapshotId + '}';
    }
}
