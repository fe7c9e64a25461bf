package io.envkeeper.core;

/** Lookup miss in the snapshot store. */
public class SnapshotNotFoundException extends RuntimeException {
    private final String snapshotId;

    public SnapshotNotFoundException(String snapshotId) {
        super("snapshot not found: " + snapshotId);
        this.snapshotId = snapshotId;
    }

    public String snapshotId() {
        return snapshotId;
    }
}
