// file: src/main/java/io/envkeeper/storage/SnapshotStore.java
package io.envkeeper.storage;

import io.envkeeper.core.Snapshot;
import io.envkeeper.storage.record.SnapshotManifest;

import java.util.List;

/**
 * Content-addressed, write-once store of run-state snapshots.
 * <p>
 * Contract:
 *  - put() is idempotent: writing an id that already exists is a no-op.
 *  - A snapshot's parent must already be stored when the child is put, so
 *    parent chains form a DAG by construction.
 *  - Nothing is ever deleted here; retention belongs to an outside process.
 *  - Named refs ("global") point at the head of a chain that has no owning session.
 */
public interface SnapshotStore {

    /**
     * Persist a snapshot.
     *
     * @return true if written now, false if the id was already present
     * @throws IllegalArgumentException if the id does not match the contents
     *                                  or the parent is unknown
     */
    boolean put(Snapshot snapshot);

    /**
     * @throws io.envkeeper.core.SnapshotNotFoundException if unknown
     * @throws io.envkeeper.core.CorruptSnapshotException  if the stored bytes no longer match the id
     */
    Snapshot get(String snapshotId);

    SnapshotManifest manifest(String snapshotId);

    boolean contains(String snapshotId);

    /** The snapshot's manifest followed by its ancestors, ending at the root. */
    List<SnapshotManifest> chain(String snapshotId);

    /** Current value of a named ref, or null. */
    String readRef(String name);

    void writeRef(String name, String snapshotId);
}
