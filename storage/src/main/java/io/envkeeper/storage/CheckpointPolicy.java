package io.envkeeper.storage;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Checkpoint policy that asks for a full table checkpoint after every N
 * journaled mutations.
 * <p>
 * Bounds worst-case replay length on restart. Does not look at file size or time.
 */
public final class CheckpointPolicy {
    private final int everyMutations;
    private final AtomicInteger sinceLast = new AtomicInteger();

    public CheckpointPolicy(int everyMutations) {
        if (everyMutations <= 0) throw new IllegalArgumentException("everyMutations must be > 0");
        this.everyMutations = everyMutations;
    }

    /** Call after each durable mutation. Returns true (and resets) when a checkpoint is due. */
    public boolean mutationRecorded() {
        if (sinceLast.incrementAndGet() >= everyMutations) {
            sinceLast.set(0);
            return true;
        }
        return false;
    }

    public void reset() {
        sinceLast.set(0);
    }

    public int everyMutations() {
        return everyMutations;
    }
}
