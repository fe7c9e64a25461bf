package io.envkeeper.server.snapshot;

import io.envkeeper.core.driver.CaptureException;
import io.envkeeper.core.driver.StatePayload;

/** Agent-supplied serializer for agent-wide run state (the "global" snapshot chain). */
@FunctionalInterface
public interface RunStateSerializer {
    StatePayload serialize() throws CaptureException;
}
