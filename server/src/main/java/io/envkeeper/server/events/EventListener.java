package io.envkeeper.server.events;

import io.envkeeper.core.SupervisorEvent;

/** Push subscriber. Called in event order on a single dispatch thread. */
@FunctionalInterface
public interface EventListener {
    void onEvent(SupervisorEvent event);
}
