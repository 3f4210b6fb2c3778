package com.questrail.btlink.observability;

import com.questrail.btlink.internal.events.LinkManagerEvent;
import com.questrail.btlink.internal.state.LinkIntents;
import com.questrail.btlink.internal.state.LinkManagerState;

import java.time.Instant;

/**
 * Record representing a state transition in the connection manager.
 */
public record LinkStateTransitionEvent(
    Instant timestamp,
    LinkManagerState oldState,
    LinkManagerState newState,
    LinkManagerEvent triggeringEvent,
    LinkIntents resultingIntents
) {
    /**
     * Checks if the lifecycle phase changed during this transition.
     */
    public boolean isPhaseChange() {
        return oldState.phase() != newState.phase();
    }

    /**
     * Checks if the published connection status changed during this transition.
     */
    public boolean isStatusChange() {
        return !oldState.status().equals(newState.status());
    }
}
