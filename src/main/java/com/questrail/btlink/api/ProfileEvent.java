package com.questrail.btlink.api;

import java.util.Objects;
import java.util.Optional;

/**
 * State change of a profile proxy service (headset, A2DP, ...).
 *
 * @param state   whether the proxy service connected or disconnected
 * @param profile platform profile identifier
 * @param proxy   the platform proxy handle; empty on disconnect
 */
public record ProfileEvent(State state, int profile, Optional<Object> proxy)
{
    public enum State {
        CONNECTED,
        DISCONNECTED
    }

    public ProfileEvent {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(proxy, "proxy");
    }
}
