package com.questrail.btlink.api;

import java.util.Objects;

/**
 * LinkEvent
 * -----------------------------------------------------------------------------
 * Link-layer (ACL) notification for a remote device.
 *
 * <p>Link events are independent of the socket lifecycle: the platform may
 * report a link going up before an accept completes, or a link going down
 * before (or after) the socket read fails. Consumers must therefore treat them
 * as hints that converge with socket-level outcomes, not as the outcomes
 * themselves.</p>
 */
public record LinkEvent(Kind kind, PeerId peer)
{
    public enum Kind {
        /** The low-level link to the peer came up. */
        CONNECTED,

        /** The peer (or the local stack) asked for the link to be torn down. */
        DISCONNECT_REQUESTED,

        /** The low-level link to the peer is gone. */
        DISCONNECTED
    }

    public LinkEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(peer, "peer");
    }

    public static LinkEvent connected(PeerId peer) {
        return new LinkEvent(Kind.CONNECTED, peer);
    }

    public static LinkEvent disconnectRequested(PeerId peer) {
        return new LinkEvent(Kind.DISCONNECT_REQUESTED, peer);
    }

    public static LinkEvent disconnected(PeerId peer) {
        return new LinkEvent(Kind.DISCONNECTED, peer);
    }
}
