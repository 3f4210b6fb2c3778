package com.questrail.btlink.internal.events;

import com.questrail.btlink.api.PeerId;

import java.time.Instant;
import java.util.Objects;

/**
 * CommandEvent
 * -----------------------------------------------------------------------------
 * Events that originate from the caller of the connection manager.
 */
public sealed interface CommandEvent extends LinkManagerEvent
        permits CommandEvent.ListenRequested,
                CommandEvent.ConnectRequested,
                CommandEvent.DisconnectRequested,
                CommandEvent.Stopped
{
    /** Arm listening if possible. */
    final class ListenRequested extends LinkManagerEvent.Base implements CommandEvent {
        public ListenRequested(Instant timestamp) {
            super(timestamp);
        }
    }

    /**
     * An outbound connection attempt to {@code peer} started. The attempt id
     * tags the eventual outcome.
     */
    final class ConnectRequested extends LinkManagerEvent.Base implements CommandEvent {
        private final PeerId peer;
        private final long attempt;

        public ConnectRequested(Instant timestamp, PeerId peer, long attempt) {
            super(timestamp);
            this.peer = Objects.requireNonNull(peer, "peer");
            this.attempt = attempt;
        }

        public PeerId peer() {
            return peer;
        }

        public long attempt() {
            return attempt;
        }

        @Override
        public String toString() {
            return "ConnectRequested[" + peer + " #" + attempt + "]";
        }
    }

    /** Drop everything: active connection, pending attempts, listening. */
    final class DisconnectRequested extends LinkManagerEvent.Base implements CommandEvent {
        public DisconnectRequested(Instant timestamp) {
            super(timestamp);
        }
    }

    /** The manager is shutting down. */
    final class Stopped extends LinkManagerEvent.Base implements CommandEvent {
        public Stopped(Instant timestamp) {
            super(timestamp);
        }
    }
}
