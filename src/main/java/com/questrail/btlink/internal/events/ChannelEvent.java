package com.questrail.btlink.internal.events;

import com.questrail.btlink.api.PeerId;
import com.questrail.btlink.transport.ConnectionClosedException;
import com.questrail.btlink.transport.DuplexChannel;
import com.questrail.btlink.transport.TransportException;

import java.time.Instant;
import java.util.Objects;

/**
 * ChannelEvent
 * -----------------------------------------------------------------------------
 * Outcomes of channel-producing operations and of the active channel itself.
 *
 * <p>Every event names the attempt (listen or connect) or the connection
 * generation it belongs to. The reducer compares that tag with the current
 * state and ignores outcomes of attempts it has already abandoned.</p>
 */
public sealed interface ChannelEvent extends LinkManagerEvent
        permits ChannelEvent.ChannelOpened,
                ChannelEvent.ListenFailed,
                ChannelEvent.ListenRetryDue,
                ChannelEvent.ConnectFailed,
                ChannelEvent.ConnectCancelled,
                ChannelEvent.ChannelTerminated
{
    /** Which operation produced a channel. */
    enum Origin {
        /** Accepted by a listen attempt. */
        INBOUND,
        /** Produced by a connect attempt. */
        OUTBOUND
    }

    /** A listen or connect attempt produced a channel. */
    final class ChannelOpened extends LinkManagerEvent.Base implements ChannelEvent {
        private final Origin origin;
        private final long attempt;
        private final DuplexChannel channel;
        private final PeerId peer;

        public ChannelOpened(Instant timestamp, Origin origin, long attempt,
                             DuplexChannel channel, PeerId peer) {
            super(timestamp);
            this.origin = Objects.requireNonNull(origin, "origin");
            this.attempt = attempt;
            this.channel = Objects.requireNonNull(channel, "channel");
            this.peer = Objects.requireNonNull(peer, "peer");
        }

        public Origin origin() {
            return origin;
        }

        public long attempt() {
            return attempt;
        }

        public DuplexChannel channel() {
            return channel;
        }

        public PeerId peer() {
            return peer;
        }

        @Override
        public String toString() {
            return "ChannelOpened[" + origin + " #" + attempt + " " + peer + "]";
        }
    }

    /** A listen attempt failed without accepting a connection. */
    final class ListenFailed extends LinkManagerEvent.Base implements ChannelEvent {
        private final long attempt;
        private final Throwable cause;

        public ListenFailed(Instant timestamp, long attempt, Throwable cause) {
            super(timestamp);
            this.attempt = attempt;
            this.cause = Objects.requireNonNull(cause, "cause");
        }

        public long attempt() {
            return attempt;
        }

        public Throwable cause() {
            return cause;
        }

        @Override
        public String toString() {
            return "ListenFailed[#" + attempt + " " + cause + "]";
        }
    }

    /** The back-off delay of a scheduled listen retry elapsed. */
    final class ListenRetryDue extends LinkManagerEvent.Base implements ChannelEvent {
        private final long token;

        public ListenRetryDue(Instant timestamp, long token) {
            super(timestamp);
            this.token = token;
        }

        public long token() {
            return token;
        }

        @Override
        public String toString() {
            return "ListenRetryDue[#" + token + "]";
        }
    }

    /** An outbound connection attempt failed. */
    final class ConnectFailed extends LinkManagerEvent.Base implements ChannelEvent {
        private final long attempt;
        private final Throwable cause;

        public ConnectFailed(Instant timestamp, long attempt, Throwable cause) {
            super(timestamp);
            this.attempt = attempt;
            this.cause = Objects.requireNonNull(cause, "cause");
        }

        public long attempt() {
            return attempt;
        }

        public Throwable cause() {
            return cause;
        }

        @Override
        public String toString() {
            return "ConnectFailed[#" + attempt + " " + cause + "]";
        }
    }

    /** The caller abandoned an outbound connection attempt. */
    final class ConnectCancelled extends LinkManagerEvent.Base implements ChannelEvent {
        private final long attempt;

        public ConnectCancelled(Instant timestamp, long attempt) {
            super(timestamp);
            this.attempt = attempt;
        }

        public long attempt() {
            return attempt;
        }

        @Override
        public String toString() {
            return "ConnectCancelled[#" + attempt + "]";
        }
    }

    /** The read loop of an active connection ended with {@code cause}. */
    final class ChannelTerminated extends LinkManagerEvent.Base implements ChannelEvent {
        private final long generation;
        private final TransportException cause;

        public ChannelTerminated(Instant timestamp, long generation, TransportException cause) {
            super(timestamp);
            this.generation = generation;
            this.cause = Objects.requireNonNull(cause, "cause");
        }

        public long generation() {
            return generation;
        }

        public TransportException cause() {
            return cause;
        }

        /** True when the channel was closed rather than broken. */
        public boolean closedByPeer() {
            return cause instanceof ConnectionClosedException;
        }

        @Override
        public String toString() {
            return "ChannelTerminated[#" + generation + " " + cause.getClass().getSimpleName() + "]";
        }
    }
}
