package com.questrail.btlink.internal.state;

import com.questrail.btlink.api.ConnectionStatus;
import com.questrail.btlink.api.PeerId;
import com.questrail.btlink.transport.DuplexChannel;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * LinkIntents
 * -----------------------------------------------------------------------------
 * Immutable, ordered list of execution intentions emitted by the
 * {@link LinkStateReducer}.
 *
 * <h2>Role in the architecture</h2>
 * {@code LinkIntents} is the bridge between pure transition logic and the
 * side-effecting executor that owns channels, multiplexers and subscriptions.
 * The reducer decides <b>what should happen next</b>; the executor decides
 * <b>how</b>.
 *
 * <h2>Ordering</h2>
 * Unlike a set of flags, link intents are executed in emission order. The
 * order is observable: a status published before listening is re-armed must
 * reach subscribers before {@code WAITING_FOR_CONNECTION}, and an old
 * connection must be released before a new one is bound.
 */
public final class LinkIntents
{
    /**
     * Enumerates the kinds of actions the connection manager may need to perform.
     */
    public enum Kind {
        /** Start one listen attempt. */
        ARM_LISTEN,

        /** Abandon the armed listen attempt. */
        CANCEL_LISTEN,

        /** Wrap a channel in a multiplexer and route its records to subscribers. */
        BIND,

        /** Release the active connection of a given generation. */
        CLOSE_ACTIVE,

        /** Close a channel that arrived too late to be bound. */
        DISCARD_CHANNEL,

        /** Publish a new connection status. */
        PUBLISH,

        /** Arm a listen retry after a delay. */
        SCHEDULE_LISTEN_RETRY,

        /** Drop a scheduled listen retry. */
        CANCEL_LISTEN_RETRY
    }

    /** One action. */
    public sealed interface Intent
            permits ArmListen, CancelListen, Bind, CloseActive, DiscardChannel,
                    Publish, ScheduleListenRetry, CancelListenRetry
    {
        Kind kind();
    }

    public record ArmListen(long attempt) implements Intent {
        @Override
        public Kind kind() {
            return Kind.ARM_LISTEN;
        }
    }

    public record CancelListen(long attempt) implements Intent {
        @Override
        public Kind kind() {
            return Kind.CANCEL_LISTEN;
        }
    }

    public record Bind(long generation, DuplexChannel channel, PeerId peer) implements Intent {
        public Bind {
            Objects.requireNonNull(channel, "channel");
            Objects.requireNonNull(peer, "peer");
        }

        @Override
        public Kind kind() {
            return Kind.BIND;
        }
    }

    public record CloseActive(long generation) implements Intent {
        @Override
        public Kind kind() {
            return Kind.CLOSE_ACTIVE;
        }
    }

    public record DiscardChannel(DuplexChannel channel) implements Intent {
        public DiscardChannel {
            Objects.requireNonNull(channel, "channel");
        }

        @Override
        public Kind kind() {
            return Kind.DISCARD_CHANNEL;
        }
    }

    public record Publish(ConnectionStatus status) implements Intent {
        public Publish {
            Objects.requireNonNull(status, "status");
        }

        @Override
        public Kind kind() {
            return Kind.PUBLISH;
        }
    }

    public record ScheduleListenRetry(long token, Duration delay) implements Intent {
        public ScheduleListenRetry {
            Objects.requireNonNull(delay, "delay");
        }

        @Override
        public Kind kind() {
            return Kind.SCHEDULE_LISTEN_RETRY;
        }
    }

    public record CancelListenRetry(long token) implements Intent {
        @Override
        public Kind kind() {
            return Kind.CANCEL_LISTEN_RETRY;
        }
    }

    private static final LinkIntents NONE = new LinkIntents(List.of());

    private final List<Intent> steps;

    private LinkIntents(List<Intent> steps) {
        this.steps = List.copyOf(steps);
    }

    public static LinkIntents none() {
        return NONE;
    }

    /** Intents in execution order. */
    public List<Intent> steps() {
        return steps;
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    /**
     * Returns true if any step is of the given kind.
     */
    public boolean contains(Kind kind) {
        for (Intent step : steps) {
            if (step.kind() == kind) {
                return true;
            }
        }
        return false;
    }

    /**
     * Statuses this intent list publishes, in order.
     */
    public List<ConnectionStatus> published() {
        List<ConnectionStatus> out = new ArrayList<>();
        for (Intent step : steps) {
            if (step instanceof Publish p) {
                out.add(p.status());
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return steps.toString();
    }

    // ---------------------------------------------------------------------
    // Builder (reducer-friendly)
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Intent> steps = new ArrayList<>();

        private Builder() {}

        public Builder add(Intent intent) {
            steps.add(Objects.requireNonNull(intent, "intent"));
            return this;
        }

        public LinkIntents build() {
            return steps.isEmpty() ? NONE : new LinkIntents(steps);
        }
    }
}
