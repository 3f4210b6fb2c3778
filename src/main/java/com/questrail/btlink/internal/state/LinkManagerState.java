package com.questrail.btlink.internal.state;

import com.questrail.btlink.api.ConnectionStatus;
import com.questrail.btlink.api.PeerId;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * LinkManagerState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of the connection manager's logical state.
 *
 * <h2>Role in the architecture</h2>
 * The state is consumed and produced by {@link LinkStateReducer}. It is pure
 * data: it records which attempts are outstanding and which connection
 * generation is active, but owns no channel, multiplexer or subscription.
 * Those live in the intent executor and are addressed by the ids kept here.
 *
 * <h2>Attempt ids</h2>
 * <ul>
 *   <li>{@code listenAttempt}: id of the armed listen, {@code 0} when not
 *       listening</li>
 *   <li>{@code connectAttempt}: id of the in-flight connect, {@code 0} when
 *       none</li>
 *   <li>{@code activeGeneration}: id of the bound connection, {@code 0} when
 *       no channel is bound</li>
 *   <li>{@code pendingRetry}: token of a scheduled listen retry, {@code 0}
 *       when none</li>
 * </ul>
 * Listen, generation and retry ids are drawn from {@code nextId} so the
 * reducer stays deterministic.
 */
public final class LinkManagerState
{
    /**
     * Lifecycle phase. {@code CONNECTING} is internal; callers observe
     * {@link ConnectionStatus} instead.
     */
    public enum Phase {
        IDLE,
        LISTENING,
        CONNECTING,
        CONNECTED,
        DISCONNECTED,
        ERROR
    }

    private final Phase phase;
    private final boolean radioEnabled;
    private final PeerId boundPeer;
    private final long listenAttempt;
    private final long connectAttempt;
    private final long activeGeneration;
    private final long pendingRetry;
    private final int listenFailures;
    private final long nextId;
    private final ConnectionStatus status;
    private final Instant lastTransition;

    private LinkManagerState(Builder b) {
        this.phase = Objects.requireNonNull(b.phase, "phase");
        this.radioEnabled = b.radioEnabled;
        this.boundPeer = b.boundPeer;
        this.listenAttempt = b.listenAttempt;
        this.connectAttempt = b.connectAttempt;
        this.activeGeneration = b.activeGeneration;
        this.pendingRetry = b.pendingRetry;
        this.listenFailures = b.listenFailures;
        this.nextId = b.nextId;
        this.status = Objects.requireNonNull(b.status, "status");
        this.lastTransition = Objects.requireNonNull(b.lastTransition, "lastTransition");
    }

    /**
     * Initial state: idle, radio assumed off, nothing bound, {@code DISCONNECTED}.
     */
    public static LinkManagerState initial(Instant now) {
        Builder b = new Builder();
        b.phase = Phase.IDLE;
        b.status = ConnectionStatus.DISCONNECTED;
        b.nextId = 1;
        b.lastTransition = now;
        return b.build();
    }

    public Phase phase() {
        return phase;
    }

    public boolean radioEnabled() {
        return radioEnabled;
    }

    public Optional<PeerId> boundPeer() {
        return Optional.ofNullable(boundPeer);
    }

    public long listenAttempt() {
        return listenAttempt;
    }

    public boolean listening() {
        return listenAttempt != 0;
    }

    public long connectAttempt() {
        return connectAttempt;
    }

    public boolean connecting() {
        return connectAttempt != 0;
    }

    public long activeGeneration() {
        return activeGeneration;
    }

    public boolean hasActiveConnection() {
        return activeGeneration != 0;
    }

    public long pendingRetry() {
        return pendingRetry;
    }

    /** Consecutive failed listens since the last bind or radio-enabled transition. */
    public int listenFailures() {
        return listenFailures;
    }

    /** Last status published to observers. */
    public ConnectionStatus status() {
        return status;
    }

    public Instant lastTransition() {
        return lastTransition;
    }

    /**
     * Copy of this state for incremental modification.
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.phase = phase;
        b.radioEnabled = radioEnabled;
        b.boundPeer = boundPeer;
        b.listenAttempt = listenAttempt;
        b.connectAttempt = connectAttempt;
        b.activeGeneration = activeGeneration;
        b.pendingRetry = pendingRetry;
        b.listenFailures = listenFailures;
        b.nextId = nextId;
        b.status = status;
        b.lastTransition = lastTransition;
        return b;
    }

    @Override
    public String toString() {
        return "LinkManagerState{" +
                "phase=" + phase +
                ", radio=" + (radioEnabled ? "on" : "off") +
                ", bound=" + boundPeer +
                ", listen=" + listenAttempt +
                ", connect=" + connectAttempt +
                ", generation=" + activeGeneration +
                ", status=" + status +
                '}';
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private Phase phase;
        private boolean radioEnabled;
        private PeerId boundPeer;
        private long listenAttempt;
        private long connectAttempt;
        private long activeGeneration;
        private long pendingRetry;
        private int listenFailures;
        private long nextId = 1;
        private ConnectionStatus status;
        private Instant lastTransition;

        private Builder() {}

        public Builder phase(Phase phase) {
            this.phase = Objects.requireNonNull(phase, "phase");
            return this;
        }

        public Builder radioEnabled(boolean radioEnabled) {
            this.radioEnabled = radioEnabled;
            return this;
        }

        public Builder boundPeer(PeerId boundPeer) {
            this.boundPeer = boundPeer;
            return this;
        }

        public Builder listenAttempt(long listenAttempt) {
            this.listenAttempt = listenAttempt;
            return this;
        }

        public Builder connectAttempt(long connectAttempt) {
            this.connectAttempt = connectAttempt;
            return this;
        }

        public Builder activeGeneration(long activeGeneration) {
            this.activeGeneration = activeGeneration;
            return this;
        }

        public Builder pendingRetry(long pendingRetry) {
            this.pendingRetry = pendingRetry;
            return this;
        }

        public Builder listenFailures(int listenFailures) {
            this.listenFailures = listenFailures;
            return this;
        }

        public Builder status(ConnectionStatus status) {
            this.status = Objects.requireNonNull(status, "status");
            return this;
        }

        public Builder lastTransition(Instant lastTransition) {
            this.lastTransition = Objects.requireNonNull(lastTransition, "lastTransition");
            return this;
        }

        /** Reserve a fresh listen, generation or retry id. */
        public long allocateId() {
            return nextId++;
        }

        // Read-back accessors used while assembling a transition.

        long listenAttempt() {
            return listenAttempt;
        }

        long connectAttempt() {
            return connectAttempt;
        }

        long activeGeneration() {
            return activeGeneration;
        }

        long pendingRetry() {
            return pendingRetry;
        }

        boolean radioEnabled() {
            return radioEnabled;
        }

        ConnectionStatus status() {
            return status;
        }

        public LinkManagerState build() {
            return new LinkManagerState(this);
        }
    }
}
