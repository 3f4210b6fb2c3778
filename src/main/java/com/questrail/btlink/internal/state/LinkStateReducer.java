package com.questrail.btlink.internal.state;

import com.questrail.btlink.api.ConnectionStatus;
import com.questrail.btlink.api.LinkEvent;
import com.questrail.btlink.api.PeerId;
import com.questrail.btlink.internal.events.AdapterEvent;
import com.questrail.btlink.internal.events.ChannelEvent;
import com.questrail.btlink.internal.events.CommandEvent;
import com.questrail.btlink.internal.events.LinkManagerEvent;
import com.questrail.btlink.internal.exec.ListenRetryPolicy;
import com.questrail.btlink.internal.state.LinkManagerState.Phase;

import java.time.Instant;
import java.util.Objects;

/**
 * LinkStateReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic transition engine for the connection manager.
 *
 * <h2>Role in the architecture</h2>
 * Given a prior {@link LinkManagerState} and a single {@link LinkManagerEvent},
 * the reducer computes:
 * <ul>
 *   <li>a new {@link LinkManagerState}</li>
 *   <li>an ordered list of {@link LinkIntents} describing what the executor
 *       should do next</li>
 * </ul>
 *
 * The reducer performs no I/O, owns no channel and starts no timer. It never
 * touches a multiplexer; it only decides which connection generation is bound
 * and asks the executor to bind or release it.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>At most one connection generation is active at a time. A channel that
 *       arrives while one is active, or from an abandoned attempt, is
 *       discarded.</li>
 *   <li>Listening is armed only while the radio is on and there is neither an
 *       active connection nor an outbound attempt in flight.</li>
 *   <li>A failed listen is not re-armed on its own. Only a radio-enabled
 *       transition, a link disconnect of the bound peer, the loss of the
 *       active channel, an explicit listen request or the retry policy arm
 *       listening again.</li>
 *   <li>A status is published only when it differs from the last published
 *       one.</li>
 * </ul>
 */
public final class LinkStateReducer
{
    /**
     * Result of applying an event to a manager state.
     *
     * @param newState the updated state
     * @param intents  actions to be executed by the caller, in order
     */
    public record Result(LinkManagerState newState,
                         LinkIntents intents) {}

    private final ListenRetryPolicy retryPolicy;

    public LinkStateReducer() {
        this(ListenRetryPolicy.disabled());
    }

    public LinkStateReducer(ListenRetryPolicy retryPolicy) {
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    /**
     * Applies a single event to the current state.
     *
     * @param state the current state (must not be {@code null})
     * @param event the event to apply (must not be {@code null})
     * @return the resulting state and intentions
     */
    public Result apply(LinkManagerState state, LinkManagerEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (event instanceof AdapterEvent.RadioStateChanged e) {
            return onRadioStateChanged(state, e);
        }
        if (event instanceof AdapterEvent.LinkEventReceived e) {
            return onLinkEvent(state, e);
        }
        if (event instanceof CommandEvent.ListenRequested e) {
            return onListenRequested(state, e);
        }
        if (event instanceof CommandEvent.ConnectRequested e) {
            return onConnectRequested(state, e);
        }
        if (event instanceof CommandEvent.DisconnectRequested e) {
            return onDisconnect(state, e.timestamp(), false);
        }
        if (event instanceof CommandEvent.Stopped e) {
            return onDisconnect(state, e.timestamp(), true);
        }
        if (event instanceof ChannelEvent.ChannelOpened e) {
            return onChannelOpened(state, e);
        }
        if (event instanceof ChannelEvent.ListenFailed e) {
            return onListenFailed(state, e);
        }
        if (event instanceof ChannelEvent.ListenRetryDue e) {
            return onListenRetryDue(state, e);
        }
        if (event instanceof ChannelEvent.ConnectFailed e) {
            return onConnectFailed(state, e);
        }
        if (event instanceof ChannelEvent.ConnectCancelled e) {
            return onConnectCancelled(state, e);
        }
        if (event instanceof ChannelEvent.ChannelTerminated e) {
            return onChannelTerminated(state, e);
        }

        // Unknown events are ignored.
        return unchanged(state);
    }

    // ---------------------------------------------------------------------
    // Adapter events
    // ---------------------------------------------------------------------

    private Result onRadioStateChanged(LinkManagerState state,
                                       AdapterEvent.RadioStateChanged e) {
        Transition t = new Transition(state, e.timestamp());

        if (e.enabled()) {
            t.next.radioEnabled(true);
            if (!state.radioEnabled()) {
                // A fresh radio-on restores the retry budget and re-arms.
                t.next.listenFailures(0);
                if (t.canArmListen()) {
                    t.armListen();
                }
            }
            return t.result();
        }

        t.next.radioEnabled(false);
        t.teardown();
        t.next.phase(Phase.IDLE);
        t.publish(ConnectionStatus.DISCONNECTED);
        return t.result();
    }

    private Result onLinkEvent(LinkManagerState state,
                               AdapterEvent.LinkEventReceived e) {
        LinkEvent linkEvent = e.linkEvent();
        PeerId peer = linkEvent.peer();
        PeerId bound = state.boundPeer().orElse(null);

        switch (linkEvent.kind()) {

            case CONNECTED -> {
                if (state.hasActiveConnection() && !peer.equals(bound)) {
                    // One live connection; a second peer's link does not displace it.
                    return unchanged(state);
                }
                Transition t = new Transition(state, e.timestamp());
                t.next.boundPeer(peer);
                if (state.hasActiveConnection()) {
                    t.next.phase(Phase.CONNECTED);
                }
                t.publish(ConnectionStatus.connected(peer));
                return t.result();
            }

            case DISCONNECTED -> {
                if (!peer.equals(bound)) {
                    return unchanged(state);
                }
                Transition t = new Transition(state, e.timestamp());
                t.releaseActive();
                t.next.boundPeer(null).phase(Phase.DISCONNECTED);
                t.publish(ConnectionStatus.DISCONNECTED);
                t.settle();
                return t.result();
            }

            default -> {
                // DISCONNECT_REQUESTED is advisory only.
                return unchanged(state);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------------

    private Result onListenRequested(LinkManagerState state,
                                     CommandEvent.ListenRequested e) {
        Transition t = new Transition(state, e.timestamp());
        if (!t.canArmListen()) {
            return unchanged(state);
        }
        t.armListen();
        return t.result();
    }

    private Result onConnectRequested(LinkManagerState state,
                                      CommandEvent.ConnectRequested e) {
        PeerId peer = e.peer();
        Transition t = new Transition(state, e.timestamp());

        t.cancelListen();
        t.cancelRetry();
        t.releaseActive();

        // A link-only binding to the same peer survives; it is what we are connecting to.
        boolean keepBinding = !state.hasActiveConnection()
                && peer.equals(state.boundPeer().orElse(null));
        if (!keepBinding) {
            t.next.boundPeer(null);
        }

        t.next.connectAttempt(e.attempt()).phase(Phase.CONNECTING);

        ConnectionStatus status = state.status();
        if (status.equals(ConnectionStatus.WAITING_FOR_CONNECTION)
                || (status instanceof ConnectionStatus.Connected && !keepBinding)) {
            t.publish(ConnectionStatus.DISCONNECTED);
        }
        return t.result();
    }

    private Result onDisconnect(LinkManagerState state, Instant now, boolean stopping) {
        Transition t = new Transition(state, now);
        t.teardown();
        if (stopping) {
            t.next.radioEnabled(false);
        }
        t.next.phase(Phase.IDLE);
        t.publish(ConnectionStatus.DISCONNECTED);
        return t.result();
    }

    // ---------------------------------------------------------------------
    // Channel events
    // ---------------------------------------------------------------------

    private Result onChannelOpened(LinkManagerState state,
                                   ChannelEvent.ChannelOpened e) {
        long attempt = e.attempt();
        boolean current = e.origin() == ChannelEvent.Origin.OUTBOUND
                ? attempt != 0 && attempt == state.connectAttempt()
                : attempt != 0 && attempt == state.listenAttempt();

        if (!current || state.hasActiveConnection()) {
            LinkIntents discard = LinkIntents.builder()
                    .add(new LinkIntents.DiscardChannel(e.channel()))
                    .build();
            return new Result(state, discard);
        }

        Transition t = new Transition(state, e.timestamp());
        if (e.origin() == ChannelEvent.Origin.INBOUND) {
            // Accept-once: the listen attempt is consumed.
            t.next.listenAttempt(0);
        } else {
            t.next.connectAttempt(0);
            t.cancelListen();
        }
        t.cancelRetry();

        long generation = t.next.allocateId();
        t.next.activeGeneration(generation)
                .boundPeer(e.peer())
                .listenFailures(0)
                .phase(Phase.CONNECTED);
        t.intents.add(new LinkIntents.Bind(generation, e.channel(), e.peer()));
        t.publish(ConnectionStatus.connected(e.peer()));
        return t.result();
    }

    private Result onListenFailed(LinkManagerState state,
                                  ChannelEvent.ListenFailed e) {
        if (e.attempt() == 0 || e.attempt() != state.listenAttempt()) {
            return unchanged(state);
        }

        int failures = state.listenFailures() + 1;
        Transition t = new Transition(state, e.timestamp());
        t.next.listenAttempt(0)
                .listenFailures(failures)
                .phase(Phase.ERROR);
        t.publish(ConnectionStatus.CONNECTION_ERROR);

        if (state.radioEnabled() && retryPolicy.allowsRetry(failures)) {
            long token = t.next.allocateId();
            t.next.pendingRetry(token);
            t.intents.add(new LinkIntents.ScheduleListenRetry(token, retryPolicy.retryDelay()));
        }
        return t.result();
    }

    private Result onListenRetryDue(LinkManagerState state,
                                    ChannelEvent.ListenRetryDue e) {
        if (e.token() == 0 || e.token() != state.pendingRetry()) {
            return unchanged(state);
        }
        Transition t = new Transition(state, e.timestamp());
        t.next.pendingRetry(0);
        if (t.canArmListen()) {
            t.armListen();
        }
        return t.result();
    }

    private Result onConnectFailed(LinkManagerState state,
                                   ChannelEvent.ConnectFailed e) {
        if (e.attempt() == 0 || e.attempt() != state.connectAttempt()) {
            return unchanged(state);
        }
        // Listening stays stopped; the caller decides what comes next.
        Transition t = new Transition(state, e.timestamp());
        t.next.connectAttempt(0).phase(Phase.ERROR);
        t.publish(ConnectionStatus.CONNECTION_ERROR);
        return t.result();
    }

    private Result onConnectCancelled(LinkManagerState state,
                                      ChannelEvent.ConnectCancelled e) {
        if (e.attempt() == 0 || e.attempt() != state.connectAttempt()) {
            return unchanged(state);
        }
        Transition t = new Transition(state, e.timestamp());
        t.next.connectAttempt(0).phase(Phase.IDLE);
        if (!(state.status() instanceof ConnectionStatus.Connected)) {
            t.publish(ConnectionStatus.DISCONNECTED);
        }
        return t.result();
    }

    private Result onChannelTerminated(LinkManagerState state,
                                       ChannelEvent.ChannelTerminated e) {
        if (e.generation() == 0 || e.generation() != state.activeGeneration()) {
            return unchanged(state);
        }

        Transition t = new Transition(state, e.timestamp());
        t.releaseActive();
        t.next.boundPeer(null);
        if (e.closedByPeer()) {
            t.next.phase(Phase.DISCONNECTED);
            t.publish(ConnectionStatus.DISCONNECTED);
        } else {
            t.next.phase(Phase.ERROR);
            t.publish(ConnectionStatus.CONNECTION_ERROR);
        }
        t.settle();
        return t.result();
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static Result unchanged(LinkManagerState state) {
        return new Result(state, LinkIntents.none());
    }

    /**
     * Accumulates one transition: the next state and the intents that realize it.
     */
    private static final class Transition {
        private final LinkManagerState.Builder next;
        private final LinkIntents.Builder intents = LinkIntents.builder();

        Transition(LinkManagerState state, Instant now) {
            this.next = state.toBuilder().lastTransition(now);
        }

        void publish(ConnectionStatus status) {
            if (!status.equals(next.status())) {
                next.status(status);
                intents.add(new LinkIntents.Publish(status));
            }
        }

        boolean canArmListen() {
            return next.radioEnabled()
                    && next.listenAttempt() == 0
                    && next.connectAttempt() == 0
                    && next.activeGeneration() == 0;
        }

        void armListen() {
            cancelRetry();
            long attempt = next.allocateId();
            next.listenAttempt(attempt).phase(Phase.LISTENING);
            intents.add(new LinkIntents.ArmListen(attempt));
            publish(ConnectionStatus.WAITING_FOR_CONNECTION);
        }

        void cancelListen() {
            long attempt = next.listenAttempt();
            if (attempt != 0) {
                intents.add(new LinkIntents.CancelListen(attempt));
                next.listenAttempt(0);
            }
        }

        void cancelRetry() {
            long token = next.pendingRetry();
            if (token != 0) {
                intents.add(new LinkIntents.CancelListenRetry(token));
                next.pendingRetry(0);
            }
        }

        void releaseActive() {
            long generation = next.activeGeneration();
            if (generation != 0) {
                intents.add(new LinkIntents.CloseActive(generation));
                next.activeGeneration(0);
            }
        }

        /** Drop every connection, attempt and binding. */
        void teardown() {
            cancelListen();
            cancelRetry();
            releaseActive();
            next.connectAttempt(0).boundPeer(null);
        }

        /** Pick the resting phase after a connection was lost. */
        void settle() {
            if (next.listenAttempt() != 0) {
                next.phase(Phase.LISTENING);
                publish(ConnectionStatus.WAITING_FOR_CONNECTION);
            } else if (canArmListen()) {
                armListen();
            } else if (next.connectAttempt() != 0) {
                next.phase(Phase.CONNECTING);
            } else {
                next.phase(Phase.IDLE);
            }
        }

        Result result() {
            return new Result(next.build(), intents.build());
        }
    }
}
