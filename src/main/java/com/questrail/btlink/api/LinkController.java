package com.questrail.btlink.api;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Observable;

import java.io.Serializable;
import java.util.Optional;
import java.util.Set;

/**
 * LinkController
 * -----------------------------------------------------------------------------
 * Primary façade for a single duplex link to one remote peer at a time.
 *
 * <h2>Core responsibilities</h2>
 * <ul>
 *   <li>Arbitrating between connecting out and listening for an inbound peer</li>
 *   <li>Owning at most one active connection</li>
 *   <li>Publishing one coherent {@link ConnectionStatus} signal</li>
 *   <li>Relaying records received on whichever connection is active</li>
 * </ul>
 *
 * <h2>Failure reporting</h2>
 * Connection-lifecycle failures (peer hang-up, transport errors, failed
 * listen attempts) are reported through {@link #connectionState()}, never
 * thrown. The only caller-visible errors are {@link PermissionDeniedException}
 * from {@link #connect(PeerId)} and {@link ProxyUnavailableException} from
 * {@link #observeProfile(int)}.
 *
 * <h2>Threading</h2>
 * All methods may be called from any thread. Emissions of
 * {@link #incomingData()} happen on the read-loop thread of the active
 * connection; emissions of {@link #connectionState()} happen on whichever
 * thread drove the transition.
 */
public interface LinkController
{
    /**
     * Distinct-change connection status. New subscribers immediately receive
     * the current value.
     */
    Observable<ConnectionStatus> connectionState();

    /**
     * Records received on the currently active connection. The underlying
     * source is switched transparently when the active connection changes;
     * records still buffered for a dropped connection are discarded.
     * The returned stream never errors because of a transport failure.
     */
    Flowable<Object> incomingData();

    /**
     * Connect out to {@code peer}. Listening is stopped for the attempt.
     *
     * @return completes once the attempt has ended, whether it bound a
     *         connection or failed; the outcome is published on
     *         {@link #connectionState()}. Errors only with
     *         {@link PermissionDeniedException} when authorizations are missing
     */
    Completable connect(PeerId peer);

    /**
     * Arm listening for a single inbound connection. No-op when already
     * connected or listening, or when the radio is off.
     */
    void listen();

    /**
     * Drop the active connection (if any) and stop connect/listen attempts.
     * Idempotent.
     */
    void disconnect();

    boolean send(byte[] bytes);

    boolean send(String text);

    boolean sendRecord(Serializable record);

    boolean isConnected();

    Optional<PeerId> boundPeer();

    Set<PeerId> bondedPeers();

    /**
     * Observe the proxy service of a platform profile. Failure to obtain the
     * proxy is signalled as {@link ProxyUnavailableException} to this
     * subscriber only.
     */
    Observable<ProfileEvent> observeProfile(int profile);
}
