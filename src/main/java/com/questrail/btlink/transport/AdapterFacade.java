package com.questrail.btlink.transport;

import com.questrail.btlink.api.LinkEvent;
import com.questrail.btlink.api.PeerId;
import com.questrail.btlink.api.ProfileEvent;
import com.questrail.btlink.api.ProxyUnavailableException;

import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Single;

import java.util.List;
import java.util.Set;

/**
 * AdapterFacade
 * -----------------------------------------------------------------------------
 * Port to the local radio adapter. Everything the connection manager needs
 * from the platform goes through this interface: radio state, link-layer
 * events, and the two socket-producing operations.
 *
 * <p>Implementations MUST NOT interpret connection semantics. They report what
 * the platform reports and produce channels; arbitration belongs to the
 * manager.</p>
 *
 * <p>Signals are push-based: subscribing registers the platform callback and
 * disposing unregisters it.</p>
 */
public interface AdapterFacade
{
    /** Current radio state, read synchronously from the platform. */
    boolean isRadioEnabled();

    /**
     * Radio-enabled changes only. Combine with {@link #isRadioEnabled()} for
     * the initial value.
     */
    Observable<Boolean> radioStateChanges();

    /** Link-layer connect/disconnect notifications in arrival order. */
    Observable<LinkEvent> linkEvents();

    /**
     * Listen under {@code serviceName}, accept exactly one inbound connection,
     * then stop listening. Disposing before success cancels the accept.
     */
    Single<DuplexChannel> listenOnce(String serviceName);

    /** Connect out to {@code peer}. */
    Single<DuplexChannel> connectTo(PeerId peer);

    /** Permission identifiers the caller still lacks; empty when authorized. */
    List<String> missingPermissions();

    /** Peers bonded (paired) with the local adapter. */
    Set<PeerId> bondedPeers();

    /**
     * Observe the proxy service of a platform profile.
     * Errors with {@link ProxyUnavailableException} when the proxy cannot be
     * requested.
     */
    Observable<ProfileEvent> observeProfile(int profile);
}
