package com.questrail.btlink.transport;

import com.questrail.btlink.api.LinkEvent;
import com.questrail.btlink.api.PeerId;
import com.questrail.btlink.api.ProfileEvent;
import com.questrail.btlink.api.ProxyUnavailableException;

import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.subjects.PublishSubject;
import io.reactivex.rxjava3.subjects.SingleSubject;
import io.reactivex.rxjava3.subjects.Subject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * FakeAdapterFacade
 * -----------------------------------------------------------------------------
 * Test-only {@link AdapterFacade}. Every listen and connect attempt is
 * recorded as a pending attempt the test completes or fails by hand.
 */
public final class FakeAdapterFacade implements AdapterFacade {

    /**
     * One listen or connect attempt, resolved by the test.
     */
    public static final class Attempt {
        private final String target;
        private final SingleSubject<DuplexChannel> result = SingleSubject.create();
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        private Attempt(String target) {
            this.target = target;
        }

        /** Service name of a listen, peer address of a connect. */
        public String target() {
            return target;
        }

        public void succeed(DuplexChannel channel) {
            result.onSuccess(channel);
        }

        public void fail(Throwable error) {
            result.onError(error);
        }

        public boolean cancelled() {
            return cancelled.get();
        }

        private Single<DuplexChannel> single() {
            return result.doOnDispose(() -> cancelled.set(true));
        }
    }

    private volatile boolean radioEnabled;
    private volatile List<String> missingPermissions = List.of();
    private volatile Set<PeerId> bondedPeers = Set.of();

    private final Subject<Boolean> radioChanges = PublishSubject.<Boolean>create().toSerialized();
    private final Subject<LinkEvent> linkEvents = PublishSubject.<LinkEvent>create().toSerialized();
    private final List<Attempt> listens = new CopyOnWriteArrayList<>();
    private final List<Attempt> connects = new CopyOnWriteArrayList<>();
    private final Map<Integer, Observable<ProfileEvent>> profiles = new ConcurrentHashMap<>();

    public FakeAdapterFacade(boolean radioEnabled) {
        this.radioEnabled = radioEnabled;
    }

    // ---------------------------------------------------------------------
    // AdapterFacade
    // ---------------------------------------------------------------------

    @Override
    public boolean isRadioEnabled() {
        return radioEnabled;
    }

    @Override
    public Observable<Boolean> radioStateChanges() {
        return radioChanges;
    }

    @Override
    public Observable<LinkEvent> linkEvents() {
        return linkEvents;
    }

    @Override
    public Single<DuplexChannel> listenOnce(String serviceName) {
        Attempt attempt = new Attempt(serviceName);
        listens.add(attempt);
        return attempt.single();
    }

    @Override
    public Single<DuplexChannel> connectTo(PeerId peer) {
        Objects.requireNonNull(peer, "peer");
        Attempt attempt = new Attempt(peer.address());
        connects.add(attempt);
        return attempt.single();
    }

    @Override
    public List<String> missingPermissions() {
        return missingPermissions;
    }

    @Override
    public Set<PeerId> bondedPeers() {
        return bondedPeers;
    }

    @Override
    public Observable<ProfileEvent> observeProfile(int profile) {
        Observable<ProfileEvent> events = profiles.get(profile);
        return events != null ? events : Observable.error(new ProxyUnavailableException(profile));
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void setRadioEnabled(boolean enabled) {
        radioEnabled = enabled;
        radioChanges.onNext(enabled);
    }

    public void emitLinkEvent(LinkEvent event) {
        linkEvents.onNext(event);
    }

    public void setMissingPermissions(List<String> missing) {
        this.missingPermissions = List.copyOf(missing);
    }

    public void setBondedPeers(Set<PeerId> peers) {
        this.bondedPeers = Set.copyOf(peers);
    }

    public void setProfile(int profile, Observable<ProfileEvent> events) {
        profiles.put(profile, events);
    }

    public List<Attempt> listens() {
        return new ArrayList<>(listens);
    }

    public Attempt lastListen() {
        return listens.get(listens.size() - 1);
    }

    public List<Attempt> connects() {
        return new ArrayList<>(connects);
    }

    public Attempt lastConnect() {
        return connects.get(connects.size() - 1);
    }
}
