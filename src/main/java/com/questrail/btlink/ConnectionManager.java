package com.questrail.btlink;

import com.questrail.btlink.api.ConnectionStatus;
import com.questrail.btlink.api.LinkController;
import com.questrail.btlink.api.LinkEvent;
import com.questrail.btlink.api.PeerId;
import com.questrail.btlink.api.PermissionDeniedException;
import com.questrail.btlink.api.ProfileEvent;
import com.questrail.btlink.config.LinkRuntimeConfig;
import com.questrail.btlink.internal.events.AdapterEvent;
import com.questrail.btlink.internal.events.ChannelEvent;
import com.questrail.btlink.internal.events.CommandEvent;
import com.questrail.btlink.internal.events.LinkManagerEvent;
import com.questrail.btlink.internal.exec.RxLinkIntentExecutor;
import com.questrail.btlink.internal.state.LinkManagerState;
import com.questrail.btlink.internal.state.LinkStateReducer;
import com.questrail.btlink.mux.StreamMultiplexer;
import com.questrail.btlink.observability.LinkErrorEvent;
import com.questrail.btlink.observability.LinkObservabilitySink;
import com.questrail.btlink.observability.LinkStateTransitionEvent;
import com.questrail.btlink.observability.NullObservabilitySink;
import com.questrail.btlink.transport.AdapterFacade;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import io.reactivex.rxjava3.processors.BehaviorProcessor;
import io.reactivex.rxjava3.schedulers.Schedulers;
import io.reactivex.rxjava3.subjects.BehaviorSubject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ConnectionManager
 * =============================================================================
 * {@link LinkController} over a single radio adapter: decides between listening
 * and connecting out, follows link-layer events, and keeps at most one live
 * connection whose records it relays to {@link #incomingData()}.
 *
 * <h2>Threading model</h2>
 * Every input (adapter signals, outcomes of listen and connect attempts,
 * read-loop termination and caller commands) becomes a {@link LinkManagerEvent}
 * queued on an inbox. Whichever thread finds the inbox idle drains it,
 * applying each event through the {@link LinkStateReducer} and executing the
 * resulting intents before taking the next event. Events submitted while a
 * drain is in progress, including re-entrant ones, are queued behind it.
 *
 * <h2>Status</h2>
 * {@link #connectionState()} replays the current {@link ConnectionStatus} and
 * never emits the same status twice in a row. It starts at
 * {@code DISCONNECTED}.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   manager.start()   → subscribe to radio and link signals; arm listening if the radio is on
 *   manager.connect() → connect out (stops listening)
 *   manager.stop()    → unsubscribe, release every channel, publish DISCONNECTED
 * </pre>
 */
public final class ConnectionManager implements LinkController
{
    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final AdapterFacade adapter;
    private final LinkRuntimeConfig config;
    private final Scheduler attemptScheduler;
    private final LinkStateReducer reducer;
    private final RxLinkIntentExecutor executor;
    private final LinkObservabilitySink observabilitySink;

    private final Queue<LinkManagerEvent> inbox = new ConcurrentLinkedQueue<>();
    private final AtomicInteger wip = new AtomicInteger();

    private final BehaviorSubject<ConnectionStatus> status =
            BehaviorSubject.createDefault(ConnectionStatus.DISCONNECTED);
    private final BehaviorProcessor<Flowable<Object>> recordSources =
            BehaviorProcessor.createDefault(Flowable.empty());

    private final CompositeDisposable adapterSubscriptions = new CompositeDisposable();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong connectAttempts = new AtomicLong();

    private volatile LinkManagerState state;

    /**
     * Manager with default configuration, blocking work on {@link Schedulers#io()}
     * and no observability.
     */
    public ConnectionManager(AdapterFacade adapter) {
        this(adapter, LinkRuntimeConfig.defaults(), Schedulers.io(), Schedulers.io(), null);
    }

    /**
     * @param adapter           the radio adapter to drive
     * @param config            service name, text settings and retry policy
     * @param readScheduler     scheduler blocking read loops run on
     * @param attemptScheduler  scheduler listen and connect attempts are subscribed
     *                          on, and listen retries are timed on
     * @param observabilitySink receives transitions and errors; {@code null} for none
     */
    public ConnectionManager(AdapterFacade adapter,
                             LinkRuntimeConfig config,
                             Scheduler readScheduler,
                             Scheduler attemptScheduler,
                             LinkObservabilitySink observabilitySink)
    {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(readScheduler, "readScheduler");
        this.attemptScheduler = Objects.requireNonNull(attemptScheduler, "attemptScheduler");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.reducer = new LinkStateReducer(config.listenRetryPolicy());
        this.executor = new RxLinkIntentExecutor(
                adapter,
                config.serviceName(),
                attemptScheduler,
                channel -> new StreamMultiplexer(channel, readScheduler,
                        config.textCharset(), config.textDelimiters()),
                this::submit,
                this::publish,
                recordSources::onNext);
        this.state = LinkManagerState.initial(Instant.now());
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Subscribe to the adapter's link events and radio state. The radio signal
     * starts with the state read at subscription time. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("Starting connection manager for service '{}'", config.serviceName());

        adapterSubscriptions.add(adapter.linkEvents().subscribe(
                this::onLinkEvent,
                error -> reportError("Link event stream failed", error)));

        adapterSubscriptions.add(Observable.defer(() ->
                        adapter.radioStateChanges().startWithItem(adapter.isRadioEnabled()))
                .subscribe(
                        enabled -> submit(new AdapterEvent.RadioStateChanged(Instant.now(), enabled)),
                        error -> reportError("Radio state stream failed", error)));
    }

    /**
     * Unsubscribe from the adapter and release every channel, attempt and
     * timer. Publishes {@code DISCONNECTED}. Idempotent; {@link #start()} may be
     * called again afterwards.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping connection manager");
        adapterSubscriptions.clear();
        submit(new CommandEvent.Stopped(Instant.now()));
    }

    public boolean isStarted() {
        return started.get();
    }

    /**
     * Current state snapshot. Thread-safe.
     */
    public LinkManagerState state() {
        return state;
    }

    // -------------------------------------------------------------------------
    // LinkController
    // -------------------------------------------------------------------------

    @Override
    public Observable<ConnectionStatus> connectionState() {
        return status.distinctUntilChanged();
    }

    @Override
    public Flowable<Object> incomingData() {
        return recordSources.switchMap(source -> source);
    }

    @Override
    public Completable connect(PeerId peer) {
        Objects.requireNonNull(peer, "peer");
        return Completable.defer(() -> {
            List<String> missing = adapter.missingPermissions();
            if (!missing.isEmpty()) {
                return Completable.error(new PermissionDeniedException(missing));
            }

            long attempt = connectAttempts.incrementAndGet();
            submit(new CommandEvent.ConnectRequested(Instant.now(), peer, attempt));

            return adapter.connectTo(peer)
                    .subscribeOn(attemptScheduler)
                    .doOnSuccess(channel -> submit(new ChannelEvent.ChannelOpened(
                            Instant.now(), ChannelEvent.Origin.OUTBOUND, attempt, channel, peer)))
                    .doOnError(error -> submit(new ChannelEvent.ConnectFailed(
                            Instant.now(), attempt, error)))
                    .doOnDispose(() -> submit(new ChannelEvent.ConnectCancelled(
                            Instant.now(), attempt)))
                    .ignoreElement()
                    .onErrorComplete();
        });
    }

    @Override
    public void listen() {
        submit(new CommandEvent.ListenRequested(Instant.now()));
    }

    @Override
    public void disconnect() {
        submit(new CommandEvent.DisconnectRequested(Instant.now()));
    }

    @Override
    public boolean send(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return executor.activeMultiplexer()
                .map(m -> m.send(bytes))
                .orElse(false);
    }

    @Override
    public boolean send(String text) {
        Objects.requireNonNull(text, "text");
        return executor.activeMultiplexer()
                .map(m -> m.send(text))
                .orElse(false);
    }

    @Override
    public boolean sendRecord(Serializable record) {
        Objects.requireNonNull(record, "record");
        return executor.activeMultiplexer()
                .map(m -> m.sendRecord(record))
                .orElse(false);
    }

    @Override
    public boolean isConnected() {
        return executor.activeMultiplexer()
                .map(StreamMultiplexer::isOpen)
                .orElse(false);
    }

    @Override
    public Optional<PeerId> boundPeer() {
        return state.boundPeer();
    }

    @Override
    public Set<PeerId> bondedPeers() {
        return adapter.bondedPeers();
    }

    @Override
    public Observable<ProfileEvent> observeProfile(int profile) {
        return adapter.observeProfile(profile);
    }

    // -------------------------------------------------------------------------
    // Inbox
    // -------------------------------------------------------------------------

    private void onLinkEvent(LinkEvent event) {
        observabilitySink.onLinkEvent(event);
        submit(new AdapterEvent.LinkEventReceived(Instant.now(), event));
    }

    /**
     * Enqueue an event and drain the inbox unless another thread already is.
     */
    void submit(LinkManagerEvent event) {
        Objects.requireNonNull(event, "event");
        inbox.offer(event);
        if (wip.getAndIncrement() != 0) {
            return;
        }

        int missed = 1;
        for (;;) {
            LinkManagerEvent next;
            while ((next = inbox.poll()) != null) {
                process(next);
            }
            missed = wip.addAndGet(-missed);
            if (missed == 0) {
                break;
            }
        }
    }

    private void process(LinkManagerEvent event) {
        try {
            LinkManagerState oldState = state;
            LinkStateReducer.Result result = reducer.apply(oldState, event);
            state = result.newState();

            observabilitySink.onStateTransition(new LinkStateTransitionEvent(
                    Instant.now(),
                    oldState,
                    result.newState(),
                    event,
                    result.intents()));

            if (!result.intents().isEmpty()) {
                executor.execute(result.intents());
            }
        } catch (RuntimeException e) {
            reportError("Event processing error on " + event, e);
        }
    }

    private void publish(ConnectionStatus next) {
        if (!next.equals(status.getValue())) {
            status.onNext(next);
        }
    }

    private void reportError(String message, Throwable cause) {
        observabilitySink.onError(new LinkErrorEvent(Instant.now(), message, cause));
    }
}
