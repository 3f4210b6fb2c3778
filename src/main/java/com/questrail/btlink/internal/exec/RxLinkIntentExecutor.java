package com.questrail.btlink.internal.exec;

import com.questrail.btlink.api.ConnectionStatus;
import com.questrail.btlink.api.PeerId;
import com.questrail.btlink.internal.events.ChannelEvent;
import com.questrail.btlink.internal.events.LinkManagerEvent;
import com.questrail.btlink.internal.state.LinkIntents;
import com.questrail.btlink.mux.StreamMultiplexer;
import com.questrail.btlink.transport.AdapterFacade;
import com.questrail.btlink.transport.DuplexChannel;
import com.questrail.btlink.transport.TransportFailures;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.disposables.SerialDisposable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * RxLinkIntentExecutor
 * =============================================================================
 * {@link LinkIntentExecutor} that drives an {@link AdapterFacade} with RxJava.
 *
 * <h2>Owned resources</h2>
 * <ul>
 *   <li>The armed listen subscription (at most one)</li>
 *   <li>The scheduled listen retry (at most one)</li>
 *   <li>The active connection: its multiplexer and the watcher subscription
 *       that reports read-loop termination</li>
 * </ul>
 * The active slot is written only from {@link #execute(LinkIntents)}, which the
 * manager calls from its drain loop. Senders read it concurrently.
 *
 * <h2>Record routing</h2>
 * On bind, the multiplexer's record stream is handed to the record output with
 * errors replaced by completion; on release an empty source replaces it. The
 * manager switches to whatever source it was handed last.
 */
public final class RxLinkIntentExecutor implements LinkIntentExecutor
{
    private static final Logger log = LoggerFactory.getLogger(RxLinkIntentExecutor.class);

    private record ActiveConnection(long generation,
                                    StreamMultiplexer multiplexer,
                                    Disposable watcher) {}

    private final AdapterFacade adapter;
    private final String serviceName;
    private final Scheduler scheduler;
    private final Function<DuplexChannel, StreamMultiplexer> multiplexers;
    private final Consumer<LinkManagerEvent> events;
    private final Consumer<ConnectionStatus> statusOutput;
    private final Consumer<Flowable<Object>> recordOutput;

    private final SerialDisposable listen = new SerialDisposable();
    private final SerialDisposable retry = new SerialDisposable();

    private volatile ActiveConnection active;

    /**
     * @param adapter      source of listen attempts
     * @param serviceName  service name handed to {@link AdapterFacade#listenOnce(String)}
     * @param scheduler    scheduler listen attempts and retry delays run on
     * @param multiplexers wraps a freshly bound channel
     * @param events       inbox of the manager that owns this executor
     * @param statusOutput receives every status to publish
     * @param recordOutput receives the record source to relay
     */
    public RxLinkIntentExecutor(AdapterFacade adapter,
                                String serviceName,
                                Scheduler scheduler,
                                Function<DuplexChannel, StreamMultiplexer> multiplexers,
                                Consumer<LinkManagerEvent> events,
                                Consumer<ConnectionStatus> statusOutput,
                                Consumer<Flowable<Object>> recordOutput)
    {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.multiplexers = Objects.requireNonNull(multiplexers, "multiplexers");
        this.events = Objects.requireNonNull(events, "events");
        this.statusOutput = Objects.requireNonNull(statusOutput, "statusOutput");
        this.recordOutput = Objects.requireNonNull(recordOutput, "recordOutput");
    }

    @Override
    public void execute(LinkIntents intents) {
        for (LinkIntents.Intent step : intents.steps()) {
            if (step instanceof LinkIntents.ArmListen s) {
                armListen(s.attempt());
            } else if (step instanceof LinkIntents.CancelListen s) {
                log.debug("Cancelling listen #{}", s.attempt());
                listen.set(Disposable.empty());
            } else if (step instanceof LinkIntents.Bind s) {
                bind(s.generation(), s.channel(), s.peer());
            } else if (step instanceof LinkIntents.CloseActive s) {
                closeActive(s.generation());
            } else if (step instanceof LinkIntents.DiscardChannel s) {
                discard(s.channel());
            } else if (step instanceof LinkIntents.Publish s) {
                statusOutput.accept(s.status());
            } else if (step instanceof LinkIntents.ScheduleListenRetry s) {
                scheduleRetry(s.token(), s.delay());
            } else if (step instanceof LinkIntents.CancelListenRetry s) {
                log.debug("Cancelling listen retry #{}", s.token());
                retry.set(Disposable.empty());
            }
        }
    }

    /**
     * The multiplexer of the bound connection, if any.
     */
    public Optional<StreamMultiplexer> activeMultiplexer() {
        ActiveConnection current = active;
        return current == null ? Optional.empty() : Optional.of(current.multiplexer());
    }

    // ---------------------------------------------------------------------
    // Listening
    // ---------------------------------------------------------------------

    private void armListen(long attempt) {
        log.debug("Arming listen #{} for service '{}'", attempt, serviceName);
        listen.set(adapter.listenOnce(serviceName)
                .subscribeOn(scheduler)
                .subscribe(
                        channel -> events.accept(new ChannelEvent.ChannelOpened(
                                Instant.now(), ChannelEvent.Origin.INBOUND, attempt,
                                channel, channel.remotePeer())),
                        error -> events.accept(new ChannelEvent.ListenFailed(
                                Instant.now(), attempt, error))));
    }

    private void scheduleRetry(long token, Duration delay) {
        log.info("Listen retry #{} in {} ms", token, delay.toMillis());
        retry.set(Completable.timer(delay.toNanos(), TimeUnit.NANOSECONDS, scheduler)
                .subscribe(() -> events.accept(new ChannelEvent.ListenRetryDue(Instant.now(), token))));
    }

    // ---------------------------------------------------------------------
    // Active connection
    // ---------------------------------------------------------------------

    private void bind(long generation, DuplexChannel channel, PeerId peer) {
        StreamMultiplexer multiplexer;
        try {
            multiplexer = multiplexers.apply(channel);
        } catch (RuntimeException e) {
            log.warn("Cannot wrap channel to {}; dropping it", peer, e);
            discard(channel);
            events.accept(new ChannelEvent.ChannelTerminated(
                    Instant.now(), generation, TransportFailures.classify(e)));
            return;
        }

        Flowable<Object> records = multiplexer.recordStream();

        // Route first so a subscriber that is already waiting sees the first record.
        recordOutput.accept(records.onErrorResumeNext(error -> Flowable.empty()));

        Disposable watcher = records.subscribe(
                ignored -> { },
                error -> events.accept(new ChannelEvent.ChannelTerminated(
                        Instant.now(), generation, TransportFailures.classify(error))));

        active = new ActiveConnection(generation, multiplexer, watcher);
        log.info("Bound connection #{} to {}", generation, peer);
    }

    private void closeActive(long generation) {
        ActiveConnection current = active;
        if (current == null || current.generation() != generation) {
            return;
        }
        active = null;

        // Switch away before closing so the closing error never reaches subscribers.
        recordOutput.accept(Flowable.empty());
        current.watcher().dispose();
        current.multiplexer().close();
        log.info("Released connection #{} to {}", generation, current.multiplexer().remotePeer());
    }

    private void discard(DuplexChannel channel) {
        log.warn("Dropping surplus channel from {}", channel.remotePeer());
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Ignoring error while closing surplus channel", e);
        }
    }
}
