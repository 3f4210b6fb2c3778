package com.questrail.btlink.transport.tcp.netty;

import com.questrail.btlink.api.LinkEvent;
import com.questrail.btlink.api.PeerId;
import com.questrail.btlink.api.ProfileEvent;
import com.questrail.btlink.api.ProxyUnavailableException;
import com.questrail.btlink.transport.AdapterFacade;
import com.questrail.btlink.transport.DuplexChannel;
import com.questrail.btlink.transport.TransportException;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.schedulers.Schedulers;
import io.reactivex.rxjava3.subjects.BehaviorSubject;
import io.reactivex.rxjava3.subjects.PublishSubject;
import io.reactivex.rxjava3.subjects.Subject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpAdapterFacade
 * =============================================================================
 * Netty-backed implementation of the {@link AdapterFacade} port over plain TCP.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong> standing in for a
 * radio adapter: RFCOMM sockets become TCP sockets, peer addresses become
 * {@code host:port} strings. It is used against emulators and in integration
 * tests.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Decide between listening and connecting</li>
 *   <li>Retry failed attempts</li>
 *   <li>Interpret records</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Channels leave it as {@link DuplexChannel}s.
 *
 * <h2>Simulated adapter state</h2>
 * <ul>
 *   <li>Radio: on at construction, toggled with {@link #setRadioEnabled(boolean)}</li>
 *   <li>Permissions: always granted</li>
 *   <li>Bonded peers: fixed at construction</li>
 *   <li>Profile proxies: never available</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * {@link #shutdown()} closes every channel and shuts down the event loop group.
 */
public final class NettyTcpAdapterFacade implements AdapterFacade
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpAdapterFacade.class);

    private record Opened(Channel channel, NettyStreamBridge bridge) {}

    private final InetSocketAddress listenAddress;
    private final Set<PeerId> bondedPeers;
    private final Scheduler setupScheduler;
    private final EventLoopGroup group;

    private final AtomicBoolean radioEnabled = new AtomicBoolean(true);
    private final Subject<Boolean> radioChanges = PublishSubject.<Boolean>create().toSerialized();
    private final Subject<LinkEvent> linkEvents = PublishSubject.<LinkEvent>create().toSerialized();
    private final Subject<InetSocketAddress> listening = BehaviorSubject.<InetSocketAddress>create().toSerialized();

    /**
     * @param listenAddress local address listen attempts bind; port {@code 0}
     *                      picks a free port per attempt
     * @param bondedPeers   peers reported as bonded
     */
    public NettyTcpAdapterFacade(InetSocketAddress listenAddress, Set<PeerId> bondedPeers)
    {
        this(listenAddress, bondedPeers, Schedulers.io());
    }

    /**
     * @param setupScheduler scheduler that opens object streams on new channels;
     *                       the header exchange blocks, so never an event loop
     */
    public NettyTcpAdapterFacade(InetSocketAddress listenAddress,
                                 Set<PeerId> bondedPeers,
                                 Scheduler setupScheduler)
    {
        this.listenAddress = Objects.requireNonNull(listenAddress, "listenAddress");
        this.bondedPeers = Set.copyOf(bondedPeers);
        this.setupScheduler = Objects.requireNonNull(setupScheduler, "setupScheduler");
        this.group = new NioEventLoopGroup(2);
    }

    // -------------------------------------------------------------------------
    // Simulated radio
    // -------------------------------------------------------------------------

    /**
     * Simulate the radio being switched on or off. Only actual changes are
     * signalled.
     */
    public void setRadioEnabled(boolean enabled)
    {
        if (radioEnabled.getAndSet(enabled) != enabled) {
            log.info("Radio {}", enabled ? "enabled" : "disabled");
            radioChanges.onNext(enabled);
        }
    }

    @Override
    public boolean isRadioEnabled()
    {
        return radioEnabled.get();
    }

    @Override
    public Observable<Boolean> radioStateChanges()
    {
        return radioChanges.hide();
    }

    @Override
    public Observable<LinkEvent> linkEvents()
    {
        return linkEvents.hide();
    }

    /**
     * Local address of the most recent listen attempt, once bound. Replays the
     * latest one.
     */
    public Observable<InetSocketAddress> listeningAddresses()
    {
        return listening.hide();
    }

    // -------------------------------------------------------------------------
    // Channels
    // -------------------------------------------------------------------------

    @Override
    public Single<DuplexChannel> listenOnce(String serviceName)
    {
        Objects.requireNonNull(serviceName, "serviceName");

        return Single.<Opened>create(emitter -> {
                    AtomicBoolean accepted = new AtomicBoolean(false);

                    ServerBootstrap bootstrap = new ServerBootstrap()
                            .group(group)
                            .channel(NioServerSocketChannel.class)
                            .childHandler(new ChannelInitializer<SocketChannel>() {
                                @Override
                                protected void initChannel(SocketChannel ch)
                                {
                                    // Accept exactly one; later children are refused.
                                    if (!accepted.compareAndSet(false, true) || emitter.isDisposed()) {
                                        ch.close();
                                        return;
                                    }
                                    NettyStreamBridge bridge =
                                            new NettyStreamBridge(peerOf(ch.remoteAddress()), linkEvents::onNext);
                                    ch.pipeline().addLast(bridge);
                                    ch.parent().close();
                                    emitter.onSuccess(new Opened(ch, bridge));
                                }
                            });

                    ChannelFuture bind = bootstrap.bind(listenAddress);
                    emitter.setCancellable(() -> bind.channel().close());

                    bind.addListener((ChannelFutureListener) future -> {
                        if (future.isSuccess()) {
                            InetSocketAddress local = (InetSocketAddress) future.channel().localAddress();
                            log.info("Listening for '{}' on {}", serviceName, local);
                            listening.onNext(local);
                        } else {
                            emitter.tryOnError(new TransportException(
                                    "Cannot listen for '" + serviceName + "' on " + listenAddress,
                                    future.cause()));
                        }
                    });
                })
                .observeOn(setupScheduler)
                .map(opened -> opened.bridge().open(opened.channel()));
    }

    @Override
    public Single<DuplexChannel> connectTo(PeerId peer)
    {
        Objects.requireNonNull(peer, "peer");

        return Single.<Opened>create(emitter -> {
                    InetSocketAddress remote = addressOf(peer);
                    NettyStreamBridge bridge = new NettyStreamBridge(peer, linkEvents::onNext);
                    AtomicBoolean delivered = new AtomicBoolean(false);

                    ChannelFuture connect = new Bootstrap()
                            .group(group)
                            .channel(NioSocketChannel.class)
                            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
                            .handler(bridge)
                            .connect(remote);

                    emitter.setCancellable(() -> {
                        if (!delivered.get()) {
                            connect.channel().close();
                        }
                    });

                    connect.addListener((ChannelFutureListener) future -> {
                        if (future.isSuccess()) {
                            log.info("Connected to {}", peer);
                            delivered.set(true);
                            emitter.onSuccess(new Opened(future.channel(), bridge));
                        } else {
                            emitter.tryOnError(new TransportException(
                                    "Cannot connect to " + peer, future.cause()));
                        }
                    });
                })
                .observeOn(setupScheduler)
                .map(opened -> opened.bridge().open(opened.channel()));
    }

    // -------------------------------------------------------------------------
    // Adapter facts
    // -------------------------------------------------------------------------

    @Override
    public List<String> missingPermissions()
    {
        return List.of();
    }

    @Override
    public Set<PeerId> bondedPeers()
    {
        return bondedPeers;
    }

    @Override
    public Observable<ProfileEvent> observeProfile(int profile)
    {
        return Observable.error(new ProxyUnavailableException(profile));
    }

    /**
     * Shut down the event loop group, closing every channel it serves.
     */
    public void shutdown()
    {
        log.info("Shutting down TCP adapter");
        group.shutdownGracefully();
    }

    // -------------------------------------------------------------------------
    // Addressing
    // -------------------------------------------------------------------------

    static PeerId peerOf(SocketAddress address)
    {
        if (address instanceof InetSocketAddress inet) {
            return PeerId.of(inet.getHostString() + ":" + inet.getPort());
        }
        return PeerId.of(String.valueOf(address));
    }

    static InetSocketAddress addressOf(PeerId peer)
    {
        String address = peer.address();
        int colon = address.lastIndexOf(':');
        if (colon <= 0 || colon == address.length() - 1) {
            throw new IllegalArgumentException("Peer address must be host:port, was " + address);
        }
        String host = address.substring(0, colon);
        int port = Integer.parseInt(address.substring(colon + 1));
        return new InetSocketAddress(host, port);
    }
}
