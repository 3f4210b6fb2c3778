package com.questrail.btlink.runtime;

import com.questrail.btlink.ConnectionManager;
import com.questrail.btlink.api.LinkController;
import com.questrail.btlink.api.PeerId;
import com.questrail.btlink.config.LinkRuntimeConfig;
import com.questrail.btlink.observability.LinkObservabilitySink;
import com.questrail.btlink.observability.Slf4jLinkObservabilitySink;
import com.questrail.btlink.transport.tcp.netty.NettyTcpAdapterFacade;

import io.reactivex.rxjava3.schedulers.Schedulers;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Set;

/**
 * TcpLinkRuntime
 * =============================================================================
 * Composition root for running a {@link ConnectionManager} over the Netty TCP
 * adapter.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>wiring and ownership component only</strong>. It
 * builds the adapter and the manager, starts them in order and shuts them down
 * in reverse. No connection semantics live here.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * TcpLinkRuntime runtime = TcpLinkRuntime.builder()
 *     .withListenAddress(new InetSocketAddress("127.0.0.1", 0))
 *     .withConfig(LinkRuntimeConfig.defaults())
 *     .build();
 *
 * runtime.start();
 * runtime.controller().connectionState().subscribe(...);
 * runtime.stop();
 * }</pre>
 */
public final class TcpLinkRuntime
{
    private final NettyTcpAdapterFacade adapter;
    private final ConnectionManager manager;

    private TcpLinkRuntime(NettyTcpAdapterFacade adapter, ConnectionManager manager)
    {
        this.adapter = adapter;
        this.manager = manager;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Start the manager; listening is armed if the simulated radio is on.
     */
    public void start()
    {
        manager.start();
    }

    /**
     * Stop the manager, then release the adapter's sockets and threads.
     */
    public void stop()
    {
        manager.stop();
        adapter.shutdown();
    }

    public LinkController controller()
    {
        return manager;
    }

    public ConnectionManager manager()
    {
        return manager;
    }

    /**
     * The adapter, for simulating radio changes and discovering listen addresses.
     */
    public NettyTcpAdapterFacade adapter()
    {
        return adapter;
    }

    public static final class Builder
    {
        private InetSocketAddress listenAddress = new InetSocketAddress("127.0.0.1", 0);
        private Set<PeerId> bondedPeers = Set.of();
        private LinkRuntimeConfig config = LinkRuntimeConfig.defaults();
        private LinkObservabilitySink observabilitySink = new Slf4jLinkObservabilitySink();

        public Builder withListenAddress(InetSocketAddress listenAddress)
        {
            this.listenAddress = listenAddress;
            return this;
        }

        public Builder withBondedPeers(Set<PeerId> bondedPeers)
        {
            this.bondedPeers = bondedPeers;
            return this;
        }

        public Builder withConfig(LinkRuntimeConfig config)
        {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(LinkObservabilitySink observabilitySink)
        {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public TcpLinkRuntime build()
        {
            Objects.requireNonNull(listenAddress, "listenAddress");
            Objects.requireNonNull(bondedPeers, "bondedPeers");
            Objects.requireNonNull(config, "config");

            NettyTcpAdapterFacade adapter = new NettyTcpAdapterFacade(listenAddress, bondedPeers);
            ConnectionManager manager = new ConnectionManager(
                    adapter, config, Schedulers.io(), Schedulers.io(), observabilitySink);
            return new TcpLinkRuntime(adapter, manager);
        }
    }
}
