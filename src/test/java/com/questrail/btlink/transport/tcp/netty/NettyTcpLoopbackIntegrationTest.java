package com.questrail.btlink.transport.tcp.netty;

import com.questrail.btlink.api.LinkEvent;
import com.questrail.btlink.api.PeerId;
import com.questrail.btlink.api.ProxyUnavailableException;
import com.questrail.btlink.mux.StreamMultiplexer;
import com.questrail.btlink.transport.ConnectionClosedException;
import com.questrail.btlink.transport.DuplexChannel;
import com.questrail.btlink.transport.TransportException;

import io.reactivex.rxjava3.observers.TestObserver;
import io.reactivex.rxjava3.subscribers.TestSubscriber;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyTcpLoopbackIntegrationTest
 * -----------------------------------------------------------------------------
 * Two TCP adapters on the loopback interface: one listens, the other connects.
 * Channels are exercised through {@link StreamMultiplexer}s as the manager
 * would.
 */
final class NettyTcpLoopbackIntegrationTest {

    private NettyTcpAdapterFacade listenSide;
    private NettyTcpAdapterFacade connectSide;

    @BeforeEach
    void setUp() {
        listenSide = new NettyTcpAdapterFacade(new InetSocketAddress("127.0.0.1", 0), Set.of());
        connectSide = new NettyTcpAdapterFacade(new InetSocketAddress("127.0.0.1", 0),
                Set.of(PeerId.of("127.0.0.1:1")));
    }

    @AfterEach
    void tearDown() {
        connectSide.shutdown();
        listenSide.shutdown();
    }

    private PeerId listenerPeer() {
        InetSocketAddress bound = listenSide.listeningAddresses()
                .timeout(5, TimeUnit.SECONDS)
                .blockingFirst();
        return PeerId.of("127.0.0.1:" + bound.getPort());
    }

    @Test
    void acceptedAndConnectedChannelsExchangeRecordsAndBytes() throws Exception {
        TestObserver<DuplexChannel> accepted = listenSide.listenOnce("btlink").test();
        PeerId target = listenerPeer();

        DuplexChannel outbound = connectSide.connectTo(target).timeout(5, TimeUnit.SECONDS).blockingGet();
        accepted.await(5, TimeUnit.SECONDS);
        accepted.assertValueCount(1);
        DuplexChannel inbound = accepted.values().get(0);

        assertEquals(target, outbound.remotePeer());

        try (StreamMultiplexer server = new StreamMultiplexer(inbound);
             StreamMultiplexer client = new StreamMultiplexer(outbound)) {

            TestSubscriber<Object> records = server.recordStream().test();
            assertTrue(client.sendRecord("ping"));
            records.awaitCount(1);
            records.assertValues("ping");

            TestSubscriber<Object> replies = client.recordStream().test();
            assertTrue(server.sendRecord(7));
            replies.awaitCount(1);
            replies.assertValues(7);
        }
    }

    @Test
    void peerCloseSurfacesOnTheOtherEnd() throws Exception {
        TestObserver<DuplexChannel> accepted = listenSide.listenOnce("btlink").test();
        DuplexChannel outbound = connectSide.connectTo(listenerPeer()).timeout(5, TimeUnit.SECONDS).blockingGet();
        accepted.await(5, TimeUnit.SECONDS);

        StreamMultiplexer server = new StreamMultiplexer(accepted.values().get(0));
        TestSubscriber<Object> records = server.recordStream().test();

        outbound.close();

        records.awaitDone(5, TimeUnit.SECONDS);
        records.assertError(ConnectionClosedException.class);
        server.close();
    }

    @Test
    void linkEventsFollowTheChannel() throws Exception {
        TestObserver<LinkEvent> events = connectSide.linkEvents().test();
        TestObserver<DuplexChannel> accepted = listenSide.listenOnce("btlink").test();
        PeerId target = listenerPeer();

        DuplexChannel outbound = connectSide.connectTo(target).timeout(5, TimeUnit.SECONDS).blockingGet();
        events.awaitCount(1);
        events.assertValueAt(0, LinkEvent.connected(target));

        accepted.await(5, TimeUnit.SECONDS);
        accepted.values().get(0).close();

        events.awaitCount(2);
        events.assertValueAt(1, LinkEvent.disconnected(target));
        outbound.close();
    }

    @Test
    void disposingAListenReleasesThePort() throws Exception {
        TestObserver<DuplexChannel> listen = listenSide.listenOnce("btlink").test();
        PeerId target = listenerPeer();

        listen.dispose();
        Thread.sleep(200);

        connectSide.connectTo(target)
                .timeout(5, TimeUnit.SECONDS)
                .test()
                .await()
                .assertError(Throwable.class);
    }

    @Test
    void connectingToNothingFails() throws Exception {
        TestObserver<DuplexChannel> attempt = connectSide.connectTo(PeerId.of("127.0.0.1:1")).test();

        attempt.await(10, TimeUnit.SECONDS);
        attempt.assertError(TransportException.class);
    }

    @Test
    void malformedPeerAddressIsRejected() throws InterruptedException {
        connectSide.connectTo(PeerId.of("no-port"))
                .test()
                .await()
                .assertError(IllegalArgumentException.class);
    }

    @Test
    void radioChangesAreSignalledOnlyOnChange() {
        TestObserver<Boolean> radio = listenSide.radioStateChanges().test();

        listenSide.setRadioEnabled(true);
        listenSide.setRadioEnabled(false);
        listenSide.setRadioEnabled(false);
        listenSide.setRadioEnabled(true);

        radio.assertValues(false, true);
        assertTrue(listenSide.isRadioEnabled());
    }

    @Test
    void adapterFactsAreStatic() {
        assertTrue(connectSide.missingPermissions().isEmpty());
        assertEquals(Set.of(PeerId.of("127.0.0.1:1")), connectSide.bondedPeers());
        connectSide.observeProfile(1).test().assertError(ProxyUnavailableException.class);
    }

    @Test
    void peerAddressesRoundTripThroughSocketAddresses() {
        InetSocketAddress address = NettyTcpAdapterFacade.addressOf(PeerId.of("127.0.0.1:4242"));

        assertEquals(4242, address.getPort());
        assertEquals(PeerId.of("127.0.0.1:4242"), NettyTcpAdapterFacade.peerOf(address));
    }
}
