package com.questrail.btlink.runtime;

import com.questrail.btlink.api.ConnectionStatus;
import com.questrail.btlink.api.PeerId;

import io.reactivex.rxjava3.subscribers.TestSubscriber;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full stack over loopback TCP: two runtimes, one waiting for a connection and
 * one connecting out.
 */
class TcpLinkRuntimeIntegrationTest {

    private TcpLinkRuntime listener;
    private TcpLinkRuntime dialer;

    @BeforeEach
    void setUp() {
        listener = TcpLinkRuntime.builder().build();
        dialer = TcpLinkRuntime.builder().build();
    }

    @AfterEach
    void tearDown() {
        dialer.stop();
        listener.stop();
    }

    private static ConnectionStatus awaitStatus(TcpLinkRuntime runtime, Class<? extends ConnectionStatus> kind) {
        return runtime.controller().connectionState()
                .filter(kind::isInstance)
                .timeout(5, TimeUnit.SECONDS)
                .blockingFirst();
    }

    private PeerId listenerPeer() {
        InetSocketAddress bound = listener.adapter().listeningAddresses()
                .timeout(5, TimeUnit.SECONDS)
                .blockingFirst();
        return PeerId.of("127.0.0.1:" + bound.getPort());
    }

    @Test
    void startedRuntimeWaitsForAConnection() {
        listener.start();

        assertEquals(ConnectionStatus.WAITING_FOR_CONNECTION,
                awaitStatus(listener, ConnectionStatus.WaitingForConnection.class));
        assertFalse(listener.controller().isConnected());
    }

    @Test
    void dialerAndListenerExchangeRecords() {
        listener.start();
        PeerId target = listenerPeer();
        TestSubscriber<Object> atListener = listener.controller().incomingData().test();
        TestSubscriber<Object> atDialer = dialer.controller().incomingData().test();

        assertTrue(dialer.controller().connect(target).blockingAwait(5, TimeUnit.SECONDS));
        awaitStatus(listener, ConnectionStatus.Connected.class);

        assertEquals(ConnectionStatus.connected(target),
                awaitStatus(dialer, ConnectionStatus.Connected.class));
        assertTrue(dialer.controller().sendRecord("hello"));
        atListener.awaitCount(1);
        atListener.assertValues("hello");

        assertTrue(listener.controller().sendRecord("welcome"));
        atDialer.awaitCount(1);
        atDialer.assertValues("welcome");
    }

    @Test
    void listenerWaitsAgainAfterTheDialerHangsUp() {
        listener.start();
        PeerId target = listenerPeer();
        assertTrue(dialer.controller().connect(target).blockingAwait(5, TimeUnit.SECONDS));
        awaitStatus(listener, ConnectionStatus.Connected.class);

        dialer.controller().disconnect();

        assertEquals(ConnectionStatus.WAITING_FOR_CONNECTION,
                awaitStatus(listener, ConnectionStatus.WaitingForConnection.class));
    }

    @Test
    void radioOffStopsListening() {
        listener.start();
        awaitStatus(listener, ConnectionStatus.WaitingForConnection.class);

        listener.adapter().setRadioEnabled(false);

        assertEquals(ConnectionStatus.DISCONNECTED,
                awaitStatus(listener, ConnectionStatus.Disconnected.class));
    }
}
