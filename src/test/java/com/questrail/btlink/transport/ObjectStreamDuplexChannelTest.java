package com.questrail.btlink.transport;

import com.questrail.btlink.api.PeerId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ObjectStreamDuplexChannelTest
 * -----------------------------------------------------------------------------
 * Exercises the object-stream channel over a real loopback socket pair.
 */
class ObjectStreamDuplexChannelTest {

    private static final PeerId CLIENT = PeerId.of("client");
    private static final PeerId SERVER = PeerId.of("server");

    private ServerSocket listener;
    private ObjectStreamDuplexChannel client;
    private ObjectStreamDuplexChannel server;

    @BeforeEach
    void setUp() throws Exception {
        listener = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        Socket clientSocket = new Socket(InetAddress.getLoopbackAddress(), listener.getLocalPort());
        Socket serverSocket = listener.accept();

        // Each constructor waits for the other end's stream header.
        CompletableFuture<ObjectStreamDuplexChannel> serverSide =
                CompletableFuture.supplyAsync(() -> open(serverSocket, CLIENT));
        client = open(clientSocket, SERVER);
        server = serverSide.get(5, TimeUnit.SECONDS);
    }

    @AfterEach
    void tearDown() throws IOException {
        client.close();
        server.close();
        listener.close();
    }

    private static ObjectStreamDuplexChannel open(Socket socket, PeerId peer) {
        try {
            return new ObjectStreamDuplexChannel(socket.getInputStream(), socket.getOutputStream(), peer, socket);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Test
    void recordsCrossInBothDirections() throws IOException {
        client.writeRecord("ping");
        assertEquals("ping", server.readRecord());

        server.writeRecord(new ArrayList<>(List.of(1, 2, 3)));
        assertEquals(List.of(1, 2, 3), client.readRecord());
    }

    @Test
    void rawBytesArriveInOrder() throws IOException {
        client.write(new byte[] {0x41, 0x0D, (byte) 0xFF});

        assertEquals(0x41, server.readByte());
        assertEquals(0x0D, server.readByte());
        assertEquals(0xFF, server.readByte());
    }

    @Test
    void remotePeerIsTheIdentityGivenAtConstruction() {
        assertEquals(SERVER, client.remotePeer());
        assertEquals(CLIENT, server.remotePeer());
    }

    @Test
    void peerCloseEndsTheRecordStream() throws IOException {
        client.close();

        assertThrows(EOFException.class, server::readRecord);
    }

    @Test
    void peerCloseEndsTheByteStream() throws IOException {
        client.close();

        assertEquals(-1, server.readByte());
    }

    @Test
    void closeReleasesABlockedReader() throws Exception {
        CompletableFuture<Object> read = CompletableFuture.supplyAsync(() -> {
            try {
                return server.readRecord();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        Thread.sleep(100);

        server.close();

        ExecutionException failure = assertThrows(ExecutionException.class, () -> read.get(5, TimeUnit.SECONDS));
        assertTrue(TransportFailures.isClosure(failure.getCause().getCause()));
    }

    @Test
    void closeIsIdempotent() throws IOException {
        server.close();
        assertDoesNotThrow(() -> server.close());
    }

    @Test
    void setupFailureClosesTheTransport() {
        AtomicBoolean closed = new AtomicBoolean(false);

        TransportException e = assertThrows(TransportException.class, () ->
                new ObjectStreamDuplexChannel(
                        new ByteArrayInputStream(new byte[0]),
                        new ByteArrayOutputStream(),
                        CLIENT,
                        () -> closed.set(true)));

        assertTrue(closed.get());
        assertInstanceOf(EOFException.class, e.getCause());
    }
}
