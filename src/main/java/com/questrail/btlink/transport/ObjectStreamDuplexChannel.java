package com.questrail.btlink.transport;

import com.questrail.btlink.api.PeerId;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.io.Serializable;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ObjectStreamDuplexChannel
 * =============================================================================
 * {@link DuplexChannel} over a pair of socket byte streams, using Java object
 * serialization for records.
 *
 * <h2>Stream construction order</h2>
 * The object output stream is created and flushed <em>before</em> the object
 * input stream. {@link ObjectInputStream}'s constructor blocks until the
 * peer's stream header arrives; if both ends created their input side first,
 * neither header would ever be sent.
 *
 * <h2>Raw bytes and records</h2>
 * Raw bytes travel as block data of the same object stream, so a peer reading
 * through this class can mix {@link #readByte()} and {@link #readRecord()} as
 * long as both ends agree on the order.
 *
 * <h2>Closing</h2>
 * The underlying transport handle is closed first so that a reader blocked in
 * the input stream is released, then both object streams are closed.
 */
public final class ObjectStreamDuplexChannel implements DuplexChannel
{
    private static final Logger log = LoggerFactory.getLogger(ObjectStreamDuplexChannel.class);

    private final PeerId peer;
    private final Closeable transport;
    private final ObjectOutputStream out;
    private final ObjectInputStream in;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Open object streams over an established socket.
     *
     * @param input     socket input stream
     * @param output    socket output stream
     * @param peer      identity of the remote end
     * @param transport the socket itself; closed by {@link #close()}
     * @throws TransportException if the object streams cannot be set up; the
     *                            transport is closed in that case
     */
    public ObjectStreamDuplexChannel(InputStream input,
                                     OutputStream output,
                                     PeerId peer,
                                     Closeable transport) throws TransportException
    {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        this.peer = Objects.requireNonNull(peer, "peer");
        this.transport = Objects.requireNonNull(transport, "transport");

        ObjectOutputStream o = null;
        ObjectInputStream i = null;
        try {
            o = new ObjectOutputStream(output);
            o.flush();
            i = new ObjectInputStream(input);
        } catch (IOException e) {
            closeQuietly(transport);
            throw new TransportException("Can't get stream from socket of " + peer, e);
        }
        this.out = o;
        this.in = i;
    }

    @Override
    public int readByte() throws IOException {
        return in.read();
    }

    @Override
    public Object readRecord() throws IOException {
        try {
            return in.readObject();
        } catch (ClassNotFoundException e) {
            throw new TransportException("Unknown record class from " + peer, e);
        }
    }

    @Override
    public void write(byte[] bytes) throws IOException {
        out.write(bytes);
        out.flush();
    }

    @Override
    public void writeRecord(Serializable record) throws IOException {
        out.writeObject(record);
        out.flush();
    }

    @Override
    public PeerId remotePeer() {
        return peer;
    }

    @Override
    public void close() throws IOException {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        IOException first = null;
        for (Closeable c : new Closeable[] {transport, in, out}) {
            try {
                c.close();
            } catch (IOException e) {
                if (first == null) {
                    first = e;
                }
                else {
                    first.addSuppressed(e);
                }
            }
        }
        if (first != null) {
            throw first;
        }
    }

    private static void closeQuietly(Closeable c) {
        try {
            c.close();
        } catch (IOException e) {
            log.debug("Ignoring close failure after stream setup error", e);
        }
    }
}
