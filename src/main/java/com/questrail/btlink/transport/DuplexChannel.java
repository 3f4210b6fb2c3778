package com.questrail.btlink.transport;

import com.questrail.btlink.api.PeerId;

import java.io.Closeable;
import java.io.IOException;
import java.io.Serializable;

/**
 * DuplexChannel
 * -----------------------------------------------------------------------------
 * Port for an already-established, bidirectional byte channel (an accepted or
 * connected RFCOMM socket, or a test double).
 *
 * <p>Reads are blocking. The read and write directions are independent: a
 * thread blocked in {@link #readByte()} must not prevent another thread from
 * writing. Implementations need not serialize concurrent writers; callers
 * (the {@code StreamMultiplexer}) do that.</p>
 *
 * <p>{@link #close()} should unblock pending reads. Implementations whose
 * transport cannot guarantee that may instead fail (or return) the next read;
 * the multiplexer tolerates one such additional read.</p>
 */
public interface DuplexChannel extends Closeable
{
    /**
     * Block until one byte is available.
     *
     * @return the byte as an unsigned value {@code 0..255}, or {@code -1} at
     *         end of stream (peer hang-up)
     * @throws IOException on transport failure or when the channel is closed
     */
    int readByte() throws IOException;

    /**
     * Block until one complete record has been received and decoded.
     *
     * @throws IOException on transport failure, end of stream, or when the
     *                     record cannot be decoded
     */
    Object readRecord() throws IOException;

    /** Write and flush the given bytes. */
    void write(byte[] bytes) throws IOException;

    /** Encode, write and flush one record. */
    void writeRecord(Serializable record) throws IOException;

    /** Identity of the remote end. */
    PeerId remotePeer();

    /**
     * Release the channel. Closing an already-closed channel has no effect.
     */
    @Override
    void close() throws IOException;
}
