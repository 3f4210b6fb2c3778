package com.questrail.btlink.transport;

import java.io.EOFException;
import java.io.ObjectStreamException;
import java.net.SocketException;
import java.nio.channels.ClosedChannelException;
import java.util.Objects;

/**
 * Classification of channel failures into {@link ConnectionClosedException}
 * and {@link TransportException}.
 */
public final class TransportFailures
{
    private TransportFailures() {}

    /**
     * Map an arbitrary read/write failure onto the transport error kinds.
     *
     * <p>End of stream, closed channels and socket resets count as
     * "closed". Stream corruption, undecodable records and every other failure
     * count as generic transport errors. Already-classified exceptions are
     * returned unchanged.</p>
     */
    public static TransportException classify(Throwable failure) {
        Objects.requireNonNull(failure, "failure");

        if (failure instanceof TransportException t) {
            return t;
        }
        if (isClosure(failure)) {
            return new ConnectionClosedException("Can't read stream", failure);
        }
        return new TransportException("Transport failure: " + failure.getMessage(), failure);
    }

    /**
     * True for the failures that mean the channel is gone rather than broken.
     */
    public static boolean isClosure(Throwable failure) {
        if (failure instanceof ConnectionClosedException
                || failure instanceof EOFException
                || failure instanceof ClosedChannelException) {
            return true;
        }
        // ObjectStreamException subclasses are decoding problems, not closure.
        if (failure instanceof ObjectStreamException) {
            return false;
        }
        return failure instanceof SocketException;
    }
}
