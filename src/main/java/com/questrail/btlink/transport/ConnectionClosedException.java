package com.questrail.btlink.transport;

/**
 * The channel was closed, by the peer (hang-up, end of stream) or locally.
 */
public final class ConnectionClosedException extends TransportException
{
    public ConnectionClosedException() {
        super("Connection is closed.");
    }

    public ConnectionClosedException(String message) {
        super(message);
    }

    public ConnectionClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
