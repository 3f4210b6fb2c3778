package com.questrail.btlink.transport;

import java.io.IOException;

/**
 * Generic transport failure of a duplex channel: anything other than an
 * orderly or abrupt close by either side.
 */
public class TransportException extends IOException
{
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
