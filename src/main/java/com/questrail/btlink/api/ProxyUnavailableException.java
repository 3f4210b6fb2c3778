package com.questrail.btlink.api;

/**
 * Signalled when the handshake with a profile proxy service could not be
 * started. Reported to the requesting subscriber only; it has no effect on the
 * connection state machine.
 */
public final class ProxyUnavailableException extends RuntimeException
{
    private final int profile;

    public ProxyUnavailableException(int profile) {
        super("Failed to get profile proxy for profile " + profile);
        this.profile = profile;
    }

    public int profile() {
        return profile;
    }
}
