package com.questrail.btlink.api;

import java.util.Objects;

/**
 * PeerId
 * -----------------------------------------------------------------------------
 * Identity of a remote device at the other end of a link.
 *
 * <p>The address is the only identity that matters for link arbitration: two
 * {@code PeerId}s are equal when their addresses are equal. For Bluetooth this
 * is the device MAC address ({@code "00:11:22:AA:BB:CC"}); the TCP bridge uses
 * {@code "host:port"}.</p>
 */
public record PeerId(String address)
{
    public PeerId {
        Objects.requireNonNull(address, "address");
        if (address.isBlank()) {
            throw new IllegalArgumentException("address must not be blank");
        }
    }

    public static PeerId of(String address) {
        return new PeerId(address);
    }

    @Override
    public String toString() {
        return address;
    }
}
