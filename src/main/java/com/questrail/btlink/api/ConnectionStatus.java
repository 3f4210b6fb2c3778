package com.questrail.btlink.api;

import java.util.Objects;

/**
 * ConnectionStatus
 * -----------------------------------------------------------------------------
 * The single, coarse-grained connection state published by a
 * {@link LinkController}.
 *
 * <p>Exactly one value is current at any time:</p>
 * <ul>
 *   <li>{@link #DISCONNECTED}: no active connection and not listening</li>
 *   <li>{@link #WAITING_FOR_CONNECTION}: listening for an inbound connection</li>
 *   <li>{@link Connected}: bound to a peer</li>
 *   <li>{@link #CONNECTION_ERROR}: the last connect or listen attempt failed,
 *       or the active channel failed with a transport error</li>
 * </ul>
 *
 * <p>Values are compared by equality, so a consumer of the published signal
 * never observes the same value twice in a row. {@code Connected} values for
 * different peers are distinct.</p>
 */
public sealed interface ConnectionStatus
        permits ConnectionStatus.Disconnected,
                ConnectionStatus.WaitingForConnection,
                ConnectionStatus.Connected,
                ConnectionStatus.ConnectionError
{
    ConnectionStatus DISCONNECTED = new Disconnected();
    ConnectionStatus WAITING_FOR_CONNECTION = new WaitingForConnection();
    ConnectionStatus CONNECTION_ERROR = new ConnectionError();

    static ConnectionStatus connected(PeerId peer) {
        return new Connected(peer);
    }

    record Disconnected() implements ConnectionStatus {
        @Override
        public String toString() {
            return "DISCONNECTED";
        }
    }

    record WaitingForConnection() implements ConnectionStatus {
        @Override
        public String toString() {
            return "WAITING_FOR_CONNECTION";
        }
    }

    record Connected(PeerId peer) implements ConnectionStatus {
        public Connected {
            Objects.requireNonNull(peer, "peer");
        }

        @Override
        public String toString() {
            return "CONNECTED(" + peer + ")";
        }
    }

    record ConnectionError() implements ConnectionStatus {
        @Override
        public String toString() {
            return "CONNECTION_ERROR";
        }
    }
}
