/**
 * Link Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>platform-agnostic boundary</em> between a
 * concrete radio stack (an Android Bluetooth adapter, a BlueZ binding, the
 * Netty TCP bridge, or a test double) and the stream multiplexer and
 * connection manager.
 *
 * <h2>Why these ports exist</h2>
 * Platform types (sockets, broadcast receivers, Netty channels) must not leak
 * into the link core. Everything above this package sees only:
 * <ul>
 *   <li>{@link com.questrail.btlink.transport.DuplexChannel}: blocking byte and
 *       record I/O on one established connection</li>
 *   <li>{@link com.questrail.btlink.transport.AdapterFacade}: radio state,
 *       link-layer events and the two channel-producing operations</li>
 *   <li>The two transport failure kinds,
 *       {@link com.questrail.btlink.transport.ConnectionClosedException} and
 *       {@link com.questrail.btlink.transport.TransportException}</li>
 * </ul>
 *
 * <h2>Constraints on implementations</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only</li>
 *   <li>Not decide whether to listen, connect or reconnect</li>
 *   <li>Not retry failed accepts or connects</li>
 * </ul>
 */
package com.questrail.btlink.transport;
