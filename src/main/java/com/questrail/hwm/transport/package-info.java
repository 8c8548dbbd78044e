/**
 * Command Transport Ports
 * =============================================================================
 *
 * These interfaces define the boundary between a concrete networking
 * implementation (Netty UDP, a test double) and the command parser.
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>Raw datagram payloads as {@code byte[]}</li>
 *   <li>Remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>Transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Endpoint implementations perform transport I/O only. They do not parse
 * commands, resolve users or touch device state; that is the job of
 * {@link com.questrail.hwm.transport.CommandDatagramAdapter}.
 */
package com.questrail.hwm.transport;
