package com.questrail.hwm.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a datagram-based command transport.
 *
 * <p>The endpoint only moves bytes. Turning a datagram into a command and the
 * response back into a datagram is the job of {@link CommandDatagramAdapter}.</p>
 *
 * <p>Implementations may be backed by Netty or by a test harness.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint and begin receiving datagrams.
     *
     * <p>On successful activation the endpoint notifies its listener via
     * {@link DatagramEndpointListener#onTransportUp()}.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     */
    void stop();

    /**
     * Send a datagram to the specified remote endpoint. Silently dropped while
     * the transport is down.
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Must be called before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);
}
