package com.questrail.hwm.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks arrive on the endpoint's I/O thread and must not block it.</p>
 */
public interface DatagramEndpointListener
{
    void onTransportUp();

    /**
     * @param cause failure cause, or {@code null} for orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called with one complete datagram, copied out of any framework buffer.
     *
     * @param remote  sender
     * @param payload raw datagram payload
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
