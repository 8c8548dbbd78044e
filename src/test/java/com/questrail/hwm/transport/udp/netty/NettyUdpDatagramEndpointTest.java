package com.questrail.hwm.transport.udp.netty;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.hwm.runtime.TestStation;
import com.questrail.hwm.transport.CommandDatagramAdapter;
import com.questrail.hwm.transport.DatagramEndpointListener;
import org.junit.jupiter.api.Test;

import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class NettyUdpDatagramEndpointTest {

    private static final InetSocketAddress LOOPBACK_ANY_PORT = new InetSocketAddress("127.0.0.1", 0);

    /**
     * Listener that sends every datagram straight back to its sender.
     */
    private static final class EchoListener implements DatagramEndpointListener {
        private NettyUdpDatagramEndpoint endpoint;

        @Override
        public void onTransportUp() {
        }

        @Override
        public void onTransportDown(Throwable cause) {
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload) {
            endpoint.send(remote, payload);
        }
    }

    @Test
    void startWithoutListenerIsRejected() {
        NettyUdpDatagramEndpoint endpoint = new NettyUdpDatagramEndpoint(LOOPBACK_ANY_PORT);
        try {
            assertThrows(IllegalStateException.class, endpoint::start);
        } finally {
            endpoint.stop();
        }
    }

    @Test
    void echoesDatagramOverLoopback() throws Exception {
        NettyUdpDatagramEndpoint endpoint = new NettyUdpDatagramEndpoint(LOOPBACK_ANY_PORT);
        EchoListener echo = new EchoListener();
        echo.endpoint = endpoint;
        endpoint.setListener(echo);
        endpoint.start();

        try (DatagramSocket client = new DatagramSocket(0, InetAddress.getLoopbackAddress())) {
            client.setSoTimeout(5000);
            InetSocketAddress server = endpoint.bound().get(5, TimeUnit.SECONDS);

            byte[] payload = {0x01, 0x02, 0x03};
            client.send(new DatagramPacket(payload, payload.length, server));

            byte[] buffer = new byte[64];
            DatagramPacket reply = new DatagramPacket(buffer, buffer.length);
            client.receive(reply);

            assertArrayEquals(payload, Arrays.copyOf(reply.getData(), reply.getLength()));
        } finally {
            endpoint.stop();
        }
    }

    @Test
    void commandRoundTripOverRealSocket() throws Exception {
        NettyUdpDatagramEndpoint endpoint = new NettyUdpDatagramEndpoint(LOOPBACK_ANY_PORT);

        try (TestStation station = TestStation.start();
             DatagramSocket client = new DatagramSocket(0, InetAddress.getLoopbackAddress())) {
            CommandDatagramAdapter adapter = new CommandDatagramAdapter(
                endpoint,
                station.manager().commandParser(),
                remote -> Optional.of("operator"),
                station.clock(),
                station.sink());
            adapter.start();
            client.setSoTimeout(5000);
            InetSocketAddress server = endpoint.bound().get(5, TimeUnit.SECONDS);

            byte[] request = "{\"command\": \"station_time\"}".getBytes(StandardCharsets.UTF_8);
            client.send(new DatagramPacket(request, request.length, server));

            byte[] buffer = new byte[4096];
            DatagramPacket reply = new DatagramPacket(buffer, buffer.length);
            client.receive(reply);

            JsonNode response = new ObjectMapper().readTree(
                new String(reply.getData(), 0, reply.getLength(), StandardCharsets.UTF_8));
            assertEquals("okay", response.get("status").asText());
            assertTrue(adapter.isTransportUp());
        } finally {
            endpoint.stop();
        }
    }
}
