package com.questrail.hwm.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.hwm.observability.CommandCompletedEvent;
import com.questrail.hwm.observability.StationErrorEvent;
import com.questrail.hwm.runtime.TestStation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CommandDatagramAdapterTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static final SocketAddress OPERATOR = new InetSocketAddress("127.0.0.1", 9100);
    private static final SocketAddress STRANGER = new InetSocketAddress("127.0.0.1", 9200);

    private TestStation station;
    private FakeDatagramEndpoint endpoint;
    private CommandDatagramAdapter adapter;

    @BeforeEach
    void setUp() {
        station = TestStation.start();
        endpoint = new FakeDatagramEndpoint();
        Map<SocketAddress, String> users = Map.of(OPERATOR, "operator");
        adapter = new CommandDatagramAdapter(
            endpoint,
            station.manager().commandParser(),
            remote -> Optional.ofNullable(users.get(remote)),
            station.clock(),
            station.sink());
        adapter.start();
    }

    @AfterEach
    void tearDown() {
        adapter.stop();
        station.close();
    }

    private static JsonNode decode(FakeDatagramEndpoint.Sent sent) throws Exception {
        return JSON.readTree(new String(sent.payload(), StandardCharsets.UTF_8));
    }

    @Test
    void tracksTransportState() {
        assertTrue(adapter.isTransportUp());
        adapter.stop();
        assertFalse(adapter.isTransportUp());
    }

    @Test
    void answersEachDatagramWithOneResponseToItsSender() throws Exception {
        endpoint.injectDatagram(OPERATOR,
            "{\"command\": \"station_time\"}".getBytes(StandardCharsets.UTF_8));

        List<FakeDatagramEndpoint.Sent> sent = endpoint.awaitSent(1, 5000);

        assertEquals(OPERATOR, sent.get(0).remote());
        JsonNode response = decode(sent.get(0));
        assertEquals("okay", response.get("status").asText());
        assertTrue(response.get("result").has("timestamp"));
        assertTrue(response.has("received_at"));
        assertTrue(response.has("completed_at"));
    }

    @Test
    void malformedDatagramGetsAnErrorEnvelope() throws Exception {
        endpoint.injectDatagram(OPERATOR, "not json".getBytes(StandardCharsets.UTF_8));

        JsonNode response = decode(endpoint.awaitSent(1, 5000).get(0));

        assertEquals("error", response.get("status").asText());
        assertTrue(response.get("result").get("error_message").asText().contains("malformed"));
    }

    @Test
    void deviceCommandResponseNamesTheDevice() throws Exception {
        endpoint.injectDatagram(OPERATOR, ("{\"command\": \"test_command\", \"device_id\": \"test_device\", "
            + "\"parameters\": {\"test_parameter\": 5}}").getBytes(StandardCharsets.UTF_8));

        JsonNode response = decode(endpoint.awaitSent(1, 5000).get(0));

        assertEquals("test_device", response.get("device_id").asText());
        assertEquals(10, response.get("result").get("test_result").asInt());
    }

    @Test
    void resultWithoutJsonFormStillGetsAReply() throws Exception {
        endpoint.injectDatagram(OPERATOR, "{\"command\": \"clock_command\", \"device_id\": \"test_device\"}"
            .getBytes(StandardCharsets.UTF_8));

        JsonNode response = decode(endpoint.awaitSent(1, 5000).get(0));

        assertEquals("error", response.get("status").asText());
        assertEquals("test_device", response.get("device_id").asText());
    }

    @Test
    void unknownSenderIsRefusedWithoutReachingTheParser() throws Exception {
        endpoint.injectDatagram(STRANGER, "{\"command\": \"station_time\"}".getBytes(StandardCharsets.UTF_8));

        List<FakeDatagramEndpoint.Sent> sent = endpoint.awaitSent(1, 5000);

        assertEquals(STRANGER, sent.get(0).remote());
        assertEquals("error", decode(sent.get(0)).get("status").asText());
        assertTrue(station.sink().eventsOfType(CommandCompletedEvent.class).isEmpty());
    }

    @Test
    void transportFailureIsReported() {
        adapter.onTransportDown(new IOException("socket closed"));

        List<StationErrorEvent> errors = station.sink().eventsOfType(StationErrorEvent.class);
        assertEquals(1, errors.size());
        assertEquals("socket closed", errors.get(0).cause().getMessage());
    }
}
