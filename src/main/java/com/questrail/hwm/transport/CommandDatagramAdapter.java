package com.questrail.hwm.transport;

import com.questrail.hwm.command.CommandParser;
import com.questrail.hwm.command.CommandResponse;
import com.questrail.hwm.internal.time.WallClock;
import com.questrail.hwm.observability.NullObservabilitySink;
import com.questrail.hwm.observability.StationErrorEvent;
import com.questrail.hwm.observability.StationObservabilitySink;

import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * CommandDatagramAdapter
 * =============================================================================
 * Connects a {@link DatagramEndpoint} to the {@link CommandParser}.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   DatagramEndpoint
 *        → UTF-8 JSON text
 *            → sender → user id
 *                → CommandParser.parseCommand(raw, userId)
 * </pre>
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   CommandResponse.toJson()
 *        → UTF-8 bytes
 *            → DatagramEndpoint.send(sender, ...)
 * </pre>
 *
 * Each datagram is exactly one request and is answered by exactly one
 * datagram to its sender. Senders the user resolver does not know are
 * answered with an error envelope and never reach the parser.
 */
public final class CommandDatagramAdapter implements DatagramEndpointListener
{
    private final DatagramEndpoint endpoint;
    private final CommandParser parser;
    private final Function<SocketAddress, Optional<String>> userResolver;
    private final WallClock clock;
    private final StationObservabilitySink observabilitySink;

    private volatile boolean transportUp;

    public CommandDatagramAdapter(DatagramEndpoint endpoint,
                                  CommandParser parser,
                                  Function<SocketAddress, Optional<String>> userResolver,
                                  WallClock clock,
                                  StationObservabilitySink observabilitySink)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.userResolver = Objects.requireNonNull(userResolver, "userResolver");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.endpoint.setListener(this);
    }

    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    public boolean isTransportUp() {
        return transportUp;
    }

    // -------------------------------------------------------------------------
    // DatagramEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        transportUp = true;
    }

    @Override
    public void onTransportDown(Throwable cause) {
        transportUp = false;
        if (cause != null) {
            observabilitySink.onError(new StationErrorEvent(clock.now(), "Command transport failed", cause));
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        Optional<String> userId = userResolver.apply(remote);
        if (userId.isEmpty()) {
            Instant now = clock.now();
            reply(remote, CommandResponse.error("Commands from " + remote + " are not accepted.", now, now));
            return;
        }

        String raw = new String(payload, StandardCharsets.UTF_8);
        parser.parseCommand(raw, userId.get())
            .thenAccept(response -> reply(remote, response))
            .whenComplete((ignored, error) -> {
                if (error != null) {
                    observabilitySink.onError(new StationErrorEvent(clock.now(),
                        "Could not answer the command from " + remote, error));
                }
            });
    }

    private void reply(SocketAddress remote, CommandResponse response) {
        endpoint.send(remote, response.toJson().getBytes(StandardCharsets.UTF_8));
    }
}
