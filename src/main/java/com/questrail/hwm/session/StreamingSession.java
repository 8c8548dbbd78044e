package com.questrail.hwm.session;

import com.questrail.hwm.pipeline.TelemetryDatum;

import java.util.Objects;

/**
 * Session that forwards pipeline output and telemetry to a {@link SessionStream}.
 */
public final class StreamingSession implements Session
{
    private final ReservationConfig configuration;
    private final SessionStream stream;

    public StreamingSession(ReservationConfig configuration, SessionStream stream) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.stream = Objects.requireNonNull(stream, "stream");
    }

    @Override
    public ReservationConfig configuration() {
        return configuration;
    }

    @Override
    public void writeOutput(byte[] data) {
        stream.onOutput(configuration.reservationId(), data);
    }

    @Override
    public void writeTelemetry(TelemetryDatum datum) {
        stream.onTelemetry(configuration.reservationId(), datum);
    }

    @Override
    public String toString() {
        return "StreamingSession[" + configuration.reservationId() + " on " + configuration.pipelineId() + "]";
    }
}
