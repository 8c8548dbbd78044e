package com.questrail.hwm.pipeline;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One telemetry point written by a device, routed through its active
 * pipelines to the session's user.
 *
 * @param stream  device-defined stream name, used by clients to group data
 * @param payload datum (a map, a number, an encoded image...)
 * @param binary  whether the payload must be encoded before transmission
 * @param headers extra fields sent along with the datum
 */
public record TelemetryDatum(
    String deviceId,
    String stream,
    Instant timestamp,
    Object payload,
    boolean binary,
    Map<String, Object> headers
) {
    public TelemetryDatum {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(stream, "stream");
        Objects.requireNonNull(timestamp, "timestamp");
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }
}
