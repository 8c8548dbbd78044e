package com.questrail.hwm.session;

import com.questrail.hwm.pipeline.TelemetryDatum;

/**
 * Receives what a {@link StreamingSession} is handed by its pipeline.
 *
 * <p>Callbacks may arrive on driver threads and must not block.</p>
 */
public interface SessionStream
{
    void onOutput(String reservationId, byte[] data);

    void onTelemetry(String reservationId, TelemetryDatum datum);
}
