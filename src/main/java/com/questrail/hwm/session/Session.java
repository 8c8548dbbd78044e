package com.questrail.hwm.session;

import com.questrail.hwm.pipeline.TelemetryDatum;

/**
 * Session
 * -----------------------------------------------------------------------------
 * A user's time-bounded use of one pipeline, created from a reservation.
 *
 * <p>The pipeline pushes its output device's data and its devices' telemetry
 * into the session. How the session delivers them to the user is up to the
 * implementation.</p>
 */
public interface Session
{
    ReservationConfig configuration();

    void writeOutput(byte[] data);

    void writeTelemetry(TelemetryDatum datum);
}
