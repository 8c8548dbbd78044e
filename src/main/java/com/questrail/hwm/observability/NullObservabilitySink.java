package com.questrail.hwm.observability;

/**
 * No-op implementation of StationObservabilitySink.
 */
public final class NullObservabilitySink implements StationObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onCommandCompleted(CommandCompletedEvent event) {}

    @Override
    public void onReservation(ReservationEvent event) {}

    @Override
    public void onSession(SessionEvent event) {}

    @Override
    public void onError(StationErrorEvent event) {}
}
