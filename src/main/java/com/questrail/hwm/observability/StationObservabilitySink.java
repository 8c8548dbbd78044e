package com.questrail.hwm.observability;

/**
 * Main interface for receiving hardware manager observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface StationObservabilitySink {
    /**
     * Called when a command has produced its response envelope, successful or not.
     * @param event the completed command details
     */
    void onCommandCompleted(CommandCompletedEvent event);

    /**
     * Called when a pipeline reservation is acquired, rejected, or released.
     * @param event the reservation event
     */
    void onReservation(ReservationEvent event);

    /**
     * Called when a session starts, fails to start, or ends.
     * @param event the session event
     */
    void onSession(SessionEvent event);

    /**
     * Called when an error or anomaly occurs outside a command envelope.
     * @param event the error event
     */
    void onError(StationErrorEvent event);
}
