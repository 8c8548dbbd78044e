package com.questrail.hwm.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of StationObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jStationObservabilitySink implements StationObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jStationObservabilitySink.class);

    @Override
    public void onCommandCompleted(CommandCompletedEvent event) {
        String target = event.deviceId() != null ? event.deviceId() : "system";
        if (event.success()) {
            log.debug("Command {} on {} completed in {} ms",
                event.command(), target, event.elapsed().toMillis());
        } else if (event.command() != null) {
            log.error("A command ({}) on {} failed for the following reason: {}",
                event.command(), target, event.errorMessage());
        } else {
            log.error("A command has failed for the following reason: {}", event.errorMessage());
        }
    }

    @Override
    public void onReservation(ReservationEvent event) {
        switch (event.kind()) {
            case RESERVED -> log.info("Pipeline {} reserved devices {}", event.pipelineId(), event.deviceIds());
            case FREED -> log.info("Pipeline {} freed devices {}", event.pipelineId(), event.deviceIds());
            case REJECTED -> log.warn("Pipeline {} could not be reserved: {}", event.pipelineId(), event.reason());
        }
    }

    @Override
    public void onSession(SessionEvent event) {
        switch (event.kind()) {
            case STARTED -> log.info("Session {} started on pipeline {}", event.reservationId(), event.pipelineId());
            case ENDED -> log.info("Session {} ended on pipeline {}", event.reservationId(), event.pipelineId());
            case START_FAILED -> log.error("Session {} failed to start on pipeline {}",
                event.reservationId(), event.pipelineId(), event.cause());
        }
    }

    @Override
    public void onError(StationErrorEvent event) {
        log.error("Hardware manager error: {}", event.message(), event.cause());
    }
}
