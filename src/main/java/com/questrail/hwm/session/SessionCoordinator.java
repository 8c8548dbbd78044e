package com.questrail.hwm.session;

import com.questrail.hwm.device.Device;
import com.questrail.hwm.internal.exec.StationCoordinator;
import com.questrail.hwm.internal.time.WallClock;
import com.questrail.hwm.observability.NullObservabilitySink;
import com.questrail.hwm.observability.SessionEvent;
import com.questrail.hwm.observability.StationErrorEvent;
import com.questrail.hwm.observability.StationObservabilitySink;
import com.questrail.hwm.pipeline.Pipeline;
import com.questrail.hwm.pipeline.PipelineRegistry;
import com.questrail.hwm.pipeline.SessionAlreadyRegisteredException;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * SessionCoordinator
 * =============================================================================
 * Drives a session through its lifecycle on a pipeline.
 *
 * <h2>Start</h2>
 * <ol>
 *   <li>reserve the pipeline (all of its devices or none)</li>
 *   <li>register the session and activate the services it selects</li>
 *   <li>let every device prepare for the session</li>
 *   <li>run the pipeline's setup commands, then the reservation's own</li>
 * </ol>
 * A failure at any step undoes every earlier step: devices clean up, the
 * session is unregistered and the pipeline is freed. The returned future then
 * completes exceptionally with the original failure.
 *
 * <h2>Threading</h2>
 * Steps 1 to 3, rollback and {@link #endSession(String)} run on the
 * {@link StationCoordinator}. Setup commands travel through the command
 * parser and complete asynchronously; the coordinator is never blocked on them.
 */
public final class SessionCoordinator
{
    private record ActiveSession(Session session, Pipeline pipeline) {}

    private final PipelineRegistry pipelines;
    private final StationCoordinator coordinator;
    private final WallClock clock;
    private final StationObservabilitySink observabilitySink;

    private final Map<String, ActiveSession> sessions = new ConcurrentHashMap<>();

    public SessionCoordinator(PipelineRegistry pipelines,
                              StationCoordinator coordinator,
                              WallClock clock,
                              StationObservabilitySink observabilitySink)
    {
        this.pipelines = Objects.requireNonNull(pipelines, "pipelines");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Starts a session on the pipeline named by its reservation.
     *
     * @return a future completed once every setup command has succeeded, or
     *         exceptionally with the failure that aborted the start
     */
    public CompletableFuture<Void> startSession(Session session) {
        Objects.requireNonNull(session, "session");
        ReservationConfig reservation = session.configuration();

        CompletableFuture<Void> started = new CompletableFuture<>();
        coordinator.submit(() -> attach(session))
            .thenCompose(pipeline -> pipeline.runSetupCommands()
                .thenCompose(done -> pipeline.runCommands(reservation.setupCommands())))
            .whenComplete((responses, error) -> {
                if (error == null) {
                    observabilitySink.onSession(new SessionEvent(
                        clock.now(), reservation.reservationId(), reservation.pipelineId(),
                        SessionEvent.Kind.STARTED, null));
                    started.complete(null);
                    return;
                }

                Throwable cause = unwrap(error);
                ActiveSession attached = sessions.get(reservation.reservationId());
                CompletableFuture<Void> rollback = attached != null && attached.session() == session
                    ? coordinator.submit(() -> {
                        detach(reservation.reservationId(), attached);
                        return null;
                    })
                    : CompletableFuture.completedFuture(null);

                rollback.whenComplete((ignored, rollbackError) -> {
                    if (rollbackError != null) {
                        cause.addSuppressed(unwrap(rollbackError));
                    }
                    observabilitySink.onSession(new SessionEvent(
                        clock.now(), reservation.reservationId(), reservation.pipelineId(),
                        SessionEvent.Kind.START_FAILED, cause));
                    started.completeExceptionally(cause);
                });
            });
        return started;
    }

    /**
     * Ends a live session: devices clean up, the session is unregistered and
     * the pipeline is freed.
     *
     * @return a future completed exceptionally with {@link IllegalArgumentException}
     *         if no live session has that reservation id
     */
    public CompletableFuture<Void> endSession(String reservationId) {
        Objects.requireNonNull(reservationId, "reservationId");
        return coordinator.submit(() -> {
            ActiveSession active = sessions.get(reservationId);
            if (active == null) {
                throw new IllegalArgumentException("No live session exists for reservation '" + reservationId + "'");
            }
            detach(reservationId, active);
            observabilitySink.onSession(new SessionEvent(
                clock.now(), reservationId, active.pipeline().id(), SessionEvent.Kind.ENDED, null));
            return null;
        });
    }

    public Optional<Session> activeSession(String reservationId) {
        ActiveSession active = sessions.get(reservationId);
        return active == null ? Optional.empty() : Optional.of(active.session());
    }

    // ---------------------------------------------------------------------
    // Coordinator-thread steps
    // ---------------------------------------------------------------------

    private Pipeline attach(Session session) {
        ReservationConfig reservation = session.configuration();
        if (sessions.containsKey(reservation.reservationId())) {
            throw new SessionAlreadyRegisteredException("A session for reservation '"
                + reservation.reservationId() + "' is already live.");
        }

        Pipeline pipeline = pipelines.getPipeline(reservation.pipelineId());
        pipeline.reservePipeline();

        try {
            pipeline.registerSession(session);
        } catch (RuntimeException e) {
            pipeline.freePipeline();
            throw e;
        }

        ActiveSession active = new ActiveSession(session, pipeline);
        sessions.put(reservation.reservationId(), active);

        try {
            for (Device device : pipeline.devices().values()) {
                device.prepareForSession(pipeline);
            }
        } catch (RuntimeException e) {
            detach(reservation.reservationId(), active);
            throw e;
        }
        return pipeline;
    }

    private void detach(String reservationId, ActiveSession active) {
        Pipeline pipeline = active.pipeline();
        try {
            for (Device device : pipeline.devices().values()) {
                try {
                    device.cleanupAfterSession(pipeline);
                } catch (RuntimeException e) {
                    observabilitySink.onError(new StationErrorEvent(clock.now(),
                        "Device " + device.id() + " failed to clean up after session " + reservationId, e));
                }
            }
        } finally {
            pipeline.unregisterSession();
            pipeline.freePipeline();
            sessions.remove(reservationId, active);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
            && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
