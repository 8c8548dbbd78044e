package com.questrail.hwm.session;

import com.questrail.hwm.config.DeviceConfig;
import com.questrail.hwm.config.PipelineConfig;
import com.questrail.hwm.config.SetupCommand;
import com.questrail.hwm.config.StationConfig;
import com.questrail.hwm.device.Device;
import com.questrail.hwm.device.TestDevice;
import com.questrail.hwm.observability.SessionEvent;
import com.questrail.hwm.pipeline.Pipeline;
import com.questrail.hwm.pipeline.PipelineConfigInvalidException;
import com.questrail.hwm.pipeline.PipelineInUseException;
import com.questrail.hwm.pipeline.PipelineNotFoundException;
import com.questrail.hwm.pipeline.ServiceInvalidException;
import com.questrail.hwm.pipeline.SessionAlreadyRegisteredException;
import com.questrail.hwm.pipeline.SetupCommandFailedException;
import com.questrail.hwm.runtime.TestStation;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SessionCoordinatorTest {

    private static void await(CompletableFuture<Void> future) throws Exception {
        future.get(5, TimeUnit.SECONDS);
    }

    private static Throwable failureOf(CompletableFuture<Void> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return e.getCause();
    }

    private static void assertReleased(TestStation station, String pipelineId) {
        Pipeline pipeline = station.pipeline(pipelineId);
        assertFalse(pipeline.isInUse(), "pipeline still reserved");
        assertFalse(pipeline.isActive(), "session still registered");
        assertTrue(pipeline.activeServices().isEmpty(), "services still active");
        for (Device device : pipeline.devices().values()) {
            assertFalse(device.isActive(), device.id() + " still reserved");
        }
    }

    @Test
    void startedSessionOwnsThePipeline() throws Exception {
        try (TestStation station = TestStation.start()) {
            SessionCoordinator sessions = station.manager().sessions();
            RecordingSession session = new RecordingSession(ReservationConfig.builder("r1", "test_pipeline")
                .withUser("alice")
                .withActiveService(TestDevice.SERVICE_TYPE, "test_device_service")
                .build());

            await(sessions.startSession(session));

            Pipeline pipeline = station.pipeline("test_pipeline");
            assertTrue(pipeline.isInUse());
            assertTrue(pipeline.isActive());
            assertSame(session, sessions.activeSession("r1").orElseThrow());
            assertEquals("test_device_service", pipeline.loadService(TestDevice.SERVICE_TYPE).id());
            assertEquals(List.of("prepare:test_pipeline"), station.testDevice("test_device").calls());
            assertEquals(SessionEvent.Kind.STARTED,
                station.sink().eventsOfType(SessionEvent.class).get(0).kind());

            station.device("test_device2").writeOutput("frame".getBytes(StandardCharsets.UTF_8));
            assertEquals(1, session.output().size());
        }
    }

    @Test
    void endedSessionReleasesThePipeline() throws Exception {
        try (TestStation station = TestStation.start()) {
            SessionCoordinator sessions = station.manager().sessions();
            await(sessions.startSession(RecordingSession.on("test_pipeline")));

            await(sessions.endSession("reservation_test_pipeline"));

            assertReleased(station, "test_pipeline");
            assertTrue(sessions.activeSession("reservation_test_pipeline").isEmpty());
            assertEquals(List.of("prepare:test_pipeline", "cleanup:test_pipeline"),
                station.testDevice("test_device").calls());
        }
    }

    @Test
    void endingAnUnknownSessionFails() {
        try (TestStation station = TestStation.start()) {
            assertInstanceOf(IllegalArgumentException.class,
                failureOf(station.manager().sessions().endSession("nonexistent")));
        }
    }

    @Test
    void secondSessionOnBusyPipelineIsRejected() throws Exception {
        try (TestStation station = TestStation.start()) {
            SessionCoordinator sessions = station.manager().sessions();
            await(sessions.startSession(RecordingSession.on("test_pipeline")));

            Throwable failure = failureOf(sessions.startSession(
                new RecordingSession(ReservationConfig.builder("r2", "test_pipeline").build())));

            assertInstanceOf(PipelineInUseException.class, failure);
            assertTrue(station.pipeline("test_pipeline").isActive(), "first session is untouched");
        }
    }

    @Test
    void duplicateReservationIdIsRejected() throws Exception {
        try (TestStation station = TestStation.start()) {
            SessionCoordinator sessions = station.manager().sessions();
            await(sessions.startSession(new RecordingSession(ReservationConfig.builder("r1", "test_pipeline").build())));

            Throwable failure = failureOf(sessions.startSession(
                new RecordingSession(ReservationConfig.builder("r1", "test_pipeline2").build())));

            assertInstanceOf(SessionAlreadyRegisteredException.class, failure);
            assertFalse(station.pipeline("test_pipeline2").isInUse());
            assertFalse(station.pipeline("test_pipeline2").isActive());
            assertTrue(station.pipeline("test_pipeline").isActive());
        }
    }

    @Test
    void unknownPipelineFails() {
        try (TestStation station = TestStation.start()) {
            assertInstanceOf(PipelineNotFoundException.class, failureOf(station.manager().sessions()
                .startSession(new RecordingSession(ReservationConfig.builder("r1", "nonexistent").build()))));
        }
    }

    @Test
    void invalidServiceSelectionFreesThePipeline() {
        try (TestStation station = TestStation.start()) {
            Throwable failure = failureOf(station.manager().sessions().startSession(new RecordingSession(
                ReservationConfig.builder("r1", "test_pipeline").withActiveService("tracking", "antenna").build())));

            assertInstanceOf(ServiceInvalidException.class, failure);
            assertReleased(station, "test_pipeline");
        }
    }

    @Test
    void failedDevicePreparationRollsBack() {
        StationConfig config = StationConfig.builder()
            .withDevice(DeviceConfig.builder("good", TestDevice.DRIVER_NAME).build())
            .withDevice(DeviceConfig.builder("bad", TestDevice.DRIVER_NAME).withSetting("fail_prepare", true).build())
            .withPipeline(PipelineConfig.builder("p").withDevice("good").withDevice("bad").build())
            .build();

        try (TestStation station = TestStation.start(config)) {
            Throwable failure = failureOf(station.manager().sessions().startSession(RecordingSession.on("p")));

            assertInstanceOf(IllegalStateException.class, failure);
            assertReleased(station, "p");
            assertEquals(List.of("prepare:p", "cleanup:p"), station.testDevice("good").calls());
            assertEquals(SessionEvent.Kind.START_FAILED,
                station.sink().eventsOfType(SessionEvent.class).get(0).kind());
        }
    }

    @Test
    void failedPipelineSetupCommandRollsBack() {
        StationConfig config = TestStation.standardConfig()
            .withPipeline(PipelineConfig.builder("setup_pipeline")
                .withDevice("test_device3")
                .withSetupCommand(SetupCommand.device("test_device3", "fail_command"))
                .build())
            .build();

        try (TestStation station = TestStation.start(config)) {
            SessionCoordinator sessions = station.manager().sessions();
            Throwable failure = failureOf(sessions.startSession(RecordingSession.on("setup_pipeline")));

            assertInstanceOf(SetupCommandFailedException.class, failure);
            assertReleased(station, "setup_pipeline");
            assertTrue(sessions.activeSession("reservation_setup_pipeline").isEmpty());
            assertEquals(List.of("prepare:setup_pipeline", "cleanup:setup_pipeline"),
                station.testDevice("test_device3").calls());

            SessionEvent event = station.sink().eventsOfType(SessionEvent.class).get(0);
            assertEquals(SessionEvent.Kind.START_FAILED, event.kind());
            assertSame(failure, event.cause());
        }
    }

    @Test
    void reservationSetupCommandsRunAfterPipelineSetup() throws Exception {
        try (TestStation station = TestStation.start()) {
            RecordingSession session = new RecordingSession(ReservationConfig.builder("r1", "test_pipeline")
                .withSetupCommand(new SetupCommand("test_device", "test_command", Map.of("test_parameter", 2)))
                .build());

            await(station.manager().sessions().startSession(session));

            assertTrue(station.pipeline("test_pipeline").isActive());
        }
    }

    @Test
    void reservationSetupCommandOutsideThePipelineRollsBack() {
        try (TestStation station = TestStation.start()) {
            RecordingSession session = new RecordingSession(ReservationConfig.builder("r1", "test_pipeline")
                .withSetupCommand(SetupCommand.device("test_device4", "test_command"))
                .build());

            Throwable failure = failureOf(station.manager().sessions().startSession(session));

            assertInstanceOf(PipelineConfigInvalidException.class, failure);
            assertReleased(station, "test_pipeline");
        }
    }

    @Test
    void pipelineCanBeReusedAfterRollback() throws Exception {
        try (TestStation station = TestStation.start()) {
            SessionCoordinator sessions = station.manager().sessions();
            failureOf(sessions.startSession(new RecordingSession(ReservationConfig.builder("r1", "test_pipeline")
                .withSetupCommand(SetupCommand.device("test_device", "fail_command"))
                .build())));

            await(sessions.startSession(new RecordingSession(ReservationConfig.builder("r2", "test_pipeline").build())));

            assertTrue(sessions.activeSession("r2").isPresent());
        }
    }
}
