package com.questrail.hwm.pipeline;

import com.questrail.hwm.config.PipelineConfig;
import com.questrail.hwm.config.StationConfig;
import com.questrail.hwm.device.Device;
import com.questrail.hwm.device.DeviceNotFoundException;
import com.questrail.hwm.device.TestDevice;
import com.questrail.hwm.observability.ReservationEvent;
import com.questrail.hwm.runtime.HardwareManager;
import com.questrail.hwm.runtime.TestStation;
import com.questrail.hwm.session.RecordingSession;
import com.questrail.hwm.session.ReservationConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelineTest {

    private static void assertRejected(PipelineConfig pipeline) {
        StationConfig config = TestStation.standardConfig().withPipeline(pipeline).build();
        assertThrows(PipelineConfigInvalidException.class,
            () -> HardwareManager.builder(config).withDrivers(TestStation.DRIVERS).build());
    }

    // ---------------------------------------------------------------------
    // Construction
    // ---------------------------------------------------------------------

    @Test
    void loadsMembersInConfigurationOrder() {
        try (TestStation station = TestStation.start()) {
            Pipeline pipeline = station.pipeline("test_pipeline");

            assertEquals(List.of("test_device", "test_device2", "test_device3"), List.copyOf(pipeline.devices().keySet()));
            assertSame(station.device("test_device"), pipeline.inputDevice().orElseThrow());
            assertSame(station.device("test_device2"), pipeline.outputDevice().orElseThrow());
            assertTrue(station.pipeline("test_pipeline3").outputDevice().isEmpty());
        }
    }

    @Test
    void rejectsDuplicateDevices() {
        assertRejected(PipelineConfig.builder("bad").withDevice("test_device").withDevice("test_device").build());
    }

    @Test
    void rejectsUnknownDevices() {
        StationConfig config = TestStation.standardConfig()
            .withPipeline(PipelineConfig.builder("bad").withDevice("nonexistent").build())
            .build();
        PipelineConfigInvalidException e = assertThrows(PipelineConfigInvalidException.class,
            () -> HardwareManager.builder(config).withDrivers(TestStation.DRIVERS).build());
        assertInstanceOf(DeviceNotFoundException.class, e.getCause());
    }

    @Test
    void rejectsMoreThanOneOutputDevice() {
        assertRejected(PipelineConfig.builder("bad")
            .withOutputDevice("test_device")
            .withOutputDevice("test_device2")
            .build());
    }

    @Test
    void rejectsMoreThanOneInputDevice() {
        assertRejected(PipelineConfig.builder("bad")
            .withInputDevice("test_device")
            .withInputDevice("test_device2")
            .build());
    }

    @Test
    void rejectsDuplicatePipelineIds() {
        assertRejected(PipelineConfig.builder("test_pipeline").withDevice("test_device").build());
    }

    @Test
    void unknownPipelineRaisesPipelineNotFound() {
        try (TestStation station = TestStation.start()) {
            assertThrows(PipelineNotFoundException.class, () -> station.pipeline("nonexistent"));
            assertTrue(station.manager().pipelines().findPipeline("nonexistent").isEmpty());
        }
    }

    // ---------------------------------------------------------------------
    // Reservation
    // ---------------------------------------------------------------------

    @Test
    void reservationLocksEveryDevice() {
        try (TestStation station = TestStation.start()) {
            Pipeline pipeline = station.pipeline("test_pipeline");

            pipeline.reservePipeline();

            assertTrue(pipeline.isInUse());
            for (Device device : pipeline.devices().values()) {
                assertTrue(device.isActive(), device.id());
            }
            assertTrue(station.device("test_device").isLocked());
            assertFalse(station.device("test_device3").isLocked());
        }
    }

    @Test
    void reservationEventsUseTheStationClock() {
        try (TestStation station = TestStation.start()) {
            station.clock().advance(Duration.ofMinutes(5));

            station.pipeline("test_pipeline").reservePipeline();

            ReservationEvent event = station.sink().eventsOfType(ReservationEvent.class).get(0);
            assertEquals(ReservationEvent.Kind.RESERVED, event.kind());
            assertEquals(station.clock().now(), event.timestamp());
        }
    }

    @Test
    void reservingTwiceFails() {
        try (TestStation station = TestStation.start()) {
            Pipeline pipeline = station.pipeline("test_pipeline");
            pipeline.reservePipeline();

            assertThrows(PipelineInUseException.class, pipeline::reservePipeline);
            assertEquals(1, station.device("test_device3").useCount());
        }
    }

    @Test
    void failedReservationRollsBackDevicesAlreadyReserved() {
        try (TestStation station = TestStation.start()) {
            station.pipeline("test_pipeline2").reservePipeline();
            Pipeline pipeline = station.pipeline("test_pipeline3");

            PipelineInUseException e = assertThrows(PipelineInUseException.class, pipeline::reservePipeline);

            assertTrue(e.getMessage().contains("test_device4"));
            assertFalse(pipeline.isInUse());
            assertFalse(station.device("test_device").isLocked(), "test_device must have been released");
            assertEquals(0, station.device("test_device").useCount());
            assertTrue(station.device("test_device4").isLocked(), "the other pipeline keeps its lock");

            List<ReservationEvent> events = station.sink().eventsOfType(ReservationEvent.class);
            assertEquals(ReservationEvent.Kind.REJECTED, events.get(events.size() - 1).kind());
        }
    }

    @Test
    void pipelinesShareConcurrentDevices() {
        try (TestStation station = TestStation.start()) {
            station.pipeline("test_pipeline").reservePipeline();
            station.pipeline("test_pipeline2").reservePipeline();

            assertEquals(2, station.device("test_device3").useCount());
            assertFalse(station.device("test_device3").isLocked());
        }
    }

    @Test
    void freeReleasesEverything() {
        try (TestStation station = TestStation.start()) {
            Pipeline pipeline = station.pipeline("test_pipeline");
            pipeline.reservePipeline();

            pipeline.freePipeline();

            assertFalse(pipeline.isInUse());
            for (Device device : pipeline.devices().values()) {
                assertFalse(device.isActive(), device.id());
                assertFalse(device.isLocked(), device.id());
            }
            assertDoesNotThrow(pipeline::reservePipeline);
        }
    }

    // ---------------------------------------------------------------------
    // Services and sessions
    // ---------------------------------------------------------------------

    @Test
    void devicesRegisterTheirServicesAtConstruction() {
        try (TestStation station = TestStation.start()) {
            Pipeline pipeline = station.pipeline("test_pipeline");

            assertEquals(3, pipeline.services().get(TestDevice.SERVICE_TYPE).size());
            assertThrows(ServiceAlreadyRegisteredException.class,
                () -> pipeline.registerService(new TestDevice.TestService("test_device_service", TestDevice.SERVICE_TYPE)));
        }
    }

    @Test
    void sessionSelectsActiveServices() {
        try (TestStation station = TestStation.start()) {
            Pipeline pipeline = station.pipeline("test_pipeline");
            pipeline.registerSession(new RecordingSession(ReservationConfig.builder("r1", "test_pipeline")
                .withActiveService(TestDevice.SERVICE_TYPE, "test_device2_service")
                .build()));

            Service service = pipeline.loadService(TestDevice.SERVICE_TYPE);

            assertEquals("test_device2_service", service.id());
            assertThrows(ServiceTypeNotFoundException.class, () -> pipeline.loadService("tracking"));
        }
    }

    @Test
    void loadingWithoutActiveServiceFails() {
        try (TestStation station = TestStation.start()) {
            Pipeline pipeline = station.pipeline("test_pipeline");
            assertThrows(ServiceTypeNotFoundException.class, () -> pipeline.loadService(TestDevice.SERVICE_TYPE));
        }
    }

    @Test
    void invalidServiceSelectionLeavesNoSessionBehind() {
        try (TestStation station = TestStation.start()) {
            Pipeline pipeline = station.pipeline("test_pipeline");

            assertThrows(ServiceInvalidException.class, () -> pipeline.registerSession(new RecordingSession(
                ReservationConfig.builder("r1", "test_pipeline").withActiveService("tracking", "antenna").build())));
            assertThrows(ServiceInvalidException.class, () -> pipeline.registerSession(new RecordingSession(
                ReservationConfig.builder("r2", "test_pipeline")
                    .withActiveService(TestDevice.SERVICE_TYPE, "nonexistent")
                    .build())));

            assertFalse(pipeline.isActive());
            assertTrue(pipeline.activeServices().isEmpty());
            assertDoesNotThrow(() -> pipeline.registerSession(RecordingSession.on("test_pipeline")));
        }
    }

    @Test
    void onlyOneSessionAtATime() {
        try (TestStation station = TestStation.start()) {
            Pipeline pipeline = station.pipeline("test_pipeline");
            pipeline.registerSession(RecordingSession.on("test_pipeline"));

            assertThrows(SessionAlreadyRegisteredException.class,
                () -> pipeline.registerSession(RecordingSession.on("test_pipeline")));

            pipeline.unregisterSession();
            assertFalse(pipeline.isActive());
        }
    }

    // ---------------------------------------------------------------------
    // Data paths
    // ---------------------------------------------------------------------

    @Test
    void writesWithoutSessionAreDropped() {
        try (TestStation station = TestStation.start()) {
            Pipeline pipeline = station.pipeline("test_pipeline");
            assertDoesNotThrow(() -> pipeline.writeOutput(new byte[] {1}));
            assertDoesNotThrow(() -> pipeline.writeTelemetry(new TelemetryDatum(
                "test_device", "status", station.clock().now(), "ok", false, null)));
        }
    }

    @Test
    void outputWithoutOutputDeviceIsDropped() {
        try (TestStation station = TestStation.start()) {
            Pipeline pipeline = station.pipeline("test_pipeline3");
            RecordingSession session = RecordingSession.on("test_pipeline3");
            pipeline.registerSession(session);

            pipeline.writeOutput(new byte[] {1});

            assertTrue(session.output().isEmpty());
        }
    }

    @Test
    void pipelineInputGoesToTheInputDevice() {
        try (TestStation station = TestStation.start()) {
            station.pipeline("test_pipeline").writeToPipeline(new byte[] {7, 8});

            assertEquals(1, station.testDevice("test_device").written().size());
            assertTrue(station.testDevice("test_device2").written().isEmpty());

            // no input device: dropped
            assertDoesNotThrow(() -> station.pipeline("test_pipeline3").writeToPipeline(new byte[] {1}));
            assertTrue(station.testDevice("test_device4").written().isEmpty());
        }
    }
}
