package com.questrail.hwm.command;

import com.questrail.hwm.device.Device;
import com.questrail.hwm.device.DeviceRegistry;
import com.questrail.hwm.internal.time.WallClock;
import com.questrail.hwm.pipeline.Pipeline;
import com.questrail.hwm.pipeline.PipelineDirectory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Handler for commands that carry no {@code device_id}.
 *
 * <ul>
 *   <li>{@code station_time}: current station time as {@code timestamp}</li>
 *   <li>{@code list_devices}: every device with its reservation state</li>
 *   <li>{@code list_pipelines}: every pipeline with its devices</li>
 *   <li>{@code device_state}: state of the device named by {@code parameters.device_id}</li>
 * </ul>
 */
public final class SystemCommandHandler extends AbstractCommandHandler
{
    public static final String DEFAULT_NAME = "system";

    private final DeviceRegistry devices;
    private final PipelineDirectory pipelines;
    private final WallClock clock;

    public SystemCommandHandler(String name, DeviceRegistry devices, PipelineDirectory pipelines, WallClock clock) {
        super(name);
        this.devices = Objects.requireNonNull(devices, "devices");
        this.pipelines = Objects.requireNonNull(pipelines, "pipelines");
        this.clock = Objects.requireNonNull(clock, "clock");

        register("station_time", this::stationTime);
        register("list_devices", this::listDevices);
        register("list_pipelines", this::listPipelines);
        register("device_state", this::deviceState);
    }

    public SystemCommandHandler(DeviceRegistry devices, PipelineDirectory pipelines, WallClock clock) {
        this(DEFAULT_NAME, devices, pipelines, clock);
    }

    private Map<String, Object> stationTime(Command command) {
        return Map.of("timestamp", clock.nowEpochSeconds());
    }

    private Map<String, Object> listDevices(Command command) {
        List<Map<String, Object>> listing = new ArrayList<>();
        for (Device device : devices.allDevices()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", device.id());
            entry.put("driver", device.configuration().driver());
            entry.put("active", device.isActive());
            entry.put("locked", device.isLocked());
            entry.put("use_count", device.useCount());
            listing.add(entry);
        }
        return Map.of("devices", listing);
    }

    private Map<String, Object> listPipelines(Command command) {
        List<Map<String, Object>> listing = new ArrayList<>();
        for (Pipeline pipeline : pipelines.allPipelines()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", pipeline.id());
            entry.put("in_use", pipeline.isInUse());
            entry.put("active", pipeline.isActive());
            entry.put("devices", List.copyOf(pipeline.devices().keySet()));
            listing.add(entry);
        }
        return Map.of("pipelines", listing);
    }

    private Map<String, Object> deviceState(Command command) {
        String deviceId = command.requireParameter("device_id").toString();
        Device device = devices.getDevice(deviceId);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("device_id", deviceId);
        result.put("state", device.getState());
        return result;
    }
}
