package com.questrail.hwm.device.drivers;

import com.questrail.hwm.command.Command;
import com.questrail.hwm.command.DeviceCommandHandler;
import com.questrail.hwm.config.DeviceConfig;
import com.questrail.hwm.device.DeviceContext;
import com.questrail.hwm.device.VirtualDevice;
import com.questrail.hwm.internal.time.WallClock;
import com.questrail.hwm.pipeline.Pipeline;

import java.util.Map;

/**
 * Virtual device exposing the station clock.
 *
 * <p>Registers a {@link TimeService} (id = device id) with every pipeline it
 * belongs to and answers {@code get_time}. Usually configured with
 * {@code allow_concurrent_use}, since any number of pipelines can read the time.</p>
 */
public final class StationClockDevice extends VirtualDevice
{
    public static final String DRIVER_NAME = "station_clock";

    public StationClockDevice(DeviceConfig configuration, DeviceContext context) {
        super(configuration, context);
        setCommandHandler(new Handler(this));
    }

    @Override
    protected void registerServices(Pipeline pipeline) {
        pipeline.registerService(new TimeService(id(), context().clock()));
    }

    @Override
    public Map<String, Object> getState() {
        return Map.of("timestamp", context().clock().nowEpochSeconds(), "use_count", useCount());
    }

    WallClock clock() {
        return context().clock();
    }

    private static final class Handler extends DeviceCommandHandler
    {
        private final StationClockDevice clockDevice;

        Handler(StationClockDevice device) {
            super(device);
            this.clockDevice = device;
            register("get_time", this::getTime);
        }

        private Map<String, Object> getTime(Command command) {
            return Map.of("timestamp", clockDevice.clock().nowEpochSeconds());
        }
    }
}
