package com.questrail.hwm.device.drivers;

import com.questrail.hwm.command.Command;
import com.questrail.hwm.command.DeviceCommandHandler;
import com.questrail.hwm.config.DeviceConfig;
import com.questrail.hwm.device.DeviceContext;
import com.questrail.hwm.device.VirtualDevice;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Virtual device that echoes pipeline input back out as device output.
 *
 * <p>Useful as the input and output device of a test pipeline: whatever the
 * session writes into the pipeline comes straight back to it.</p>
 */
public final class LoopbackDevice extends VirtualDevice
{
    public static final String DRIVER_NAME = "loopback";

    private final AtomicLong bytesWritten = new AtomicLong();

    public LoopbackDevice(DeviceConfig configuration, DeviceContext context) {
        super(configuration, context);
        setCommandHandler(new Handler(this));
    }

    @Override
    public void write(byte[] data) {
        bytesWritten.addAndGet(data.length);
        writeOutput(data);
    }

    @Override
    public Map<String, Object> getState() {
        return Map.of("bytes_written", bytesWritten.get());
    }

    private static final class Handler extends DeviceCommandHandler
    {
        Handler(LoopbackDevice device) {
            super(device);
            register("get_state", this::getState);
            register("write", this::write);
        }

        private Map<String, Object> getState(Command command) {
            return device().getState();
        }

        private Map<String, Object> write(Command command) {
            byte[] data = command.requireParameter("data").toString().getBytes(StandardCharsets.UTF_8);
            device().write(data);
            return Map.of("bytes_written", data.length);
        }
    }
}
