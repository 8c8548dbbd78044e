package com.questrail.hwm.command;

import com.questrail.hwm.device.Device;

import java.util.Objects;

/**
 * Base class for handlers that answer commands addressed to one device.
 */
public abstract class DeviceCommandHandler extends AbstractCommandHandler
{
    private final Device device;

    protected DeviceCommandHandler(Device device) {
        super(Objects.requireNonNull(device, "device").id());
        this.device = device;
    }

    protected Device device() {
        return device;
    }
}
