package com.questrail.hwm.device;

import com.questrail.hwm.config.DeviceConfig;

/**
 * Base class for drivers that are implemented entirely in software.
 */
public abstract class VirtualDevice extends Device
{
    protected VirtualDevice(DeviceConfig configuration, DeviceContext context) {
        super(configuration, context);
    }
}
