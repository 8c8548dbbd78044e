package com.questrail.hwm.device;

import com.questrail.hwm.config.DeviceConfig;

/**
 * Base class for drivers of physical hardware (radios, rotators, TNCs).
 */
public abstract class HardwareDevice extends Device
{
    protected HardwareDevice(DeviceConfig configuration, DeviceContext context) {
        super(configuration, context);
    }
}
