package com.questrail.hwm.device;

import com.questrail.hwm.config.DeviceConfig;

/**
 * Creates a driver instance for one configured device.
 */
@FunctionalInterface
public interface DeviceDriverFactory
{
    Device create(DeviceConfig configuration, DeviceContext context);
}
