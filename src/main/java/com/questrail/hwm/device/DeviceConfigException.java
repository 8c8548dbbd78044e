package com.questrail.hwm.device;

/**
 * Base type for device configuration and lookup failures.
 */
public class DeviceConfigException extends RuntimeException
{
    public DeviceConfigException(String message) {
        super(message);
    }

    public DeviceConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
