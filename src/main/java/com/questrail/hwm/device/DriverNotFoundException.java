package com.questrail.hwm.device;

/**
 * No driver factory is registered under the configured driver name.
 */
public final class DriverNotFoundException extends DeviceConfigException
{
    public DriverNotFoundException(String message) {
        super(message);
    }

    public DriverNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
