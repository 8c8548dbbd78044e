package com.questrail.hwm.device;

/**
 * A driver factory failed while instantiating a configured device.
 */
public final class DriverInitException extends DeviceConfigException
{
    public DriverInitException(String message) {
        super(message);
    }

    public DriverInitException(String message, Throwable cause) {
        super(message, cause);
    }
}
