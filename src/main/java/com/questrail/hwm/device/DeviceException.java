package com.questrail.hwm.device;

/**
 * Base type for failures raised by device drivers at runtime.
 */
public class DeviceException extends RuntimeException
{
    public DeviceException(String message) {
        super(message);
    }

    public DeviceException(String message, Throwable cause) {
        super(message, cause);
    }
}
