package com.questrail.hwm.device;

/**
 * The requested device id is not loaded in the device registry.
 */
public final class DeviceNotFoundException extends DeviceConfigException
{
    public DeviceNotFoundException(String message) {
        super(message);
    }

    public DeviceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
