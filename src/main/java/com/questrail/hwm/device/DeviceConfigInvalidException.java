package com.questrail.hwm.device;

/**
 * The device configuration is malformed or contains duplicate device ids.
 */
public final class DeviceConfigInvalidException extends DeviceConfigException
{
    public DeviceConfigInvalidException(String message) {
        super(message);
    }

    public DeviceConfigInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
