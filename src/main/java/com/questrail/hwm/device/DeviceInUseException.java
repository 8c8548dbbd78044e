package com.questrail.hwm.device;

/**
 * Raised when an exclusive device is reserved while another holder still has it locked.
 */
public final class DeviceInUseException extends DeviceException
{
    public DeviceInUseException(String message) {
        super(message);
    }

    public DeviceInUseException(String message, Throwable cause) {
        super(message, cause);
    }
}
