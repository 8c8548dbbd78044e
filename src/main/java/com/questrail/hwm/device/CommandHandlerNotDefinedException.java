package com.questrail.hwm.device;

/**
 * Raised when a command targets a device whose driver offers no command handler.
 */
public final class CommandHandlerNotDefinedException extends DeviceException
{
    public CommandHandlerNotDefinedException(String message) {
        super(message);
    }

    public CommandHandlerNotDefinedException(String message, Throwable cause) {
        super(message, cause);
    }
}
