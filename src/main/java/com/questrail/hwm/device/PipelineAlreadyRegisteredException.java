package com.questrail.hwm.device;

/**
 * Raised when the same pipeline registers with a device twice.
 */
public final class PipelineAlreadyRegisteredException extends DeviceException
{
    public PipelineAlreadyRegisteredException(String message) {
        super(message);
    }

    public PipelineAlreadyRegisteredException(String message, Throwable cause) {
        super(message, cause);
    }
}
