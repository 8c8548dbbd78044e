package com.questrail.hwm.device;

/**
 * Raised when a driver reports no state.
 */
public final class StateNotDefinedException extends DeviceException
{
    public StateNotDefinedException(String message) {
        super(message);
    }

    public StateNotDefinedException(String message, Throwable cause) {
        super(message, cause);
    }
}
