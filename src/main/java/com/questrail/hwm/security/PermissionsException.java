package com.questrail.hwm.security;

/**
 * Raised when user permissions cannot be loaded or parsed.
 */
public class PermissionsException extends RuntimeException
{
    public PermissionsException(String message) {
        super(message);
    }

    public PermissionsException(String message, Throwable cause) {
        super(message, cause);
    }
}
