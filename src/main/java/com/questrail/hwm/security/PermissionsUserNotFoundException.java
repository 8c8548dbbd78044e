package com.questrail.hwm.security;

/**
 * The user has no (unexpired) permission record.
 */
public final class PermissionsUserNotFoundException extends PermissionsException
{
    public PermissionsUserNotFoundException(String message) {
        super(message);
    }

    public PermissionsUserNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
