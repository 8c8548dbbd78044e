package com.questrail.hwm.security;

/**
 * A permissions resource does not conform to the permission record shape.
 */
public final class PermissionsInvalidSchemaException extends PermissionsException
{
    public PermissionsInvalidSchemaException(String message) {
        super(message);
    }

    public PermissionsInvalidSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
