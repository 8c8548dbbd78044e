package com.questrail.hwm.security;

import java.util.List;

/**
 * Where permission records come from.
 *
 * <p>A source may return records for more users than were asked for; the
 * {@link PermissionManager} caches all of them.</p>
 */
@FunctionalInterface
public interface PermissionSource
{
    /**
     * Loads the permission records that include {@code userId}. Called on a
     * worker thread; may block.
     *
     * @throws PermissionsException if the resource cannot be read
     * @throws PermissionsInvalidSchemaException if the resource has the wrong shape
     */
    List<UserPermissions> load(String userId);
}
