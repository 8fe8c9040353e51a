package com.familycalendar.core.permissions;

import java.util.List;

/**
 * Storage for per-user permission sets.
 */
public interface PermissionBackend {

    void assignPermission(long userId, Permission permission);

    void removePermission(long userId, Permission permission);

    boolean checkPermission(long userId, Permission permission);

    List<Permission> listPermissions(long userId);

    /**
     * Whether the backing store can currently serve requests.
     */
    boolean isAvailable();

    /**
     * Short label for health output, e.g. {@code "memory"}.
     */
    String name();
}
