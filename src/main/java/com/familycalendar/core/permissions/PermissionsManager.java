package com.familycalendar.core.permissions;

import java.util.List;

/**
 * Entry point for permission checks; delegates to the backend chosen at startup.
 */
public class PermissionsManager {

    private final PermissionBackend backend;

    public PermissionsManager(PermissionBackend backend) {
        this.backend = backend;
    }

    public void assignPermission(long userId, Permission permission) {
        backend.assignPermission(userId, permission);
    }

    public void removePermission(long userId, Permission permission) {
        backend.removePermission(userId, permission);
    }

    public boolean checkPermission(long userId, Permission permission) {
        return backend.checkPermission(userId, permission);
    }

    public List<Permission> listPermissions(long userId) {
        return backend.listPermissions(userId);
    }

    public PermissionBackend backend() {
        return backend;
    }
}
