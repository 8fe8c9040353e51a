package com.familycalendar.core.permissions;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps permissions in process memory. Nothing survives a restart.
 */
public class InMemoryPermissionBackend implements PermissionBackend {

    private final ConcurrentHashMap<Long, Set<Permission>> userPermissions = new ConcurrentHashMap<>();

    @Override
    public void assignPermission(long userId, Permission permission) {
        userPermissions.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet()).add(permission);
    }

    @Override
    public void removePermission(long userId, Permission permission) {
        Set<Permission> set = userPermissions.get(userId);
        if (set != null) {
            set.remove(permission);
        }
    }

    @Override
    public boolean checkPermission(long userId, Permission permission) {
        Set<Permission> set = userPermissions.get(userId);
        return set != null && set.contains(permission);
    }

    @Override
    public List<Permission> listPermissions(long userId) {
        Set<Permission> set = userPermissions.get(userId);
        return set == null ? List.of() : List.copyOf(set);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String name() {
        return "memory";
    }
}
