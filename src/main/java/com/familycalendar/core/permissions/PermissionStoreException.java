package com.familycalendar.core.permissions;

/**
 * A write to the permission store failed.
 */
public class PermissionStoreException extends RuntimeException {

    public PermissionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
