package com.familycalendar.core.permissions;

import java.util.Locale;
import java.util.Objects;

/**
 * A named permission. The four built-ins cover calendar access; any other name is a custom
 * permission.
 *
 * @param name stored form of the permission, e.g. {@code "read"}
 */
public record Permission(String name) {

    public static final Permission READ = new Permission("read");
    public static final Permission WRITE = new Permission("write");
    public static final Permission DELETE = new Permission("delete");
    public static final Permission ADMIN = new Permission("admin");

    public Permission {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Permission name must not be blank");
        }
    }

    public static Permission custom(String name) {
        return new Permission(name);
    }

    /**
     * Maps a stored name back to a permission; built-in names are matched case-insensitively.
     */
    public static Permission fromName(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "read" -> READ;
            case "write" -> WRITE;
            case "delete" -> DELETE;
            case "admin" -> ADMIN;
            default -> new Permission(name);
        };
    }

    public boolean isBuiltIn() {
        return this.equals(READ) || this.equals(WRITE) || this.equals(DELETE) || this.equals(ADMIN);
    }
}
