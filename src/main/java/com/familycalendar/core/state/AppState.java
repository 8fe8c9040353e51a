package com.familycalendar.core.state;

import com.familycalendar.core.config.CalendarProperties;
import com.familycalendar.core.permissions.PermissionsManager;
import com.familycalendar.core.realtime.BroadcastHub;
import com.familycalendar.core.realtime.ConnectionRegistry;

/**
 * Shared application state handed to every supervised task.
 * <p>
 * Every component is itself thread-safe, so the same instance is shared by all tasks and
 * connections instead of being copied.
 *
 * @param config      calendar server configuration
 * @param permissions permission checks against the configured store
 * @param connections live websocket connections
 * @param hub         global broadcast channel
 */
public record AppState(
    CalendarProperties config,
    PermissionsManager permissions,
    ConnectionRegistry connections,
    BroadcastHub hub
) {}
