package com.familycalendar.core.health;

import com.familycalendar.core.permissions.InMemoryPermissionBackend;
import com.familycalendar.core.permissions.PermissionBackend;
import com.familycalendar.core.permissions.PermissionsManager;
import com.familycalendar.core.realtime.BroadcastHub;
import com.familycalendar.core.realtime.ConnectionRegistry;
import com.familycalendar.core.state.AppState;
import com.familycalendar.core.tasks.TaskSupervisor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    @SuppressWarnings("unchecked")
    private final TaskSupervisor<AppState> supervisor = mock(TaskSupervisor.class);
    private final BroadcastHub hub = new BroadcastHub(8);
    private final ConnectionRegistry connections = new ConnectionRegistry();

    private HealthStatus find(List<HealthStatus> checks, String component) {
        return checks.stream().filter(c -> c.component().equals(component)).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("reports supervisor, realtime and permissions components")
    void reportsAllComponents() {
        when(supervisor.supervisedCount()).thenReturn(2);
        var service = new HealthCheckService(supervisor, hub, connections,
                new PermissionsManager(new InMemoryPermissionBackend()));

        var checks = service.checkAll();

        assertEquals(List.of("supervisor", "realtime", "permissions"),
                checks.stream().map(HealthStatus::component).toList());
        assertTrue(checks.stream().allMatch(c -> c.status() == HealthStatus.Status.UP));
        assertEquals("8", find(checks, "realtime").metadata().get("capacity"));
    }

    @Test
    @DisplayName("supervisor is degraded when no pass is running")
    void supervisorDegraded() {
        when(supervisor.supervisedCount()).thenReturn(0);
        var service = new HealthCheckService(supervisor, hub, connections,
                new PermissionsManager(new InMemoryPermissionBackend()));

        assertEquals(HealthStatus.Status.DEGRADED, find(service.checkAll(), "supervisor").status());
    }

    @Test
    @DisplayName("permissions is down when the backend is unavailable")
    void permissionsDown() {
        PermissionBackend backend = mock(PermissionBackend.class);
        when(backend.isAvailable()).thenReturn(false);
        when(backend.name()).thenReturn("jdbc");
        var service = new HealthCheckService(supervisor, hub, connections, new PermissionsManager(backend));

        HealthStatus permissions = find(service.checkAll(), "permissions");

        assertEquals(HealthStatus.Status.DOWN, permissions.status());
        assertEquals("jdbc", permissions.metadata().get("backend"));
    }
}
