package com.familycalendar.core.health;

import com.familycalendar.core.permissions.PermissionsManager;
import com.familycalendar.core.realtime.BroadcastHub;
import com.familycalendar.core.realtime.ConnectionRegistry;
import com.familycalendar.core.state.AppState;
import com.familycalendar.core.tasks.TaskSupervisor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private final TaskSupervisor<AppState> supervisor;
    private final BroadcastHub hub;
    private final ConnectionRegistry connections;
    private final PermissionsManager permissions;

    public HealthCheckService(TaskSupervisor<AppState> supervisor, BroadcastHub hub,
                              ConnectionRegistry connections, PermissionsManager permissions) {
        this.supervisor = supervisor;
        this.hub = hub;
        this.connections = connections;
        this.permissions = permissions;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkSupervisor());
        results.add(checkRealtime());
        results.add(checkPermissions());
        return results;
    }

    private HealthStatus checkSupervisor() {
        int supervised = supervisor.supervisedCount();
        var metadata = Map.of(
                "supervised", String.valueOf(supervised),
                "pending", String.valueOf(supervisor.longLivedCount()),
                "temporary", String.valueOf(supervisor.temporaryCount()));
        if (supervised > 0) {
            return new HealthStatus("supervisor", HealthStatus.Status.UP,
                    "Supervising " + supervised + " long-lived task(s)", metadata);
        }
        return new HealthStatus("supervisor", HealthStatus.Status.DEGRADED,
                "No supervision pass running", metadata);
    }

    private HealthStatus checkRealtime() {
        return new HealthStatus("realtime", HealthStatus.Status.UP,
                connections.size() + " connection(s), " + hub.subscriberCount() + " subscriber(s)",
                Map.of("capacity", String.valueOf(hub.capacity())));
    }

    private HealthStatus checkPermissions() {
        var backend = permissions.backend();
        if (!backend.isAvailable()) {
            return new HealthStatus("permissions", HealthStatus.Status.DOWN,
                    "Permission store unreachable", Map.of("backend", backend.name()));
        }
        return new HealthStatus("permissions", HealthStatus.Status.UP,
                "Permission backend available", Map.of("backend", backend.name()));
    }
}
