package com.familycalendar.core.state;

import com.familycalendar.core.config.CalendarProperties;
import com.familycalendar.core.permissions.PermissionsManager;
import com.familycalendar.core.realtime.BroadcastHub;
import com.familycalendar.core.realtime.ConnectionRegistry;
import com.familycalendar.core.tasks.TaskSupervisor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the shared state, the worker pool and the task supervisor.
 */
@Configuration
public class AppStateConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService calendarWorkerPool() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "calendar-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public BroadcastHub broadcastHub(CalendarProperties properties) {
        return new BroadcastHub(properties.getRealtime().getChannelCapacity());
    }

    @Bean
    public ConnectionRegistry connectionRegistry() {
        return new ConnectionRegistry();
    }

    @Bean
    public AppState appState(CalendarProperties properties, PermissionsManager permissions,
                             ConnectionRegistry connections, BroadcastHub hub) {
        return new AppState(properties, permissions, connections, hub);
    }

    @Bean
    public TaskSupervisor<AppState> taskSupervisor(ExecutorService calendarWorkerPool, AppState appState) {
        return new TaskSupervisor<>(calendarWorkerPool, appState);
    }
}
