package com.familycalendar.core.metrics;

import com.familycalendar.core.realtime.ConnectionRegistry;
import com.familycalendar.core.tasks.TaskExit;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Centralised Micrometer metrics for the live-update channel and the task supervisor.
 */
@Service
public class CalendarMetrics {

    private final MeterRegistry registry;

    public CalendarMetrics(MeterRegistry registry, ConnectionRegistry connections) {
        this.registry = registry;
        Gauge.builder("calendar.ws.active", connections, ConnectionRegistry::size)
                .description("Live websocket connections")
                .register(registry);
    }

    public void recordConnectionOpened() {
        Counter.builder("calendar.ws.connections")
                .tag("event", "opened")
                .register(registry)
                .increment();
    }

    public void recordConnectionClosed() {
        Counter.builder("calendar.ws.connections")
                .tag("event", "closed")
                .register(registry)
                .increment();
    }

    /**
     * @param kind "echo", "broadcast", "unknown" or "malformed"
     */
    public void recordInboundFrame(String kind) {
        Counter.builder("calendar.ws.frames")
                .description("Inbound frames by routing decision")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    /**
     * Records broadcast messages a slow subscriber never saw.
     */
    public void recordLagged(long skipped) {
        Counter.builder("calendar.hub.lagged")
                .description("Broadcast messages skipped by lagging subscribers")
                .register(registry)
                .increment(skipped);
    }

    public void recordTaskExit(TaskExit exit) {
        Counter.builder("calendar.tasks.exits")
                .tag("exit", exit.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }
}
