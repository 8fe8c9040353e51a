package com.familycalendar.core.lifecycle;

import com.familycalendar.core.config.CalendarProperties;
import com.familycalendar.core.state.AppState;
import com.familycalendar.core.tasks.TaskBody;
import com.familycalendar.core.tasks.TaskSupervisor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TemporaryTaskReaperTest {

    @Test
    @DisplayName("periodically removes finished temporary tasks until aborted")
    void reapsUntilAborted() throws Exception {
        ExecutorService executor = Executors.newCachedThreadPool();
        try {
            var supervisor = new TaskSupervisor<AppState>(executor, null);
            var properties = new CalendarProperties();
            properties.getTasks().setReapInterval(Duration.ofMillis(10));
            var reaper = new TemporaryTaskReaper(supervisor, properties);

            supervisor.spawnTemporary(List.<TaskBody<AppState>>of(state -> { }, state -> { }));
            long reaperId = supervisor.spawnTemporary(List.of(reaper)).get(0);

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (supervisor.temporaryCount() > 1 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(List.of(reaperId), supervisor.temporaryIds());

            assertTrue(supervisor.abortTemporary(reaperId));
            assertEquals("temporary-task-reaper", supervisor.temporaryTask(reaperId).orElseThrow().name());
        } finally {
            executor.shutdownNow();
        }
    }
}
