package com.familycalendar.core.lifecycle;

import com.familycalendar.core.config.CalendarProperties;
import com.familycalendar.core.state.AppState;
import com.familycalendar.core.tasks.TaskBody;
import com.familycalendar.core.tasks.TaskSupervisor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Long-lived task that periodically drops finished temporary tasks from the supervisor.
 */
@Component
public class TemporaryTaskReaper implements TaskBody<AppState> {

    private final TaskSupervisor<AppState> supervisor;
    private final Duration interval;

    public TemporaryTaskReaper(TaskSupervisor<AppState> supervisor, CalendarProperties properties) {
        this.supervisor = supervisor;
        this.interval = properties.getTasks().getReapInterval();
    }

    @Override
    public void run(AppState state) throws InterruptedException {
        while (true) {
            Thread.sleep(interval.toMillis());
            supervisor.reapTemporary();
        }
    }

    @Override
    public String name() {
        return "temporary-task-reaper";
    }
}
