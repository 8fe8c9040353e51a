package com.familycalendar.core.lifecycle;

import com.familycalendar.core.logging.LogRetentionService;
import com.familycalendar.core.state.AppState;
import com.familycalendar.core.tasks.TaskBody;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * One-shot startup sweep of expired log files, run as a temporary task.
 */
@Component
public class LogRetentionTask implements TaskBody<AppState> {

    private final LogRetentionService retentionService;

    public LogRetentionTask(LogRetentionService retentionService) {
        this.retentionService = retentionService;
    }

    @Override
    public void run(AppState state) throws IOException {
        retentionService.cleanupOldLogs();
    }

    @Override
    public String name() {
        return "log-retention";
    }
}
