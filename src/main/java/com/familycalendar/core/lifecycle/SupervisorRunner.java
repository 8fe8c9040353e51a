package com.familycalendar.core.lifecycle;

import com.familycalendar.core.config.CalendarProperties;
import com.familycalendar.core.metrics.CalendarMetrics;
import com.familycalendar.core.state.AppState;
import com.familycalendar.core.tasks.SupervisionResult;
import com.familycalendar.core.tasks.TaskSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.IntConsumer;

/**
 * Starts the background tasks in serve mode and takes the process down when any long-lived one
 * exits.
 * <p>
 * The supervisor waits on its own {@code task-supervisor} thread so startup is not blocked.
 * Once {@link TaskSupervisor#supervise()} returns every sibling has been sent an abort; what is left
 * is to stop the Spring context and exit with status 1. An exit caused by the context shutting
 * down is expected and does not escalate.
 */
@Component
public class SupervisorRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SupervisorRunner.class);

    static final int TASK_EXIT_STATUS = 1;

    private final TaskSupervisor<AppState> supervisor;
    private final WebServerTask webServerTask;
    private final TemporaryTaskReaper reaper;
    private final LogRetentionTask logRetentionTask;
    private final CalendarMetrics metrics;
    private final boolean exitOnTaskExit;
    private final IntConsumer exitHook;

    private volatile boolean contextClosing;
    private volatile Thread supervisorThread;

    @Autowired
    public SupervisorRunner(TaskSupervisor<AppState> supervisor, WebServerTask webServerTask,
                            TemporaryTaskReaper reaper, LogRetentionTask logRetentionTask,
                            CalendarMetrics metrics, CalendarProperties properties,
                            ConfigurableApplicationContext context) {
        this(supervisor, webServerTask, reaper, logRetentionTask, metrics,
                properties.getSupervisor().isExitOnTaskExit(),
                status -> System.exit(SpringApplication.exit(context, () -> status)));
    }

    SupervisorRunner(TaskSupervisor<AppState> supervisor, WebServerTask webServerTask,
                     TemporaryTaskReaper reaper, LogRetentionTask logRetentionTask,
                     CalendarMetrics metrics, boolean exitOnTaskExit, IntConsumer exitHook) {
        this.supervisor = supervisor;
        this.webServerTask = webServerTask;
        this.reaper = reaper;
        this.logRetentionTask = logRetentionTask;
        this.metrics = metrics;
        this.exitOnTaskExit = exitOnTaskExit;
        this.exitHook = exitHook;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.getNonOptionArgs().contains("serve")) {
            return;
        }

        List<Long> temporary = supervisor.spawnTemporary(List.of(logRetentionTask));
        int longLived = supervisor.spawnLongLived(List.of(webServerTask, reaper));
        log.info("Spawned {} task(s)", longLived + temporary.size());

        Thread thread = new Thread(this::superviseAndEscalate, "task-supervisor");
        thread.setDaemon(true);
        supervisorThread = thread;
        thread.start();
    }

    void superviseAndEscalate() {
        Optional<SupervisionResult> result;
        try {
            result = supervisor.supervise();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Task supervisor interrupted");
            return;
        }

        result.ifPresent(r -> metrics.recordTaskExit(r.outcome().exit()));

        if (contextClosing) {
            log.info("Long-lived tasks stopped during shutdown");
            return;
        }
        result.ifPresent(r -> log.error("Shutting down after task {} ({}) exited with {}",
                r.index(), r.taskName(), r.outcome().exit()));
        if (!exitOnTaskExit) {
            log.warn("Process left running after a long-lived task exit; calendar.supervisor.exit-on-task-exit is false");
            return;
        }
        exitHook.accept(TASK_EXIT_STATUS);
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent event) {
        // flag first so the web server task's exit is seen as part of shutdown
        contextClosing = true;
        webServerTask.stop();
    }

    Thread supervisorThread() {
        return supervisorThread;
    }
}
