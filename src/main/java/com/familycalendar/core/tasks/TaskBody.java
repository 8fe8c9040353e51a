package com.familycalendar.core.tasks;

/**
 * A unit of background work started by the {@link TaskSupervisor}.
 * <p>
 * The body receives the shared application state and runs on a worker-pool thread.
 * Long-running bodies should block only in interruptible calls so that an abort
 * takes effect at their next wait.
 *
 * @param <S> type of the shared state handed to every task
 */
@FunctionalInterface
public interface TaskBody<S> {

    void run(S state) throws Exception;

    /**
     * Name used in supervisor log lines and MDC.
     */
    default String name() {
        return "task";
    }
}
