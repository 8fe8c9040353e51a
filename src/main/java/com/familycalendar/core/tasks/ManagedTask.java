package com.familycalendar.core.tasks;

import com.familycalendar.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle to a unit of work running on the worker pool.
 * <p>
 * The handle completes exactly once with a {@link TaskOutcome}, when the body has actually
 * stopped. {@link #abort()} only interrupts the worker thread: the body stops at its next
 * interruptible wait, so cancellation is cooperative and not instantaneous, and a body that
 * ignores the interrupt keeps its handle unfinished until it returns. A body that ends after an
 * abort request is reported {@link TaskExit#ABORTED} however it ends.
 */
public final class ManagedTask {

    private static final Logger log = LoggerFactory.getLogger(ManagedTask.class);

    private final String name;
    private final TaskKind kind;
    private final CompletableFuture<TaskOutcome> completion = new CompletableFuture<>();
    private final AtomicBoolean claimed = new AtomicBoolean();
    private volatile boolean abortRequested;
    private volatile Future<?> future;

    private ManagedTask(String name, TaskKind kind) {
        this.name = name;
        this.kind = kind;
    }

    /**
     * Starts {@code body} on {@code executor} and returns its handle.
     */
    static <S> ManagedTask start(TaskBody<S> body, TaskKind kind, S state, ExecutorService executor) {
        var task = new ManagedTask(body.name(), kind);
        task.future = executor.submit(() -> task.runBody(body, state));
        return task;
    }

    private <S> void runBody(TaskBody<S> body, S state) {
        if (!claimed.compareAndSet(false, true)) {
            return;
        }
        MdcContext.setTask(name);
        try {
            body.run(state);
            completeUnlessAborted(TaskOutcome.completed());
        } catch (InterruptedException e) {
            completion.complete(TaskOutcome.aborted());
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            completeAbnormally(TaskOutcome.panicked(e));
        } catch (Exception e) {
            completeAbnormally(TaskOutcome.failed(e));
        } catch (Error e) {
            completeAbnormally(TaskOutcome.panicked(e));
        } finally {
            MdcContext.clear();
        }
    }

    private void completeUnlessAborted(TaskOutcome outcome) {
        completion.complete(abortRequested ? TaskOutcome.aborted() : outcome);
    }

    private void completeAbnormally(TaskOutcome outcome) {
        if (abortRequested) {
            log.debug("Task {} stopped after abort", name, outcome.cause());
            completion.complete(TaskOutcome.aborted());
            return;
        }
        // long-lived exits are reported by the supervisor; nobody waits on temporary ones
        if (kind == TaskKind.TEMPORARY) {
            log.warn("Temporary task {} {}", name,
                    outcome.exit() == TaskExit.FAILED ? "failed" : "panicked", outcome.cause());
        }
        completion.complete(outcome);
    }

    /**
     * Requests cancellation. Has no effect on a task that already finished. The handle completes
     * right away only if the body never started; otherwise it completes when the body returns.
     */
    public void abort() {
        if (completion.isDone()) {
            return;
        }
        abortRequested = true;
        if (claimed.compareAndSet(false, true)) {
            completion.complete(TaskOutcome.aborted());
        }
        Future<?> f = future;
        if (f != null) {
            f.cancel(true);
        }
    }

    /**
     * True once the body has stopped, or was aborted before it started.
     */
    public boolean isFinished() {
        return completion.isDone();
    }

    /**
     * Completion stage of this task; never completes exceptionally.
     */
    public CompletableFuture<TaskOutcome> completion() {
        return completion.copy();
    }

    public String name() {
        return name;
    }

    public TaskKind kind() {
        return kind;
    }
}
