package com.familycalendar.core.tasks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the background tasks of the process.
 * <p>
 * Long-lived tasks form a fail-fast group: {@link #supervise()} waits for the first of them to
 * exit, for any reason, then aborts every sibling and returns so the caller can take the process
 * down. There is no restart and no backoff.
 * <p>
 * Temporary tasks are kept in a separate mapping keyed by a monotonically increasing id. They are
 * never touched by {@code supervise()} and leave the mapping only through {@link #reapTemporary()}.
 * <p>
 * Both collections are guarded by locks held only for a single insert, remove or snapshot, never
 * while waiting on a task.
 *
 * @param <S> type of the shared state handed to every task
 */
public class TaskSupervisor<S> {

    private static final Logger log = LoggerFactory.getLogger(TaskSupervisor.class);

    private final ExecutorService executor;
    private final S state;

    private final ReentrantLock longLivedLock = new ReentrantLock();
    private List<ManagedTask> longLived = new ArrayList<>();

    private final ReentrantLock temporaryLock = new ReentrantLock();
    private final Map<Long, ManagedTask> temporary = new LinkedHashMap<>();
    private long nextTemporaryId = 0;

    private volatile int supervisedCount;

    public TaskSupervisor(ExecutorService executor, S state) {
        this.executor = executor;
        this.state = state;
    }

    /**
     * Starts each task immediately and adds its handle to the supervised set.
     *
     * @return the number of tasks scheduled
     */
    public int spawnLongLived(List<? extends TaskBody<S>> tasks) {
        var handles = new ArrayList<ManagedTask>(tasks.size());
        for (TaskBody<S> body : tasks) {
            handles.add(ManagedTask.start(body, TaskKind.LONG_LIVED, state, executor));
        }

        longLivedLock.lock();
        try {
            longLived.addAll(handles);
        } finally {
            longLivedLock.unlock();
        }
        log.debug("Spawned {} long-lived task(s)", handles.size());
        return handles.size();
    }

    /**
     * Starts each task immediately and files its handle under a fresh temporary id.
     * Ids are never reused, whatever order earlier tasks finish in.
     *
     * @return the ids assigned, in spawn order; its size is the number of tasks scheduled
     */
    public List<Long> spawnTemporary(List<? extends TaskBody<S>> tasks) {
        var handles = new ArrayList<ManagedTask>(tasks.size());
        for (TaskBody<S> body : tasks) {
            handles.add(ManagedTask.start(body, TaskKind.TEMPORARY, state, executor));
        }

        var ids = new ArrayList<Long>(handles.size());
        temporaryLock.lock();
        try {
            for (ManagedTask handle : handles) {
                long id = nextTemporaryId++;
                temporary.put(id, handle);
                ids.add(id);
            }
        } finally {
            temporaryLock.unlock();
        }
        log.debug("Spawned temporary task(s) {}", ids);
        return ids;
    }

    /**
     * Blocks until the first long-lived task exits, then aborts all of its siblings.
     * <p>
     * Only the tasks present when this method takes its snapshot are covered. Tasks spawned
     * afterwards stay in the supervised set for the next call and are not aborted by this pass.
     * Aborting is cooperative: siblings may still be winding down when this method returns.
     *
     * @return the first exit and the siblings aborted, or empty when there was nothing to supervise
     * @throws InterruptedException if the waiting thread is interrupted; the snapshot is aborted first
     */
    public Optional<SupervisionResult> supervise() throws InterruptedException {
        List<ManagedTask> snapshot;
        longLivedLock.lock();
        try {
            snapshot = longLived;
            longLived = new ArrayList<>();
        } finally {
            longLivedLock.unlock();
        }

        if (snapshot.isEmpty()) {
            log.error("No long-lived tasks to supervise");
            return Optional.empty();
        }

        supervisedCount = snapshot.size();
        BlockingQueue<Integer> exits = new ArrayBlockingQueue<>(snapshot.size());
        for (int i = 0; i < snapshot.size(); i++) {
            final int index = i;
            snapshot.get(i).completion().whenComplete((outcome, error) -> exits.offer(index));
        }

        int first;
        try {
            first = exits.take();
        } catch (InterruptedException e) {
            log.warn("Supervisor interrupted; aborting {} supervised task(s)", snapshot.size());
            snapshot.forEach(ManagedTask::abort);
            supervisedCount = 0;
            throw e;
        }

        ManagedTask winner = snapshot.get(first);
        TaskOutcome outcome = winner.completion().join();
        logFirstExit(first, winner.name(), outcome);

        var aborted = new ArrayList<Integer>(snapshot.size() - 1);
        for (int i = 0; i < snapshot.size(); i++) {
            if (i == first) {
                continue;
            }
            ManagedTask sibling = snapshot.get(i);
            sibling.abort();
            log.error("Aborted task {} ({})", i, sibling.name());
            aborted.add(i);
        }

        supervisedCount = 0;
        return Optional.of(new SupervisionResult(first, winner.name(), outcome, List.copyOf(aborted)));
    }

    private static void logFirstExit(int index, String name, TaskOutcome outcome) {
        switch (outcome.exit()) {
            case COMPLETED -> log.error("Task {} ({}) exited normally", index, name);
            case FAILED -> log.error("Task {} ({}) exited with error: {}", index, name,
                    outcome.cause().toString(), outcome.cause());
            case PANICKED -> log.error("Task {} ({}) panicked: {}", index, name,
                    outcome.cause().toString(), outcome.cause());
            case ABORTED -> log.error("Task {} ({}) was aborted", index, name);
        }
    }

    /**
     * Removes finished temporary tasks from the mapping.
     *
     * @return how many entries were removed
     */
    public int reapTemporary() {
        int reaped = 0;
        temporaryLock.lock();
        try {
            Iterator<ManagedTask> it = temporary.values().iterator();
            while (it.hasNext()) {
                if (it.next().isFinished()) {
                    it.remove();
                    reaped++;
                }
            }
        } finally {
            temporaryLock.unlock();
        }
        if (reaped > 0) {
            log.debug("Reaped {} finished temporary task(s)", reaped);
        }
        return reaped;
    }

    /**
     * Aborts the temporary task with the given id. The entry stays tracked until the body has
     * stopped and a reap removes it.
     *
     * @return false if no such id is tracked
     */
    public boolean abortTemporary(long id) {
        ManagedTask task;
        temporaryLock.lock();
        try {
            task = temporary.get(id);
        } finally {
            temporaryLock.unlock();
        }
        if (task == null) {
            return false;
        }
        task.abort();
        return true;
    }

    public Optional<ManagedTask> temporaryTask(long id) {
        temporaryLock.lock();
        try {
            return Optional.ofNullable(temporary.get(id));
        } finally {
            temporaryLock.unlock();
        }
    }

    public List<Long> temporaryIds() {
        temporaryLock.lock();
        try {
            return List.copyOf(temporary.keySet());
        } finally {
            temporaryLock.unlock();
        }
    }

    public int temporaryCount() {
        temporaryLock.lock();
        try {
            return temporary.size();
        } finally {
            temporaryLock.unlock();
        }
    }

    /**
     * Number of long-lived tasks in the snapshot currently being watched by {@link #supervise()}.
     */
    public int supervisedCount() {
        return supervisedCount;
    }

    /**
     * Number of long-lived tasks waiting for the next {@link #supervise()} snapshot.
     */
    public int longLivedCount() {
        longLivedLock.lock();
        try {
            return longLived.size();
        } finally {
            longLivedLock.unlock();
        }
    }
}
