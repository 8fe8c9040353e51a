package com.familycalendar.core.tasks;

import java.util.List;

/**
 * What a {@link TaskSupervisor#supervise()} pass observed.
 *
 * @param index          position of the first task to exit within the supervised snapshot
 * @param taskName       name of that task
 * @param outcome        how it exited
 * @param abortedIndexes snapshot positions of the siblings that were sent an abort; they
 *                       may still be winding down when the pass returns
 */
public record SupervisionResult(
    int index,
    String taskName,
    TaskOutcome outcome,
    List<Integer> abortedIndexes
) {}
