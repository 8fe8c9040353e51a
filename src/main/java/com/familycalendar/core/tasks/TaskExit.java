package com.familycalendar.core.tasks;

/**
 * How a managed task finished.
 */
public enum TaskExit {
    /** The body returned normally. */
    COMPLETED,
    /** The body threw a checked exception. */
    FAILED,
    /** The body threw an unchecked exception or an {@link Error}. */
    PANICKED,
    /** The task was aborted or interrupted before it could finish. */
    ABORTED
}
