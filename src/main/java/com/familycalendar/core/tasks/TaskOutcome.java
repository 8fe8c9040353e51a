package com.familycalendar.core.tasks;

/**
 * Result of a finished {@link ManagedTask}.
 *
 * @param exit  how the task finished
 * @param cause the throwable for {@link TaskExit#FAILED} and {@link TaskExit#PANICKED}, otherwise null
 */
public record TaskOutcome(TaskExit exit, Throwable cause) {

    public static TaskOutcome completed() {
        return new TaskOutcome(TaskExit.COMPLETED, null);
    }

    public static TaskOutcome failed(Throwable cause) {
        return new TaskOutcome(TaskExit.FAILED, cause);
    }

    public static TaskOutcome panicked(Throwable cause) {
        return new TaskOutcome(TaskExit.PANICKED, cause);
    }

    public static TaskOutcome aborted() {
        return new TaskOutcome(TaskExit.ABORTED, null);
    }
}
