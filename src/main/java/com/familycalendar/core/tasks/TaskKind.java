package com.familycalendar.core.tasks;

public enum TaskKind {
    /** Expected to run for the life of the process; its exit is fatal to the group. */
    LONG_LIVED,
    /** Caller-tracked, not covered by the abort-all policy. */
    TEMPORARY
}
