package com.familycalendar.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing calendar-server MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setConnection(String connectionId) {
        MDC.put("connectionId", connectionId);
    }

    public static void setTask(String taskName) {
        MDC.put("task", taskName);
    }

    public static void clear() {
        MDC.remove("connectionId");
        MDC.remove("task");
    }
}
