package com.overseer.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Overseer-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId, String phases) {
        MDC.put("runId", runId);
        MDC.put("phase", phases);
    }

    public static void setTask(String runId, String taskId) {
        MDC.put("runId", runId);
        MDC.put("taskId", taskId);
    }

    public static void clearTask() {
        MDC.remove("taskId");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("phase");
        MDC.remove("taskId");
    }
}
