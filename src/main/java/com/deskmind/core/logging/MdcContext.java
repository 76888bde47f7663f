package com.deskmind.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Deskmind-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String TASK_ID = "taskId";
    public static final String SUBTASK_INDEX = "subtaskIndex";
    public static final String EXECUTOR_KIND = "executorKind";

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put(TASK_ID, taskId);
    }

    public static void setSubtask(String taskId, int subtaskIndex, String executorKind) {
        MDC.put(TASK_ID, taskId);
        MDC.put(SUBTASK_INDEX, String.valueOf(subtaskIndex));
        MDC.put(EXECUTOR_KIND, executorKind);
    }

    public static void clearSubtask() {
        MDC.remove(SUBTASK_INDEX);
        MDC.remove(EXECUTOR_KIND);
    }

    public static void clear() {
        MDC.remove(TASK_ID);
        MDC.remove(SUBTASK_INDEX);
        MDC.remove(EXECUTOR_KIND);
    }
}
