package com.zzf.localagent.logging;

import org.slf4j.MDC;

/**
 * MDC keys carried by log lines written while a background task runs.
 */
public final class MdcContext {

    public static final String TASK_ID = "taskId";
    public static final String TASK_TYPE = "taskType";

    private MdcContext() {}

    public static void setTask(String taskId, String taskType) {
        MDC.put(TASK_ID, taskId);
        MDC.put(TASK_TYPE, taskType);
    }

    public static void clear() {
        MDC.remove(TASK_ID);
        MDC.remove(TASK_TYPE);
    }
}
