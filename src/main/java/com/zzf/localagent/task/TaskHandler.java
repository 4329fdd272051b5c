package com.zzf.localagent.task;

import java.util.Map;

/**
 * Executes tasks of one type on the worker thread. Any exception marks the task failed.
 */
public interface TaskHandler {

    String getType();

    /**
     * @return the result document; {@code null} is stored as {@code {"ok": true}}
     */
    Map<String, Object> handle(TaskRecord task) throws Exception;
}
