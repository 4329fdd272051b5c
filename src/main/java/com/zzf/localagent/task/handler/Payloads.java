package com.zzf.localagent.task.handler;

import com.zzf.localagent.exception.ValidationException;
import com.zzf.localagent.task.TaskRecord;

final class Payloads {

    private Payloads() {}

    static String requireText(TaskRecord task, String field) {
        String value = optionalText(task, field);
        if (value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        return value;
    }

    static String optionalText(TaskRecord task, String field) {
        Object value = task.getPayload() == null ? null : task.getPayload().get(field);
        return value == null ? "" : String.valueOf(value);
    }
}
