package com.zzf.localagent.task;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * A line of {@code tasks.jsonl}. {@link TaskQueue#list(int)} returns these with status and
 * error refreshed from the task's meta.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaskRecord {
    private String id;
    private String type;
    private Map<String, Object> payload;
    private TaskStatus status;
    /** Submission time, epoch millis. */
    private long ts;
    private String error;
}
