package com.zzf.localagent.task;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * Contents of {@code <task_id>/meta.json}; the worker owns its status transitions.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaskMeta {
    private String id;
    private String type;
    private TaskStatus status;
    private String error;
    private Long createdAt;
    private Long startedAt;
    private Long finishedAt;
}
