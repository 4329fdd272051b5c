package com.zzf.localagent.task.handler;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.localagent.core.planner.PlannerOutput;
import com.zzf.localagent.core.planner.QueryPlanner;
import com.zzf.localagent.task.TaskHandler;
import com.zzf.localagent.task.TaskRecord;
import lombok.RequiredArgsConstructor;

import java.util.Map;

/**
 * {@code QUERY}: runs the planner on {@code payload.user_text}; the result is the planner output.
 */
@RequiredArgsConstructor
public class QueryTaskHandler implements TaskHandler {

    public static final String TYPE = "QUERY";

    private final QueryPlanner planner;
    private final ObjectMapper objectMapper;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public Map<String, Object> handle(TaskRecord task) {
        String userText = Payloads.requireText(task, "user_text");
        PlannerOutput output = planner.analyze(userText);
        return objectMapper.convertValue(output, new TypeReference<Map<String, Object>>() {});
    }
}
