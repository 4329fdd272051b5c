package com.zzf.localagent.core.planner;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.zzf.localagent.core.intent.Intent;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Decision of the planner for one request. Not persisted except as a task result.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlannerOutput {
    AgentState state;
    @Singular
    List<String> questions;
    @Singular("planStep")
    List<String> plan;
    boolean useMcp;
    String mcpServer;
    Intent intent;
    boolean needsConfirm;
    String confirmToken;
}
