package com.zzf.localagent.core.planner;

import com.zzf.localagent.core.intent.Intent;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PlannerInput {
    String userText;
    Intent intent;
    boolean repoRootKnown;
    boolean hasPendingPatch;
}
