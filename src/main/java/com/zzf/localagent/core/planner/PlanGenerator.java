package com.zzf.localagent.core.planner;

import java.util.List;

/**
 * Collaborator that writes the concrete steps for a request the planner has marked READY.
 * Invoked only for non-INFO intents.
 */
@FunctionalInterface
public interface PlanGenerator {

    /**
     * @return ordered short step descriptions; an empty list keeps the planner's skeleton
     */
    List<String> generatePlan(String userText);
}
