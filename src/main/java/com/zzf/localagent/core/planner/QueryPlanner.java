package com.zzf.localagent.core.planner;

import com.zzf.localagent.core.intent.Intent;
import com.zzf.localagent.core.intent.IntentClassifier;
import com.zzf.localagent.project.AgentContext;
import com.zzf.localagent.util.StringUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for a user request: classify, run the planner state machine, record the
 * decision on the context's session and, for actionable non-INFO requests, let the plan
 * generator fill in concrete steps.
 */
@Slf4j
@Service
public class QueryPlanner {

    private final IntentClassifier classifier;
    private final PlannerStateMachine stateMachine;
    private final AgentContext context;
    private final PlanGenerator planGenerator;

    public QueryPlanner(IntentClassifier classifier,
                        PlannerStateMachine stateMachine,
                        AgentContext context,
                        @Autowired(required = false) PlanGenerator planGenerator) {
        this.classifier = classifier;
        this.stateMachine = stateMachine;
        this.context = context;
        this.planGenerator = planGenerator;
    }

    /**
     * Analyzes {@code userText} with the repository and pending-patch flags taken from the
     * context.
     */
    public PlannerOutput analyze(String userText) {
        boolean repoRootKnown = context.isInitialized();
        boolean hasPendingPatch = repoRootKnown && context.hasPendingPatch();
        return analyze(userText, repoRootKnown, hasPendingPatch);
    }

    public PlannerOutput analyze(String userText, boolean repoRootKnown, boolean hasPendingPatch) {
        Intent intent = classifier.classify(userText);
        PlannerOutput output = stateMachine.plan(userText, intent, repoRootKnown, hasPendingPatch);
        context.getSession().apply(output);
        log.info("planner.analyze intent={} state={} questions={} q={}",
                intent, output.getState(), output.getQuestions().size(), StringUtils.truncate(userText, 50));

        if (output.getState() != AgentState.READY || intent == Intent.INFO || planGenerator == null) {
            return output;
        }
        List<String> steps = generateSteps(userText);
        if (steps.isEmpty()) {
            return output;
        }
        return output.toBuilder().clearPlan().plan(steps).build();
    }

    private List<String> generateSteps(String userText) {
        try {
            long t0 = System.nanoTime();
            List<String> steps = planGenerator.generatePlan(userText);
            long tookMs = (System.nanoTime() - t0) / 1_000_000L;
            log.info("planner.generate ok steps={} tookMs={}", steps == null ? 0 : steps.size(), tookMs);
            return steps == null ? List.of() : steps;
        } catch (RuntimeException e) {
            log.warn("planner.generate.fail err={}", e.toString());
            return List.of();
        }
    }
}
