package com.zzf.localagent.core.planner;

import com.zzf.localagent.core.intent.Intent;
import com.zzf.localagent.core.intent.ScopeHints;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Turns a classified request into a plan skeleton, a clarifying question or a confirmation
 * requirement.
 *
 * <pre>
 * INFO       repo unknown                     -> NEEDS_INFO  (ask for repo root)
 * INFO       repo known                       -> READY       (4-step investigation)
 * MCP                                         -> READY       (2 steps, use playwright)
 * COMMAND                                     -> NEEDS_INFO  (confirm with YES)
 * EDIT       pending patch + revision wording -> READY       (revise pending patch)
 * EDIT       scope undetermined               -> NEEDS_INFO  (ask for file/area)
 * EDIT                                        -> READY       (3-step edit)
 * AMBIGUOUS                                   -> NEEDS_INFO  (explain or change?)
 * </pre>
 * Pure; never throws.
 */
@Component
public class PlannerStateMachine {

    public static final String MCP_SERVER = "playwright";
    public static final String CONFIRM_TOKEN = "YES";

    static final String ASK_REPO_ROOT = "Please call init with repo_root or provide the repo path.";
    static final String ASK_COMMAND = "Commands require explicit confirmation. Provide the exact command to run.";
    static final String ASK_SCOPE = "Which file or area should I change?";
    static final String ASK_DISAMBIGUATE = "Is this an explanation request or a code change?";

    static final List<String> INFO_PLAN = List.of(
            "Read README/docs for usage",
            "Inspect build files (package.json/pyproject/Makefile/pom.xml) for scripts",
            "Use repo map/index to summarize structure",
            "Summarize how to start/run the project");
    static final List<String> MCP_PLAN = List.of(
            "Use MCP tools to gather external context",
            "Summarize findings for the user");
    static final List<String> REVISE_PLAN = List.of(
            "Revise pending patch based on new instruction",
            "Update diff and summary");
    static final List<String> EDIT_PLAN = List.of(
            "Locate relevant files and symbols",
            "Identify necessary changes",
            "Prepare a patch proposal");

    private static final List<String> REVISION_KEYWORDS = List.of(
            "change more", "revise", "update", "tweak", "modify", "adjust");

    public PlannerOutput plan(PlannerInput input) {
        String text = input.getUserText() == null ? "" : input.getUserText().trim();
        Intent intent = input.getIntent() == null ? Intent.AMBIGUOUS : input.getIntent();

        switch (intent) {
            case INFO:
                if (!input.isRepoRootKnown()) {
                    return needsInfo(intent, ASK_REPO_ROOT).build();
                }
                return ready(intent, INFO_PLAN).build();
            case MCP:
                return ready(intent, MCP_PLAN)
                        .useMcp(true)
                        .mcpServer(MCP_SERVER)
                        .build();
            case COMMAND:
                return needsInfo(intent, ASK_COMMAND)
                        .needsConfirm(true)
                        .confirmToken(CONFIRM_TOKEN)
                        .build();
            case EDIT:
                if (input.isHasPendingPatch() && looksLikeRevision(text)) {
                    return ready(intent, REVISE_PLAN).build();
                }
                if (ScopeHints.isScopeUndetermined(text)) {
                    return needsInfo(intent, ASK_SCOPE).build();
                }
                return ready(intent, EDIT_PLAN).build();
            case AMBIGUOUS:
            default:
                return needsInfo(Intent.AMBIGUOUS, ASK_DISAMBIGUATE).build();
        }
    }

    public PlannerOutput plan(String userText, Intent intent, boolean repoRootKnown, boolean hasPendingPatch) {
        return plan(PlannerInput.builder()
                .userText(userText)
                .intent(intent)
                .repoRootKnown(repoRootKnown)
                .hasPendingPatch(hasPendingPatch)
                .build());
    }

    static boolean looksLikeRevision(String text) {
        String t = text.toLowerCase(Locale.ROOT);
        for (String keyword : REVISION_KEYWORDS) {
            if (t.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static PlannerOutput.PlannerOutputBuilder needsInfo(Intent intent, String question) {
        return PlannerOutput.builder()
                .state(AgentState.NEEDS_INFO)
                .question(question)
                .intent(intent);
    }

    private static PlannerOutput.PlannerOutputBuilder ready(Intent intent, List<String> plan) {
        return PlannerOutput.builder()
                .state(AgentState.READY)
                .plan(plan)
                .intent(intent);
    }
}
