package com.zzf.localagent.core.planner;

import com.zzf.localagent.core.intent.Intent;
import com.zzf.localagent.core.intent.IntentClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlannerStateMachineTest {

    private PlannerStateMachine planner;
    private IntentClassifier classifier;

    @BeforeEach
    void setUp() {
        planner = new PlannerStateMachine();
        classifier = new IntentClassifier();
    }

    @Test
    void testInfoWithoutRepoAsksForRoot() {
        PlannerOutput out = planner.plan("summarize the repo", Intent.INFO, false, false);
        assertEquals(AgentState.NEEDS_INFO, out.getState());
        assertEquals(List.of(PlannerStateMachine.ASK_REPO_ROOT), out.getQuestions());
        assertTrue(out.getPlan().isEmpty());
    }

    @Test
    void testInfoWithRepoIsReady() {
        PlannerOutput out = planner.plan("summarize the repo", Intent.INFO, true, false);
        assertEquals(AgentState.READY, out.getState());
        assertEquals(4, out.getPlan().size());
        assertTrue(out.getQuestions().isEmpty());
    }

    @Test
    void testMcpUsesPlaywright() {
        PlannerOutput out = planner.plan("search the web", Intent.MCP, false, false);
        assertEquals(AgentState.READY, out.getState());
        assertTrue(out.isUseMcp());
        assertEquals("playwright", out.getMcpServer());
        assertEquals(2, out.getPlan().size());
    }

    @Test
    void testCommandAlwaysNeedsConfirmation() {
        for (boolean repoKnown : new boolean[]{true, false}) {
            for (boolean pending : new boolean[]{true, false}) {
                PlannerOutput out = planner.plan("run tests", classifier.classify("run tests"), repoKnown, pending);
                assertEquals(Intent.COMMAND, out.getIntent());
                assertEquals(AgentState.NEEDS_INFO, out.getState());
                assertTrue(out.isNeedsConfirm());
                assertEquals("YES", out.getConfirmToken());
                assertEquals(1, out.getQuestions().size());
            }
        }
    }

    @Test
    void testScopedEditIsReady() {
        String text = "fix the bug in auth.py";
        PlannerOutput out = planner.plan(text, classifier.classify(text), true, false);
        assertEquals(Intent.EDIT, out.getIntent());
        assertEquals(AgentState.READY, out.getState());
        assertFalse(out.getPlan().isEmpty());
        assertTrue(out.getQuestions().isEmpty());
    }

    @Test
    void testPronounOnlyEditAsksForScope() {
        String text = "fix it";
        PlannerOutput out = planner.plan(text, classifier.classify(text), true, false);
        assertEquals(Intent.EDIT, out.getIntent());
        assertEquals(AgentState.NEEDS_INFO, out.getState());
        assertEquals(List.of(PlannerStateMachine.ASK_SCOPE), out.getQuestions());
    }

    @Test
    void testRevisionOfPendingPatch() {
        PlannerOutput out = planner.plan("please revise it", Intent.EDIT, true, true);
        assertEquals(AgentState.READY, out.getState());
        assertEquals(PlannerStateMachine.REVISE_PLAN, out.getPlan());

        PlannerOutput withoutPatch = planner.plan("please revise it", Intent.EDIT, true, false);
        assertEquals(AgentState.NEEDS_INFO, withoutPatch.getState());
    }

    @Test
    void testAmbiguousAsksToDisambiguate() {
        PlannerOutput out = planner.plan("hmm", Intent.AMBIGUOUS, true, false);
        assertEquals(AgentState.NEEDS_INFO, out.getState());
        assertEquals(List.of(PlannerStateMachine.ASK_DISAMBIGUATE), out.getQuestions());

        PlannerOutput nullIntent = planner.plan(PlannerInput.builder().userText(null).build());
        assertEquals(Intent.AMBIGUOUS, nullIntent.getIntent());
    }
}
