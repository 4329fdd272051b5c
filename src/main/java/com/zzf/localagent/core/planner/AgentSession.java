package com.zzf.localagent.core.planner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The live record of one conversation: the phase it is in and the questions still waiting
 * for an answer. Overwritten by every planner decision, cleared by {@link #reset()}.
 */
public class AgentSession {

    private AgentState state = AgentState.IDLE;
    private List<String> questions = new ArrayList<>();

    public synchronized AgentState getState() {
        return state;
    }

    public synchronized List<String> getQuestions() {
        return Collections.unmodifiableList(new ArrayList<>(questions));
    }

    public synchronized void setNeedsInfo(List<String> questions) {
        this.state = AgentState.NEEDS_INFO;
        this.questions = questions == null ? new ArrayList<>() : new ArrayList<>(questions);
    }

    public synchronized void setReady() {
        this.state = AgentState.READY;
        this.questions = new ArrayList<>();
    }

    /**
     * Moves the session to the state decided by the planner.
     */
    public void apply(PlannerOutput output) {
        if (output.getState() == AgentState.NEEDS_INFO) {
            setNeedsInfo(output.getQuestions());
        } else if (output.getState() == AgentState.READY) {
            setReady();
        }
    }

    public synchronized void reset() {
        this.state = AgentState.IDLE;
        this.questions = new ArrayList<>();
    }
}
