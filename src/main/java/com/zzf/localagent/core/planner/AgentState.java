package com.zzf.localagent.core.planner;

public enum AgentState {
    IDLE,
    NEEDS_INFO,
    READY
}
