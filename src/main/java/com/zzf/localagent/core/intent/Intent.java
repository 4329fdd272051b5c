package com.zzf.localagent.core.intent;

/**
 * Category of a user utterance. Decides which planner branch runs.
 */
public enum Intent {
    /** Explanation or overview of the repository. */
    INFO,
    /** A shell command the user wants executed; always gated behind confirmation. */
    COMMAND,
    /** A code change. */
    EDIT,
    /** Needs external context through the tool-calling protocol (browsing, web search). */
    MCP,
    /** Not enough signal to pick any of the above. */
    AMBIGUOUS
}
