package com.zzf.localagent.state;

/**
 * Scalar documents of a branch. These are the files a snapshot captures and restores.
 */
public enum BranchFile {
    STATE("state.json", "{}"),
    MEMORY("memory.md", ""),
    PLAN("plan.md", ""),
    SCRATCHPAD("scratchpad.md", ""),
    PENDING_PATCH("pending_patch.json", "");

    private final String fileName;
    private final String initialContent;

    BranchFile(String fileName, String initialContent) {
        this.fileName = fileName;
        this.initialContent = initialContent;
    }

    public String getFileName() {
        return fileName;
    }

    public String getInitialContent() {
        return initialContent;
    }
}
