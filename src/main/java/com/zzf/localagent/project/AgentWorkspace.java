package com.zzf.localagent.project;

import com.zzf.localagent.snapshot.RepoSnapshotCache;
import com.zzf.localagent.state.BranchStateStore;
import lombok.Getter;

import java.nio.file.Path;

/**
 * Everything bound to one opened repository: its branch state and its snapshot cache.
 */
@Getter
public final class AgentWorkspace {
    private final Path repoRoot;
    private final String sessionId;
    private final BranchStateStore stateStore;
    private final RepoSnapshotCache snapshotCache;

    public AgentWorkspace(Path repoRoot, String sessionId, BranchStateStore stateStore, RepoSnapshotCache snapshotCache) {
        this.repoRoot = repoRoot;
        this.sessionId = sessionId;
        this.stateStore = stateStore;
        this.snapshotCache = snapshotCache;
    }
}
