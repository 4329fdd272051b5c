package com.zzf.localagent.checkpoint;

import com.zzf.localagent.project.AgentContext;
import com.zzf.localagent.project.AgentWorkspace;
import com.zzf.localagent.snapshot.RepoSnapshot;
import com.zzf.localagent.state.BranchStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Approve and revert of the opened repository. An approve pairs a working-tree snapshot with
 * an agent snapshot of the active branch, so a later revert brings back files and
 * conversation state together.
 */
@Slf4j
@RequiredArgsConstructor
public class CheckpointService {

    static final String TOOL_APPROVE = "checkpoint.approve";
    static final String TOOL_REVERT = "checkpoint.revert";

    private final AgentContext context;

    public Checkpoint approve(String message) {
        AgentWorkspace workspace = context.requireWorkspace();
        BranchStateStore stateStore = workspace.getStateStore();
        String text = message == null ? "" : message;

        RepoSnapshot repoSnapshot = workspace.getSnapshotCache().snapshot(text);
        String agentSnapshotId = stateStore.snapshot(repoSnapshot.getSnapshotId(), text);
        stateStore.clearPendingPatch();
        stateStore.appendToolLog(TOOL_APPROVE, repoSnapshot.getSnapshotId());

        Checkpoint checkpoint = Checkpoint.builder()
                .repoSnapshot(repoSnapshot)
                .agentSnapshotId(agentSnapshotId)
                .branch(stateStore.getActiveBranch())
                .build();
        log.info("checkpoint.approve ok repoSnapshot={} agentSnapshot={} branch={} files={}",
                repoSnapshot.getSnapshotId(), agentSnapshotId, checkpoint.getBranch(), repoSnapshot.getFileCount());
        return checkpoint;
    }

    /**
     * Restores the working tree to {@code repoSnapshotId} and drops the pending patch and
     * conversation state.
     *
     * @throws com.zzf.localagent.exception.NotFoundException for an unknown snapshot id
     */
    public void revert(String repoSnapshotId) {
        AgentWorkspace workspace = context.requireWorkspace();
        workspace.getSnapshotCache().restore(repoSnapshotId);
        BranchStateStore stateStore = workspace.getStateStore();
        stateStore.clearPendingPatch();
        context.reset();
        stateStore.appendToolLog(TOOL_REVERT, repoSnapshotId);
        log.info("checkpoint.revert ok repoSnapshot={} branch={}", repoSnapshotId, stateStore.getActiveBranch());
    }

    public RestorePoints restorePoints() {
        AgentWorkspace workspace = context.requireWorkspace();
        return new RestorePoints(workspace.getSnapshotCache().listSnapshots(), workspace.getSnapshotCache().getHead());
    }
}
