package com.zzf.localagent.checkpoint;

import com.zzf.localagent.snapshot.RepoSnapshot;
import lombok.Builder;
import lombok.Value;

/**
 * Result of an approve: the working-tree snapshot and the agent snapshot that points at it.
 */
@Value
@Builder
public class Checkpoint {
    RepoSnapshot repoSnapshot;
    String agentSnapshotId;
    String branch;
}
