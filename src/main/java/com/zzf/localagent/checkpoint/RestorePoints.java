package com.zzf.localagent.checkpoint;

import com.zzf.localagent.snapshot.RepoSnapshot;
import lombok.Value;

import java.util.List;

@Value
public class RestorePoints {
    List<RepoSnapshot> snapshots;
    /** Snapshot id the working tree was last restored to or captured as, or {@code working}. */
    String head;
}
