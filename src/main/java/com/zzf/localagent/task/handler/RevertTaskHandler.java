package com.zzf.localagent.task.handler;

import com.zzf.localagent.checkpoint.CheckpointService;
import com.zzf.localagent.task.TaskHandler;
import com.zzf.localagent.task.TaskRecord;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code REVERT}: restores {@code payload.snapshot_id} through the checkpoint service.
 */
@RequiredArgsConstructor
public class RevertTaskHandler implements TaskHandler {

    public static final String TYPE = "REVERT";

    private final CheckpointService checkpoints;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public Map<String, Object> handle(TaskRecord task) {
        String snapshotId = Payloads.requireText(task, "snapshot_id");
        checkpoints.revert(snapshotId);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("ok", true);
        result.put("snapshot_id", snapshotId);
        return result;
    }
}
