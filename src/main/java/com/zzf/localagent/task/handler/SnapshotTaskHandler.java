package com.zzf.localagent.task.handler;

import com.zzf.localagent.project.AgentContext;
import com.zzf.localagent.snapshot.RepoSnapshot;
import com.zzf.localagent.task.TaskHandler;
import com.zzf.localagent.task.TaskRecord;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code SNAPSHOT}: captures the working tree of the opened repository.
 */
@RequiredArgsConstructor
public class SnapshotTaskHandler implements TaskHandler {

    public static final String TYPE = "SNAPSHOT";

    private final AgentContext context;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public Map<String, Object> handle(TaskRecord task) {
        String message = Payloads.optionalText(task, "message");
        RepoSnapshot snapshot = context.requireWorkspace().getSnapshotCache().snapshot(message);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("snapshot_id", snapshot.getSnapshotId());
        result.put("file_count", snapshot.getFileCount());
        return result;
    }
}
