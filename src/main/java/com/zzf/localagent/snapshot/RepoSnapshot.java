package com.zzf.localagent.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * One entry of the snapshot cache's {@code index.json}.
 */
@Data
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class RepoSnapshot {
    @JsonProperty("snapshot_id")
    private String snapshotId;
    /** Epoch millis. */
    @JsonProperty("created_at")
    private long createdAt;
    private String message;
    @JsonProperty("file_count")
    private int fileCount;
}
