package com.zzf.localagent.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * Contents of {@code meta.json} inside a branch snapshot.
 */
@Data
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentSnapshotMeta {
    private String id;
    /** Opaque reference supplied by the caller, e.g. a commit sha or repo snapshot id. */
    private String head;
    private String message;
    private long ts;
}
