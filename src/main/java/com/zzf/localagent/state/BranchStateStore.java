package com.zzf.localagent.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.localagent.exception.NotFoundException;
import com.zzf.localagent.exception.StorageException;
import com.zzf.localagent.exception.ValidationException;
import com.zzf.localagent.storage.DocumentStore;
import com.zzf.localagent.util.Identifier;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.zzf.localagent.storage.DocumentStore.key;

/**
 * Branch-scoped working memory of one agent session.
 * <pre>
 * active_branch.txt
 * branches/&lt;branch&gt;/state.json memory.md plan.md scratchpad.md pending_patch.json tool_log.jsonl repo_map/
 * branches/&lt;branch&gt;/snapshots/&lt;id&gt;/{scalar files, meta.json}
 * </pre>
 * Every read and write goes through the active branch; switching branches only moves the
 * pointer, nothing is copied between branches.
 */
@Slf4j
public class BranchStateStore {

    public static final String DEFAULT_BRANCH = "main";

    private static final String ACTIVE_BRANCH = "active_branch.txt";
    private static final String BRANCHES = "branches";
    private static final String SNAPSHOTS = "snapshots";
    private static final String REPO_MAP = "repo_map";
    private static final String TOOL_LOG = "tool_log.jsonl";
    private static final String META = "meta.json";
    private static final Pattern BRANCH_NAME = Pattern.compile("[A-Za-z0-9._-]+");
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final DocumentStore store;
    private final ObjectMapper objectMapper;

    public BranchStateStore(DocumentStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    public void ensureSession(String branch) {
        validateBranchName(branch);
        store.createDirectories(key(BRANCHES, branch));
        if (!store.exists(key(ACTIVE_BRANCH))) {
            store.writeText(key(ACTIVE_BRANCH), branch);
        }
        ensureBranchFiles(branch);
    }

    public String getActiveBranch() {
        return store.readText(key(ACTIVE_BRANCH))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .orElse(DEFAULT_BRANCH);
    }

    public void switchBranch(String name) {
        validateBranchName(name);
        ensureBranchFiles(name);
        store.writeText(key(ACTIVE_BRANCH), name);
        log.info("branch.switch ok branch={}", name);
    }

    public List<String> listBranches() {
        List<String> branches = new ArrayList<>();
        for (String name : store.list(key(BRANCHES))) {
            if (store.isDirectory(key(BRANCHES, name))) {
                branches.add(name);
            }
        }
        return branches;
    }

    public Map<String, Object> readPendingPatch() {
        return store.readJson(branchKey(getActiveBranch(), BranchFile.PENDING_PATCH.getFileName()), MAP_TYPE)
                .<Map<String, Object>>map(m -> m)
                .orElseGet(LinkedHashMap::new);
    }

    public void writePendingPatch(Map<String, Object> data) {
        store.writeJson(branchKey(getActiveBranch(), BranchFile.PENDING_PATCH.getFileName()),
                data == null ? Map.of() : data);
    }

    public void clearPendingPatch() {
        writePendingPatch(Map.of());
    }

    public boolean hasPendingPatch() {
        return !readPendingPatch().isEmpty();
    }

    public String readFile(BranchFile file) {
        return store.readText(branchKey(getActiveBranch(), file.getFileName())).orElse(file.getInitialContent());
    }

    public void writeFile(BranchFile file, String content) {
        store.writeText(branchKey(getActiveBranch(), file.getFileName()), content);
    }

    public void appendToolLog(String tool, String detail) {
        ToolLogEntry entry = ToolLogEntry.builder()
                .ts(System.currentTimeMillis())
                .tool(tool)
                .detail(detail)
                .build();
        try {
            store.appendLine(branchKey(getActiveBranch(), TOOL_LOG), objectMapper.writeValueAsString(entry));
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialise tool log entry", e);
        }
    }

    public List<ToolLogEntry> readToolLog() {
        List<ToolLogEntry> entries = new ArrayList<>();
        for (String line : store.readLines(branchKey(getActiveBranch(), TOOL_LOG))) {
            try {
                entries.add(objectMapper.readValue(line, ToolLogEntry.class));
            } catch (IOException e) {
                log.warn("branch.tool_log.skip_line err={}", e.getMessage());
            }
        }
        return entries;
    }

    /**
     * Copies the active branch's scalar files into a new snapshot.
     *
     * @param headRef opaque reference recorded with the snapshot
     * @return the snapshot id
     */
    public String snapshot(String headRef, String message) {
        String branch = getActiveBranch();
        String snapshotId = Identifier.timeOrdered("snap");
        store.createDirectories(key(BRANCHES, branch, SNAPSHOTS, snapshotId));
        for (BranchFile file : BranchFile.values()) {
            List<String> source = branchKey(branch, file.getFileName());
            if (store.exists(source)) {
                store.copy(source, key(BRANCHES, branch, SNAPSHOTS, snapshotId, file.getFileName()));
            }
        }
        AgentSnapshotMeta meta = AgentSnapshotMeta.builder()
                .id(snapshotId)
                .head(headRef)
                .message(message == null ? "" : message)
                .ts(System.currentTimeMillis())
                .build();
        store.writeJson(key(BRANCHES, branch, SNAPSHOTS, snapshotId, META), meta);
        log.info("branch.snapshot ok branch={} id={} head={}", branch, snapshotId, headRef);
        return snapshotId;
    }

    public List<AgentSnapshotMeta> listSnapshots() {
        String branch = getActiveBranch();
        List<AgentSnapshotMeta> snapshots = new ArrayList<>();
        for (String id : store.list(key(BRANCHES, branch, SNAPSHOTS))) {
            Optional<AgentSnapshotMeta> meta = store.readJson(key(BRANCHES, branch, SNAPSHOTS, id, META), AgentSnapshotMeta.class);
            meta.ifPresent(snapshots::add);
        }
        snapshots.sort(Comparator.comparingLong(AgentSnapshotMeta::getTs).thenComparing(AgentSnapshotMeta::getId));
        return snapshots;
    }

    /**
     * Overwrites the active branch's scalar files with the snapshot's copies.
     *
     * @throws NotFoundException when the active branch has no snapshot with that id
     */
    public void restoreSnapshot(String snapshotId) {
        String branch = getActiveBranch();
        if (snapshotId == null || snapshotId.isBlank()
                || !store.isDirectory(key(BRANCHES, branch, SNAPSHOTS, snapshotId))) {
            throw new NotFoundException("snapshot not found: " + snapshotId);
        }
        for (BranchFile file : BranchFile.values()) {
            List<String> source = key(BRANCHES, branch, SNAPSHOTS, snapshotId, file.getFileName());
            if (store.exists(source)) {
                store.copy(source, branchKey(branch, file.getFileName()));
            }
        }
        log.info("branch.restore ok branch={} id={}", branch, snapshotId);
    }

    private void ensureBranchFiles(String branch) {
        store.createDirectories(key(BRANCHES, branch));
        for (BranchFile file : BranchFile.values()) {
            List<String> target = branchKey(branch, file.getFileName());
            if (!store.exists(target)) {
                store.writeText(target, file.getInitialContent());
            }
        }
        store.touch(branchKey(branch, TOOL_LOG));
        store.createDirectories(branchKey(branch, REPO_MAP));
    }

    private static List<String> branchKey(String branch, String name) {
        return key(BRANCHES, branch, name);
    }

    private static void validateBranchName(String name) {
        if (name == null || !BRANCH_NAME.matcher(name).matches() || ".".equals(name) || "..".equals(name)) {
            throw new ValidationException("Invalid branch name: " + name);
        }
    }
}
