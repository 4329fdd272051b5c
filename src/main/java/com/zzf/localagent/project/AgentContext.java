package com.zzf.localagent.project;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.localagent.config.LocalAgentProperties;
import com.zzf.localagent.core.planner.AgentSession;
import com.zzf.localagent.exception.ValidationException;
import com.zzf.localagent.snapshot.RepoSnapshotCache;
import com.zzf.localagent.state.BranchStateStore;
import com.zzf.localagent.storage.FileSystemDocumentStore;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Set;

/**
 * The repository and conversation the agent is currently working on. One context serves one
 * repository at a time; independent contexts do not share any state.
 */
@Slf4j
public class AgentContext {

    private final LocalAgentProperties properties;
    private final ObjectMapper objectMapper;
    private final AgentSession session = new AgentSession();
    private volatile AgentWorkspace workspace;

    public AgentContext(LocalAgentProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Opens {@code repoRoot}, ensures the session's default branch and resets the
     * conversation.
     *
     * @throws ValidationException when the path is not an existing directory
     */
    public AgentWorkspace init(String repoRoot) {
        if (repoRoot == null || repoRoot.isBlank()) {
            throw new ValidationException("repo_root is required");
        }
        Path repo = Paths.get(repoRoot.trim()).toAbsolutePath().normalize();
        if (!Files.isDirectory(repo)) {
            throw new ValidationException("repo_root not found: " + repo);
        }
        String sessionId = properties.getSessionId();
        Path stateRoot = repo.resolve(properties.getStateDir());
        Path sessionRoot = stateRoot.resolve("state").resolve("sessions").resolve(sessionId);

        BranchStateStore stateStore = new BranchStateStore(new FileSystemDocumentStore(sessionRoot, objectMapper), objectMapper);
        RepoSnapshotCache snapshotCache = new RepoSnapshotCache(
                repo,
                stateRoot.resolve("snapshots"),
                properties.getSnapshot().getMaxSnapshots(),
                properties.getSnapshot().getMaxFileBytes(),
                Set.of(stateRoot.getFileName().toString()),
                objectMapper);
        stateStore.ensureSession(BranchStateStore.DEFAULT_BRANCH);

        AgentWorkspace opened = new AgentWorkspace(repo, sessionId, stateStore, snapshotCache);
        this.workspace = opened;
        session.reset();
        log.info("context.init ok repoRoot={} session={} branch={}", repo, sessionId, stateStore.getActiveBranch());
        return opened;
    }

    /**
     * Clears the conversation; repository and branch state are kept.
     */
    public void reset() {
        session.reset();
    }

    public boolean isInitialized() {
        return workspace != null;
    }

    /**
     * @throws ValidationException when {@link #init(String)} has not been called
     */
    public AgentWorkspace requireWorkspace() {
        AgentWorkspace current = workspace;
        if (current == null) {
            throw new ValidationException("init first: no repository has been opened");
        }
        return current;
    }

    public boolean hasPendingPatch() {
        AgentWorkspace current = workspace;
        return current != null && current.getStateStore().hasPendingPatch();
    }

    public AgentSession getSession() {
        return session;
    }
}
