package com.zzf.localagent.snapshot;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.localagent.exception.NotFoundException;
import com.zzf.localagent.exception.StorageException;
import com.zzf.localagent.exception.ValidationException;
import com.zzf.localagent.storage.FileSystemDocumentStore;
import com.zzf.localagent.util.Identifier;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.zzf.localagent.storage.DocumentStore.key;

/**
 * Bounded history of full working-tree backups, independent of any VCS.
 * <pre>
 * &lt;cache&gt;/index.json              [{snapshot_id, created_at, message, file_count}]  (at most maxSnapshots)
 * &lt;cache&gt;/head.json               {"head": id | "working"}
 * &lt;cache&gt;/&lt;id&gt;/manifest.json       sorted relative paths
 * &lt;cache&gt;/&lt;id&gt;/&lt;relative files&gt;
 * </pre>
 * The newest snapshot becomes head and eviction only removes older entries, so head never
 * points at an evicted directory.
 */
@Slf4j
public class RepoSnapshotCache {

    public static final String WORKING = "working";
    public static final long DEFAULT_MAX_FILE_BYTES = 10_000_000L;

    static final Set<String> DEFAULT_EXCLUDE_DIRS = Set.of(
            ".git", ".agent", ".agent_stateless", ".venv", "venv", "__pycache__",
            "node_modules", "dist", "build", "models", "target", ".gradle", ".idea");
    static final Set<String> DEFAULT_EXCLUDE_FILES = Set.of(".DS_Store");

    private static final String INDEX = "index.json";
    private static final String HEAD = "head.json";
    private static final String MANIFEST = "manifest.json";
    private static final DateTimeFormatter ID_TIME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final TypeReference<List<RepoSnapshot>> INDEX_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> MANIFEST_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> HEAD_TYPE = new TypeReference<>() {};

    private final Path repoRoot;
    private final Path cacheDir;
    private final int maxSnapshots;
    private final long maxFileBytes;
    private final Set<String> excludeDirs;
    private final FileSystemDocumentStore metaStore;

    public RepoSnapshotCache(Path repoRoot, Path cacheDir, int maxSnapshots, long maxFileBytes,
                             Set<String> extraExcludeDirs, ObjectMapper objectMapper) {
        if (maxSnapshots < 1) {
            throw new ValidationException("maxSnapshots must be at least 1, got " + maxSnapshots);
        }
        this.repoRoot = repoRoot.toAbsolutePath().normalize();
        this.cacheDir = cacheDir.toAbsolutePath().normalize();
        this.maxSnapshots = maxSnapshots;
        this.maxFileBytes = maxFileBytes;
        Set<String> excludes = new HashSet<>(DEFAULT_EXCLUDE_DIRS);
        if (extraExcludeDirs != null) {
            excludes.addAll(extraExcludeDirs);
        }
        this.excludeDirs = Collections.unmodifiableSet(excludes);
        this.metaStore = new FileSystemDocumentStore(this.cacheDir, objectMapper);
        metaStore.createDirectories(List.of());
        if (!metaStore.exists(key(INDEX))) {
            metaStore.writeJson(key(INDEX), List.of());
        }
    }

    public RepoSnapshot snapshot(String message) {
        String snapshotId = Identifier.random("snap_" + LocalDateTime.now().format(ID_TIME));
        Path snapRoot = cacheDir.resolve(snapshotId);
        List<String> manifest = new ArrayList<>();
        try {
            Files.createDirectories(snapRoot);
            for (String rel : listEligibleFiles()) {
                Path target = snapRoot.resolve(rel);
                Files.createDirectories(target.getParent());
                Files.copy(repoRoot.resolve(rel), target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                manifest.add(rel);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to snapshot " + repoRoot, e);
        }
        metaStore.writeJson(key(snapshotId, MANIFEST), manifest);

        RepoSnapshot meta = RepoSnapshot.builder()
                .snapshotId(snapshotId)
                .createdAt(System.currentTimeMillis())
                .message(message == null ? "" : message)
                .fileCount(manifest.size())
                .build();
        List<RepoSnapshot> index = listSnapshots();
        index.add(meta);
        if (index.size() > maxSnapshots) {
            index = new ArrayList<>(index.subList(index.size() - maxSnapshots, index.size()));
        }
        metaStore.writeJson(key(INDEX), index);
        writeHead(snapshotId);
        trimOld(index);
        log.info("repo.snapshot ok id={} files={} kept={}", snapshotId, manifest.size(), index.size());
        return meta;
    }

    public List<RepoSnapshot> listSnapshots() {
        return new ArrayList<>(metaStore.readJson(key(INDEX), INDEX_TYPE).orElseGet(ArrayList::new));
    }

    public List<String> readManifest(String snapshotId) {
        requireSnapshotId(snapshotId);
        return metaStore.readJson(key(snapshotId, MANIFEST), MANIFEST_TYPE)
                .orElseThrow(() -> new NotFoundException("snapshot not found: " + snapshotId));
    }

    /**
     * Makes the working tree match the snapshot: eligible files missing from the manifest are
     * deleted, manifest files are copied back. Applying it again gives the same tree.
     *
     * @throws NotFoundException when the snapshot's manifest is missing
     */
    public void restore(String snapshotId) {
        List<String> manifest = readManifest(snapshotId);
        Set<String> wanted = new LinkedHashSet<>(manifest);
        Path snapRoot = cacheDir.resolve(snapshotId);

        int removed = 0;
        for (String rel : listEligibleFiles()) {
            if (wanted.contains(rel)) {
                continue;
            }
            try {
                Files.deleteIfExists(repoRoot.resolve(rel));
                removed++;
            } catch (IOException e) {
                log.warn("repo.restore.delete_failed path={} err={}", rel, e.getMessage());
            }
        }

        int restored = 0;
        try {
            for (String rel : manifest) {
                Path src = snapRoot.resolve(rel);
                if (!Files.isRegularFile(src)) {
                    continue;
                }
                Path dst = repoRoot.resolve(rel);
                Files.createDirectories(dst.getParent());
                Files.copy(src, dst, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                restored++;
            }
        } catch (IOException e) {
            throw new StorageException("Failed to restore snapshot " + snapshotId, e);
        }
        writeHead(snapshotId);
        log.info("repo.restore ok id={} restored={} removed={}", snapshotId, restored, removed);
    }

    public String getHead() {
        return metaStore.readJson(key(HEAD), HEAD_TYPE)
                .map(m -> m.get("head"))
                .filter(h -> !h.isBlank())
                .orElse(WORKING);
    }

    public Path getCacheDir() {
        return cacheDir;
    }

    /**
     * Relative paths (with {@code /} separators) of every file a snapshot would capture, sorted.
     */
    List<String> listEligibleFiles() {
        List<String> files = new ArrayList<>();
        try {
            Files.walkFileTree(repoRoot, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(repoRoot)) {
                        return FileVisitResult.CONTINUE;
                    }
                    Path name = dir.getFileName();
                    if (dir.equals(cacheDir) || (name != null && excludeDirs.contains(name.toString()))) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isSymbolicLink() || !attrs.isRegularFile()) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (DEFAULT_EXCLUDE_FILES.contains(file.getFileName().toString())) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (attrs.size() > maxFileBytes) {
                        return FileVisitResult.CONTINUE;
                    }
                    files.add(toRelative(file));
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("repo.walk.skip path={} err={}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new StorageException("Failed to walk " + repoRoot, e);
        }
        Collections.sort(files);
        return files;
    }

    private String toRelative(Path file) {
        Path rel = repoRoot.relativize(file);
        List<String> parts = new ArrayList<>();
        for (Path part : rel) {
            parts.add(part.toString());
        }
        return String.join("/", parts);
    }

    private void trimOld(List<RepoSnapshot> index) {
        Set<String> keep = new HashSet<>();
        for (RepoSnapshot s : index) {
            keep.add(s.getSnapshotId());
        }
        for (String child : metaStore.list(List.of())) {
            if (keep.contains(child) || !metaStore.isDirectory(key(child))) {
                continue;
            }
            metaStore.delete(key(child));
            log.info("repo.snapshot.evicted id={}", child);
        }
    }

    private void writeHead(String snapshotId) {
        Map<String, String> head = new LinkedHashMap<>();
        head.put("head", snapshotId);
        metaStore.writeJson(key(HEAD), head);
    }

    private static void requireSnapshotId(String snapshotId) {
        if (snapshotId == null || snapshotId.isBlank()) {
            throw new NotFoundException("snapshot not found: " + snapshotId);
        }
    }
}
