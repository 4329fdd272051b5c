package com.zzf.localagent.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.localagent.exception.NotFoundException;
import com.zzf.localagent.exception.ValidationException;
import com.zzf.localagent.storage.FileSystemDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BranchStateStoreTest {

    @TempDir
    Path sessionRoot;

    private BranchStateStore store;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper();
        store = new BranchStateStore(new FileSystemDocumentStore(sessionRoot, mapper), mapper);
        store.ensureSession(BranchStateStore.DEFAULT_BRANCH);
    }

    @Test
    void testEnsureSessionCreatesLayout() {
        Path main = sessionRoot.resolve("branches/main");
        assertEquals("{}", readString(main.resolve("state.json")));
        assertEquals("", readString(main.resolve("memory.md")));
        assertEquals("", readString(main.resolve("pending_patch.json")));
        assertTrue(Files.isRegularFile(main.resolve("tool_log.jsonl")));
        assertTrue(Files.isDirectory(main.resolve("repo_map")));
        assertEquals("main", readString(sessionRoot.resolve("active_branch.txt")));
        assertFalse(store.hasPendingPatch());
    }

    @Test
    void testEnsureSessionKeepsActivePointer() {
        store.switchBranch("feature");
        store.ensureSession(BranchStateStore.DEFAULT_BRANCH);
        assertEquals("feature", store.getActiveBranch());
    }

    @Test
    void testBranchIsolationOfPendingPatch() {
        store.writePendingPatch(Map.of("diff", "A"));

        store.switchBranch("feature");
        assertTrue(store.readPendingPatch().isEmpty());
        assertEquals(List.of("feature", "main"), store.listBranches());

        store.switchBranch("main");
        assertEquals(Map.of("diff", "A"), store.readPendingPatch());

        store.clearPendingPatch();
        assertFalse(store.hasPendingPatch());
    }

    @Test
    void testSnapshotRestoreIsByteIdentical() {
        store.writeFile(BranchFile.PLAN, "1. step one\n");
        store.writeFile(BranchFile.MEMORY, "remember ü\n");
        store.writePendingPatch(Map.of("diff", "+a"));
        Path main = sessionRoot.resolve("branches/main");
        byte[] plan = readBytes(main.resolve("plan.md"));
        byte[] memory = readBytes(main.resolve("memory.md"));
        byte[] patch = readBytes(main.resolve("pending_patch.json"));
        byte[] state = readBytes(main.resolve("state.json"));

        String id = store.snapshot("snap_20240101_000000_abcd1234", "before edit");

        store.writeFile(BranchFile.PLAN, "rewritten");
        store.writeFile(BranchFile.MEMORY, "");
        store.writeFile(BranchFile.STATE, "{\"x\":1}");
        store.clearPendingPatch();

        store.restoreSnapshot(id);
        assertArrayEquals(plan, readBytes(main.resolve("plan.md")));
        assertArrayEquals(memory, readBytes(main.resolve("memory.md")));
        assertArrayEquals(patch, readBytes(main.resolve("pending_patch.json")));
        assertArrayEquals(state, readBytes(main.resolve("state.json")));
    }

    @Test
    void testSnapshotsAreListedOldestFirst() {
        String first = store.snapshot("h1", "one");
        String second = store.snapshot("h2", "two");
        assertNotEquals(first, second);

        List<AgentSnapshotMeta> snapshots = store.listSnapshots();
        assertEquals(2, snapshots.size());
        assertEquals(first, snapshots.get(0).getId());
        assertEquals("h2", snapshots.get(1).getHead());
        assertEquals("two", snapshots.get(1).getMessage());
    }

    @Test
    void testSnapshotsAreBranchScoped() {
        String id = store.snapshot("h", "main only");
        store.switchBranch("feature");
        assertTrue(store.listSnapshots().isEmpty());
        assertThrows(NotFoundException.class, () -> store.restoreSnapshot(id));
    }

    @Test
    void testRestoreUnknownSnapshot() {
        assertThrows(NotFoundException.class, () -> store.restoreSnapshot("snap_missing"));
    }

    @Test
    void testInvalidBranchNamesAreRejectedWithoutMutation() {
        for (String name : new String[]{"", ".", "..", "a/b", "bad name", "x\\y"}) {
            assertThrows(ValidationException.class, () -> store.switchBranch(name));
        }
        assertThrows(ValidationException.class, () -> store.switchBranch(null));
        assertEquals("main", store.getActiveBranch());
        assertEquals(List.of("main"), store.listBranches());
    }

    @Test
    void testToolLog() {
        store.appendToolLog("checkpoint.approve", "snap_1");
        store.appendToolLog("checkpoint.revert", "snap_1");
        List<ToolLogEntry> log = store.readToolLog();
        assertEquals(2, log.size());
        assertEquals("checkpoint.revert", log.get(1).getTool());
        assertEquals("snap_1", log.get(0).getDetail());
    }

    private static String readString(Path path) {
        return new String(readBytes(path), StandardCharsets.UTF_8);
    }

    private static byte[] readBytes(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new AssertionError(e);
        }
    }
}
