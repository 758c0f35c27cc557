package com.zzf.codesync.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.codesync.core.merkle.MerkleTree;
import com.zzf.codesync.core.merkle.MerkleTreeBuilder;
import com.zzf.codesync.core.util.Sha256;
import com.zzf.codesync.model.SyncErrorCode;
import com.zzf.codesync.model.SyncException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotStoreTest {

    @TempDir
    Path tempDir;

    private SnapshotStore store;

    @BeforeEach
    void setUp() {
        store = new SnapshotStore(tempDir, new ObjectMapper());
        store.init();
    }

    @Test
    void testWriteAndRead() {
        List<String> key = List.of("test", "data");
        store.write(key, "hello world");
        assertEquals("hello world", store.read(key, String.class));
        assertNull(store.read(List.of("non", "existent"), String.class));
    }

    @Test
    void testListAndRemove() {
        store.write(List.of("folder", "file1"), "content1");
        store.write(List.of("folder", "file2"), "content2");

        List<List<String>> keys = store.list(List.of("folder"));
        assertEquals(Arrays.asList(List.of("folder", "file1"), List.of("folder", "file2")), keys);

        store.remove(List.of("folder", "file1"));
        assertNull(store.read(List.of("folder", "file1"), String.class));
        assertEquals(1, store.list(List.of("folder")).size());
    }

    @Test
    void testKeySegmentsCannotEscape() {
        assertThrows(IllegalArgumentException.class, () -> store.write(List.of("..", "x"), "x"));
        assertThrows(IllegalArgumentException.class, () -> store.write(List.of("a/b"), "x"));
    }

    @Test
    void testProjectRecordRoundTrip() {
        Map<String, List<String>> ledger = new TreeMap<>();
        ledger.put("a.txt", Collections.singletonList(Sha256.hex("a")));
        ProjectRecord record = ProjectRecord.builder()
                .projectId("/work/demo")
                .projectKey("abc123")
                .projectName("demo")
                .registeredAt(42L)
                .pathChunks(ledger)
                .build();

        store.saveProject(record);

        assertEquals(record, store.loadProject("abc123"));
        assertEquals(1, store.loadProjects().size());
    }

    @Test
    void testSnapshotSavedUnderRootHash() {
        MerkleTree tree = tree("a.txt", "alpha", "src/B.java", "b");
        store.saveSnapshot("p1", tree);

        MerkleTree loaded = store.loadSnapshot("p1", tree.getRootHash());
        assertEquals(tree.getRootHash(), loaded.getRootHash());
        assertNull(store.loadSnapshot("p1", Sha256.hex("missing")));

        store.deleteSnapshot("p1", tree.getRootHash());
        assertNull(store.loadSnapshot("p1", tree.getRootHash()));
    }

    @Test
    void testCorruptSnapshotIsInvalid() throws Exception {
        String rootHash = Sha256.hex("whatever");
        Path file = tempDir.resolve("snapshots").resolve("p1").resolve(rootHash + ".json");
        Files.createDirectories(file.getParent());
        Files.write(file, "{ truncated".getBytes(StandardCharsets.UTF_8));

        SyncException e = assertThrows(SyncException.class, () -> store.loadSnapshot("p1", rootHash));
        assertEquals(SyncErrorCode.INVALID_SNAPSHOT, e.getErrorCode());
    }

    @Test
    void testSnapshotUnderWrongNameIsInvalid() throws Exception {
        MerkleTree tree = tree("a.txt", "alpha");
        store.saveSnapshot("p1", tree);
        String other = Sha256.hex("other");
        Path dir = tempDir.resolve("snapshots").resolve("p1");
        Files.move(dir.resolve(tree.getRootHash() + ".json"), dir.resolve(other + ".json"));

        SyncException e = assertThrows(SyncException.class, () -> store.loadSnapshot("p1", other));
        assertEquals(SyncErrorCode.INVALID_SNAPSHOT, e.getErrorCode());
    }

    private static MerkleTree tree(String... pathsAndContents) {
        Map<String, String> leaves = new TreeMap<>();
        for (int i = 0; i < pathsAndContents.length; i += 2) {
            leaves.put(pathsAndContents[i], Sha256.hex(pathsAndContents[i + 1]));
        }
        return MerkleTreeBuilder.fromLeaves(leaves);
    }
}
