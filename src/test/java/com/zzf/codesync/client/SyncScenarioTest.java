package com.zzf.codesync.client;

import com.zzf.codesync.core.merkle.MerkleTree;
import com.zzf.codesync.core.scan.FileContentReader;
import com.zzf.codesync.core.util.ProjectKeys;
import com.zzf.codesync.core.util.Sha256;
import com.zzf.codesync.model.SyncErrorCode;
import com.zzf.codesync.service.SyncServerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The documented walk-through: {@code d/a.txt="hello"}, {@code d/b.txt="world"}, then an edit,
 * a delete and a corrupted upload.
 */
class SyncScenarioTest {

    private static final String PROJECT = "/work/scenario";

    @TempDir
    Path tempDir;

    private Path root;
    private SyncServerFixture fixture;
    private LocalSyncTransport transport;
    private ProjectConfig project;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectories(tempDir.resolve("project"));
        fixture = SyncServerFixture.create(tempDir.resolve("server"));
        transport = new LocalSyncTransport(fixture.server);
        project = ProjectConfig.of(PROJECT, root);
        write("d/a.txt", "hello");
        write("d/b.txt", "world");
    }

    @Test
    void testAddEditDelete() throws IOException {
        CycleResult first = runner(FileContentReader.DEFAULT).runCycle(project);
        assertEquals(CycleStatus.COMMITTED, first.getStatus());
        assertEquals(Arrays.asList("d/a.txt", "d/b.txt"), list(first.getChangeSet().getAdded()));
        assertTrue(first.getChangeSet().getModified().isEmpty());
        assertTrue(first.getChangeSet().getRemoved().isEmpty());
        MerkleTree afterA = acknowledged();

        CycleResult unchanged = runner(FileContentReader.DEFAULT).runCycle(project);
        assertEquals(CycleStatus.UP_TO_DATE, unchanged.getStatus());
        assertTrue(unchanged.getChangeSet().isEmpty());
        assertEquals(afterA.getRootHash(), acknowledged().getRootHash());

        write("d/b.txt", "world!");
        CycleResult edited = runner(FileContentReader.DEFAULT).runCycle(project);
        assertEquals(CycleStatus.COMMITTED, edited.getStatus());
        assertEquals(Collections.singleton("d/b.txt"), edited.getChangeSet().getModified());
        assertTrue(edited.getChangeSet().getAdded().isEmpty());
        assertTrue(edited.getChangeSet().getRemoved().isEmpty());
        MerkleTree afterB = acknowledged();
        assertEquals(afterA.leafHashes().get("d/a.txt"), afterB.leafHashes().get("d/a.txt"));
        assertEquals(Sha256.hex("world!"), afterB.leafHashes().get("d/b.txt"));
        assertNotEquals(afterA.getRootHash(), afterB.getRootHash());

        Files.delete(root.resolve("d/a.txt"));
        CycleResult deleted = runner(FileContentReader.DEFAULT).runCycle(project);
        assertEquals(CycleStatus.COMMITTED, deleted.getStatus());
        assertEquals(Collections.singleton("d/a.txt"), deleted.getChangeSet().getRemoved());
        assertTrue(deleted.getChangeSet().getAdded().isEmpty());
        assertTrue(deleted.getChangeSet().getModified().isEmpty());
        assertFalse(fixture.embeddingStore.contains(Sha256.hex("hello")));
        assertTrue(fixture.embeddingStore.contains(Sha256.hex("world!")));
        assertFalse(acknowledged().leafHashes().containsKey("d/a.txt"));
    }

    @Test
    void testCorruptedUploadRejectedAlone() {
        Map<Path, AtomicInteger> reads = new ConcurrentHashMap<>();
        FileContentReader corruptingB = file -> {
            int n = reads.computeIfAbsent(file, k -> new AtomicInteger()).incrementAndGet();
            if (file.getFileName().toString().equals("b.txt") && n > 1) {
                return "w0rld".getBytes(StandardCharsets.UTF_8);
            }
            return Files.readAllBytes(file);
        };

        CycleResult result = runner(corruptingB).runCycle(project);

        assertEquals(CycleStatus.PARTIAL, result.getStatus());
        assertFalse(result.isSuccess());
        assertEquals(Collections.singletonList("d/a.txt"), result.getAccepted());
        assertEquals(1, result.getRejected().size());
        assertEquals("d/b.txt", result.getRejected().get(0).getPath());
        assertEquals(SyncErrorCode.HASH_MISMATCH, result.getRejected().get(0).getCode());
        assertEquals(Collections.singleton("d/a.txt"), acknowledged().leafHashes().keySet());

        CycleResult retried = runner(FileContentReader.DEFAULT).runCycle(project);
        assertEquals(CycleStatus.COMMITTED, retried.getStatus());
        assertEquals(Collections.singleton("d/b.txt"), retried.getChangeSet().getAdded());
    }

    private SyncCycleRunner runner(FileContentReader reader) {
        return new SyncCycleRunner(transport, new RetryPolicy(4, 1, 2.0, 10, millis -> { }), 10, 1024 * 1024, reader);
    }

    private MerkleTree acknowledged() {
        return fixture.projects.acknowledgedTree(ProjectKeys.projectKey(PROJECT));
    }

    private static List<String> list(Set<String> paths) {
        return new ArrayList<String>(paths);
    }

    private void write(String rel, String content) throws IOException {
        Path p = root.resolve(rel);
        Files.createDirectories(p.getParent());
        Files.write(p, content.getBytes(StandardCharsets.UTF_8));
    }
}
