package com.zzf.codesync.service;

import com.zzf.codesync.core.merkle.TreeSnapshotCodec;
import com.zzf.codesync.core.merkle.MerkleTreeBuilder;
import com.zzf.codesync.core.util.Sha256;
import com.zzf.codesync.model.SyncException;
import com.zzf.codesync.protocol.CommitRequest;
import com.zzf.codesync.protocol.FilePayload;
import com.zzf.codesync.protocol.NegotiateRequest;
import com.zzf.codesync.protocol.NegotiateResponse;
import com.zzf.codesync.protocol.PushChangesRequest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class VectorQueryServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void testExactTextRanksFirst() {
        SyncServerFixture fixture = SyncServerFixture.create(tempDir);
        Map<String, String> files = new TreeMap<>();
        files.put("a.txt", "alpha");
        files.put("b.txt", "beta");
        files.put("c.txt", "gamma");
        commit(fixture, "/work/q", files);

        VectorQueryService query = new VectorQueryService(fixture.projects, fixture.embeddingStore, fixture.embeddingService, fixture.cipher);
        List<QueryHit> hits = query.query("/work/q", "beta", 2);

        assertEquals(2, hits.size());
        assertEquals("b.txt", hits.get(0).getPath());
        assertEquals(Sha256.hex("beta"), hits.get(0).getChunkHash());
        assertEquals(1.0, hits.get(0).getScore(), 1e-5);
        assertTrue(hits.get(0).getScore() >= hits.get(1).getScore());
    }

    @Test
    void testRejectsBlankTextAndUnknownProject() {
        SyncServerFixture fixture = SyncServerFixture.create(tempDir);
        VectorQueryService query = new VectorQueryService(fixture.projects, fixture.embeddingStore, fixture.embeddingService, fixture.cipher);

        assertThrows(SyncException.class, () -> query.query("/work/q", " ", 3));
        assertThrows(SyncException.class, () -> query.query("/work/unknown", "x", 3));
    }

    @Test
    void testCosine() {
        assertEquals(1.0, VectorQueryService.cosine(new float[]{1f, 0f}, new float[]{2f, 0f}), 1e-9);
        assertEquals(0.0, VectorQueryService.cosine(new float[]{1f, 0f}, new float[]{0f, 1f}), 1e-9);
        assertEquals(0.0, VectorQueryService.cosine(new float[]{0f, 0f}, new float[]{1f, 1f}), 1e-9);
    }

    private static void commit(SyncServerFixture fixture, String projectId, Map<String, String> files) {
        Map<String, String> leaves = new TreeMap<>();
        for (Map.Entry<String, String> e : files.entrySet()) {
            leaves.put(e.getKey(), Sha256.hex(e.getValue()));
        }
        NegotiateResponse negotiated = fixture.server.negotiate(new NegotiateRequest(projectId,
                TreeSnapshotCodec.toSnapshot(MerkleTreeBuilder.fromLeaves(leaves))));
        List<FilePayload> payloads = new ArrayList<>();
        for (String path : negotiated.getChangedPaths()) {
            String content = files.get(path);
            payloads.add(new FilePayload(path, content.getBytes(StandardCharsets.UTF_8), Sha256.hex(content)));
        }
        fixture.server.pushChanges(new PushChangesRequest(projectId, negotiated.getSessionId(), payloads));
        fixture.server.commit(new CommitRequest(projectId, negotiated.getSessionId()));
    }
}
