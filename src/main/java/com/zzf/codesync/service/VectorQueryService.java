package com.zzf.codesync.service;

import com.zzf.codesync.core.crypto.VectorCipher;
import com.zzf.codesync.core.embed.EmbeddingService;
import com.zzf.codesync.core.index.EmbeddingRecord;
import com.zzf.codesync.core.index.EmbeddingStore;
import com.zzf.codesync.model.SyncErrorCode;
import com.zzf.codesync.model.SyncException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Nearest-chunk lookup over one project's acknowledged embeddings. Records are decrypted in
 * process and scored by cosine similarity against the embedded query text.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VectorQueryService {

    private final ProjectRegistryService projects;
    private final EmbeddingStore embeddingStore;
    private final EmbeddingService embeddingService;
    private final VectorCipher cipher;

    public List<QueryHit> query(String projectId, String text, int k) {
        if (text == null || text.trim().isEmpty()) {
            throw new SyncException(SyncErrorCode.INVALID_REQUEST, "query text is required");
        }
        ProjectRecord record = projects.find(projectId)
                .orElseThrow(() -> new SyncException(SyncErrorCode.INVALID_REQUEST, "unknown project " + projectId));
        long t0 = System.nanoTime();
        float[] q = embeddingService.embed(text);
        Map<String, float[]> opened = new HashMap<>();
        List<QueryHit> hits = new ArrayList<>();
        for (Map.Entry<String, List<String>> e : record.getPathChunks().entrySet()) {
            List<String> hashes = e.getValue();
            for (int i = 0; i < hashes.size(); i++) {
                String hash = hashes.get(i);
                float[] v = opened.get(hash);
                if (v == null && !opened.containsKey(hash)) {
                    Optional<EmbeddingRecord> stored = embeddingStore.get(hash);
                    v = stored.isPresent() ? cipher.open(stored.get()) : null;
                    opened.put(hash, v);
                }
                if (v != null) {
                    hits.add(new QueryHit(e.getKey(), i, hash, cosine(q, v)));
                }
            }
        }
        hits.sort(Comparator.comparingDouble(QueryHit::getScore).reversed()
                .thenComparing(QueryHit::getPath)
                .thenComparingInt(QueryHit::getChunkIndex));
        List<QueryHit> top = hits.size() > Math.max(0, k) ? new ArrayList<>(hits.subList(0, Math.max(0, k))) : hits;
        log.info("query ok projectId={} candidates={} returned={} tookMs={}", projectId, hits.size(), top.size(), (System.nanoTime() - t0) / 1_000_000L);
        return top;
    }

    static double cosine(float[] a, float[] b) {
        int n = Math.min(a.length, b.length);
        double dot = 0;
        double na = 0;
        double nb = 0;
        for (int i = 0; i < n; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0 || nb == 0) {
            return 0;
        }
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }
}
