package com.zzf.codesync.core.pipeline;

import com.zzf.codesync.config.SyncProperties;
import com.zzf.codesync.core.chunk.Chunk;
import com.zzf.codesync.core.chunk.Chunker;
import com.zzf.codesync.core.crypto.VectorCipher;
import com.zzf.codesync.core.embed.EmbeddingService;
import com.zzf.codesync.core.index.EmbeddingRecord;
import com.zzf.codesync.core.index.EmbeddingStore;
import com.zzf.codesync.model.EmbeddingProviderException;
import com.zzf.codesync.model.SyncErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Chunks a file, embeds every chunk the store does not already hold, seals the vectors and
 * upserts them. Provider failures stay local to the file; an encryption failure propagates
 * and must abort the caller's cycle.
 */
@Component
public class EmbeddingPipeline {
    private static final Logger logger = LoggerFactory.getLogger(EmbeddingPipeline.class);
    private static final int BINARY_SNIFF_BYTES = 8 * 1024;

    private final Chunker chunker;
    private final EmbeddingService embeddingService;
    private final VectorCipher cipher;
    private final EmbeddingStore store;
    private final int maxAttempts;
    private final long backoffMs;

    private final AtomicLong embedCalls = new AtomicLong();
    private final AtomicLong embedFailures = new AtomicLong();

    @Autowired
    public EmbeddingPipeline(Chunker chunker, EmbeddingService embeddingService, VectorCipher cipher,
                             EmbeddingStore store, SyncProperties properties) {
        this(chunker, embeddingService, cipher, store,
                properties.getServer().getEmbedMaxAttempts(), properties.getServer().getEmbedBackoffMs());
    }

    public EmbeddingPipeline(Chunker chunker, EmbeddingService embeddingService, VectorCipher cipher,
                             EmbeddingStore store, int maxAttempts, long backoffMs) {
        this.chunker = chunker;
        this.embeddingService = embeddingService;
        this.cipher = cipher;
        this.store = store;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMs = Math.max(0, backoffMs);
    }

    public IngestOutcome ingest(String path, byte[] content) {
        long t0 = System.nanoTime();
        List<String> warnings = new ArrayList<String>();
        if (isBinary(content)) {
            warnings.add("binary content not chunked path=" + path);
            logger.info("pipeline.skip path={} reason=binary bytes={}", path, content.length);
            return IngestOutcome.accepted(path, new ArrayList<String>(), new ArrayList<String>(), 0, 0, warnings, 0);
        }

        List<Chunk> chunks = chunker.chunk(path, new String(content, StandardCharsets.UTF_8));
        List<String> chunkHashes = new ArrayList<String>(chunks.size());
        List<String> stored = new ArrayList<String>();
        Set<String> seen = new HashSet<String>();
        int embedded = 0;
        int skipped = 0;
        long embedNanos = 0;
        String failure = null;

        for (Chunk chunk : chunks) {
            chunkHashes.add(chunk.getContentHash());
            if (chunk.isOversized()) {
                warnings.add(SyncErrorCode.CHUNK_TOO_LARGE + " path=" + path + " line=" + chunk.getStartLine()
                        + " chars=" + (chunk.getEndOffset() - chunk.getStartOffset()));
            }
            if (!seen.add(chunk.getContentHash()) || store.contains(chunk.getContentHash())) {
                skipped++;
                continue;
            }
            long e0 = System.nanoTime();
            float[] vector;
            try {
                vector = embedWithRetry(chunk);
            } catch (EmbeddingProviderException e) {
                embedFailures.incrementAndGet();
                failure = "chunk " + chunk.getChunkIndex() + ": " + e.getMessage();
                logger.warn("pipeline.embed.failed path={} chunkIndex={} err={}", path, chunk.getChunkIndex(), e.getMessage());
                continue;
            } finally {
                embedNanos += System.nanoTime() - e0;
            }
            EmbeddingRecord record = cipher.seal(chunk.getContentHash(), vector);
            if (store.upsert(record)) {
                stored.add(chunk.getContentHash());
            }
            embedded++;
        }

        long tookMs = (System.nanoTime() - t0) / 1_000_000L;
        if (failure != null) {
            logger.warn("pipeline.reject path={} chunks={} stored={} tookMs={}", path, chunks.size(), stored.size(), tookMs);
            return IngestOutcome.rejected(path, SyncErrorCode.EMBEDDING_PROVIDER, failure, stored, warnings, embedNanos);
        }
        logger.info("pipeline.ok path={} chunks={} embedded={} skipped={} embedMs={} tookMs={}",
                path, chunks.size(), embedded, skipped, embedNanos / 1_000_000L, tookMs);
        return IngestOutcome.accepted(path, chunkHashes, stored, embedded, skipped, warnings, embedNanos);
    }

    public long getEmbedCalls() {
        return embedCalls.get();
    }

    public long getEmbedFailures() {
        return embedFailures.get();
    }

    private float[] embedWithRetry(Chunk chunk) {
        EmbeddingProviderException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            embedCalls.incrementAndGet();
            try {
                return embeddingService.embed(chunk.getText());
            } catch (EmbeddingProviderException e) {
                last = e;
            } catch (RuntimeException e) {
                last = new EmbeddingProviderException(embeddingService.providerName() + " failed: " + e.getMessage(), e);
            }
            if (attempt < maxAttempts) {
                logger.info("pipeline.embed.retry path={} chunkIndex={} attempt={} err={}", chunk.getSourcePath(), chunk.getChunkIndex(), attempt, last.getMessage());
                if (!sleep(backoffMs * attempt)) {
                    break;
                }
            }
        }
        throw last;
    }

    static boolean isBinary(byte[] content) {
        int n = Math.min(content.length, BINARY_SNIFF_BYTES);
        for (int i = 0; i < n; i++) {
            if (content[i] == 0) {
                return true;
            }
        }
        return false;
    }

    private static boolean sleep(long ms) {
        if (ms <= 0) {
            return true;
        }
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
