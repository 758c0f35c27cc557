package com.zzf.codesync.core.index;

import java.util.Collection;
import java.util.Optional;

/**
 * Vector index holding encrypted embeddings keyed by chunk hash.
 */
public interface EmbeddingStore {
    /**
     * @return true when the record was written, false when a record with the same chunk hash
     * was already present
     */
    boolean upsert(EmbeddingRecord record);

    boolean contains(String chunkHash);

    Optional<EmbeddingRecord> get(String chunkHash);

    /**
     * @return number of records actually removed
     */
    int delete(Collection<String> chunkHashes);

    String name();
}
