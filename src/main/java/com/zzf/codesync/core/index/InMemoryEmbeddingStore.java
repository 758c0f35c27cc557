package com.zzf.codesync.core.index;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public final class InMemoryEmbeddingStore implements EmbeddingStore {
    private final ConcurrentMap<String, EmbeddingRecord> records = new ConcurrentHashMap<String, EmbeddingRecord>();

    @Override
    public boolean upsert(EmbeddingRecord record) {
        if (record == null || record.getChunkHash() == null) {
            throw new IllegalArgumentException("record with chunkHash is required");
        }
        return records.putIfAbsent(record.getChunkHash(), record) == null;
    }

    @Override
    public boolean contains(String chunkHash) {
        return chunkHash != null && records.containsKey(chunkHash);
    }

    @Override
    public Optional<EmbeddingRecord> get(String chunkHash) {
        return chunkHash == null ? Optional.<EmbeddingRecord>empty() : Optional.ofNullable(records.get(chunkHash));
    }

    @Override
    public int delete(Collection<String> chunkHashes) {
        int removed = 0;
        for (String h : chunkHashes) {
            if (h != null && records.remove(h) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public String name() {
        return "memory";
    }

    public int size() {
        return records.size();
    }
}
