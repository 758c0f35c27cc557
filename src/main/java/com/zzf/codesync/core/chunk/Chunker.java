package com.zzf.codesync.core.chunk;

import java.util.List;

public interface Chunker {
    /**
     * Splits one file version into ordered chunks. Identical input always yields identical
     * boundaries and hashes.
     */
    List<Chunk> chunk(String path, String content);
}
