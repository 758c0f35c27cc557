package com.zzf.codesync.service;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class QueryHit {
    private final String path;
    private final int chunkIndex;
    private final String chunkHash;
    private final double score;

    @JsonCreator
    public QueryHit(
            @JsonProperty("path") String path,
            @JsonProperty("chunkIndex") int chunkIndex,
            @JsonProperty("chunkHash") String chunkHash,
            @JsonProperty("score") double score
    ) {
        this.path = path;
        this.chunkIndex = chunkIndex;
        this.chunkHash = chunkHash;
        this.score = score;
    }

    public String getPath() {
        return path;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }

    public String getChunkHash() {
        return chunkHash;
    }

    public double getScore() {
        return score;
    }
}
