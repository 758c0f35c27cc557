package com.zzf.codesync.core.chunk;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A bounded slice of one file version. The text is carried only while the chunk is being
 * embedded and is never serialized.
 */
public final class Chunk {
    private final String sourcePath;
    private final int chunkIndex;
    private final int startLine;
    private final int endLine;
    private final int startOffset;
    private final int endOffset;
    private final String contentHash;
    private final boolean oversized;
    private final transient String text;

    public Chunk(String sourcePath, int chunkIndex, int startLine, int endLine, int startOffset, int endOffset,
                 String contentHash, boolean oversized, String text) {
        this.sourcePath = sourcePath;
        this.chunkIndex = chunkIndex;
        this.startLine = startLine;
        this.endLine = endLine;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.contentHash = contentHash;
        this.oversized = oversized;
        this.text = text;
    }

    @JsonCreator
    public Chunk(
            @JsonProperty("sourcePath") String sourcePath,
            @JsonProperty("chunkIndex") int chunkIndex,
            @JsonProperty("startLine") int startLine,
            @JsonProperty("endLine") int endLine,
            @JsonProperty("startOffset") int startOffset,
            @JsonProperty("endOffset") int endOffset,
            @JsonProperty("contentHash") String contentHash,
            @JsonProperty("oversized") boolean oversized
    ) {
        this(sourcePath, chunkIndex, startLine, endLine, startOffset, endOffset, contentHash, oversized, null);
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public String getContentHash() {
        return contentHash;
    }

    public boolean isOversized() {
        return oversized;
    }

    @JsonIgnore
    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return sourcePath + "#" + chunkIndex + "[" + startLine + ".." + endLine + "]";
    }
}
