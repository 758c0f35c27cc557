package com.zzf.codesync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Content of one changed file. {@code claimedHash} is the hash the client saw at enumeration
 * time; the server re-hashes {@code content} and compares.
 */
public final class FilePayload {
    private final String path;
    private final byte[] content;
    private final String claimedHash;

    @JsonCreator
    public FilePayload(
            @JsonProperty("path") String path,
            @JsonProperty("content") byte[] content,
            @JsonProperty("claimedHash") String claimedHash
    ) {
        this.path = path;
        this.content = content;
        this.claimedHash = claimedHash;
    }

    public String getPath() {
        return path;
    }

    public byte[] getContent() {
        return content;
    }

    public String getClaimedHash() {
        return claimedHash;
    }
}
