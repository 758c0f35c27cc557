package com.zzf.codesync.core.scan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class FileRecord {
    private final String path;
    private final String contentHash;
    private final long size;
    private final long modifiedTime;

    @JsonCreator
    public FileRecord(
            @JsonProperty("path") String path,
            @JsonProperty("contentHash") String contentHash,
            @JsonProperty("size") long size,
            @JsonProperty("modifiedTime") long modifiedTime
    ) {
        this.path = path;
        this.contentHash = contentHash;
        this.size = size;
        this.modifiedTime = modifiedTime;
    }

    public String getPath() {
        return path;
    }

    public String getContentHash() {
        return contentHash;
    }

    public long getSize() {
        return size;
    }

    public long getModifiedTime() {
        return modifiedTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FileRecord)) {
            return false;
        }
        FileRecord that = (FileRecord) o;
        return size == that.size && modifiedTime == that.modifiedTime
                && Objects.equals(path, that.path) && Objects.equals(contentHash, that.contentHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, contentHash, size, modifiedTime);
    }

    @Override
    public String toString() {
        return "FileRecord{" + path + " " + contentHash + "}";
    }
}
