package com.zzf.codesync.core.scan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class RejectedFile {
    private final String path;
    private final String reason;

    @JsonCreator
    public RejectedFile(@JsonProperty("path") String path, @JsonProperty("reason") String reason) {
        this.path = path;
        this.reason = reason;
    }

    public String getPath() {
        return path;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return path + " (" + reason + ")";
    }
}
