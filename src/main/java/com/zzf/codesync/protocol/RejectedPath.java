package com.zzf.codesync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.zzf.codesync.model.SyncErrorCode;

import java.util.Objects;

public final class RejectedPath {
    private final String path;
    private final SyncErrorCode code;
    private final String reason;

    @JsonCreator
    public RejectedPath(
            @JsonProperty("path") String path,
            @JsonProperty("code") SyncErrorCode code,
            @JsonProperty("reason") String reason
    ) {
        this.path = path;
        this.code = code;
        this.reason = reason;
    }

    public String getPath() {
        return path;
    }

    public SyncErrorCode getCode() {
        return code;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RejectedPath)) {
            return false;
        }
        RejectedPath that = (RejectedPath) o;
        return Objects.equals(path, that.path) && code == that.code && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, code, reason);
    }

    @Override
    public String toString() {
        return path + " (" + code + ": " + reason + ")";
    }
}
