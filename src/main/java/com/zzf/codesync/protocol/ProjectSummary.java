package com.zzf.codesync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class ProjectSummary {
    private final String projectId;
    private final String projectName;
    private final String acknowledgedRootHash;
    private final long registeredAt;
    private final long lastSync;
    private final int fileCount;

    @JsonCreator
    public ProjectSummary(
            @JsonProperty("projectId") String projectId,
            @JsonProperty("projectName") String projectName,
            @JsonProperty("acknowledgedRootHash") String acknowledgedRootHash,
            @JsonProperty("registeredAt") long registeredAt,
            @JsonProperty("lastSync") long lastSync,
            @JsonProperty("fileCount") int fileCount
    ) {
        this.projectId = projectId;
        this.projectName = projectName;
        this.acknowledgedRootHash = acknowledgedRootHash;
        this.registeredAt = registeredAt;
        this.lastSync = lastSync;
        this.fileCount = fileCount;
    }

    public String getProjectId() {
        return projectId;
    }

    public String getProjectName() {
        return projectName;
    }

    public String getAcknowledgedRootHash() {
        return acknowledgedRootHash;
    }

    public long getRegisteredAt() {
        return registeredAt;
    }

    public long getLastSync() {
        return lastSync;
    }

    public int getFileCount() {
        return fileCount;
    }
}
