package com.zzf.codesync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class CommitRequest {
    private final String projectId;
    private final String sessionId;

    @JsonCreator
    public CommitRequest(@JsonProperty("projectId") String projectId, @JsonProperty("sessionId") String sessionId) {
        this.projectId = projectId;
        this.sessionId = sessionId;
    }

    public String getProjectId() {
        return projectId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
