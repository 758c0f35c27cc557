package com.zzf.codesync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class PushChangesRequest {
    private final String projectId;
    private final String sessionId;
    private final List<FilePayload> files;

    @JsonCreator
    public PushChangesRequest(
            @JsonProperty("projectId") String projectId,
            @JsonProperty("sessionId") String sessionId,
            @JsonProperty("files") List<FilePayload> files
    ) {
        this.projectId = projectId;
        this.sessionId = sessionId;
        this.files = files == null ? Collections.<FilePayload>emptyList() : Collections.unmodifiableList(new ArrayList<FilePayload>(files));
    }

    public String getProjectId() {
        return projectId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public List<FilePayload> getFiles() {
        return files;
    }
}
