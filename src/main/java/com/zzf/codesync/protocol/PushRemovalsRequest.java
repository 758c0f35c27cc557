package com.zzf.codesync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class PushRemovalsRequest {
    private final String projectId;
    private final String sessionId;
    private final List<String> paths;

    @JsonCreator
    public PushRemovalsRequest(
            @JsonProperty("projectId") String projectId,
            @JsonProperty("sessionId") String sessionId,
            @JsonProperty("paths") List<String> paths
    ) {
        this.projectId = projectId;
        this.sessionId = sessionId;
        this.paths = paths == null ? Collections.<String>emptyList() : Collections.unmodifiableList(new ArrayList<String>(paths));
    }

    public String getProjectId() {
        return projectId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public List<String> getPaths() {
        return paths;
    }
}
