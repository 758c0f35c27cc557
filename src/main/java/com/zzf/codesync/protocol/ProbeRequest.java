package com.zzf.codesync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class ProbeRequest {
    private final String projectId;
    private final String rootHash;

    @JsonCreator
    public ProbeRequest(@JsonProperty("projectId") String projectId, @JsonProperty("rootHash") String rootHash) {
        this.projectId = projectId;
        this.rootHash = rootHash;
    }

    public String getProjectId() {
        return projectId;
    }

    public String getRootHash() {
        return rootHash;
    }
}
