package com.zzf.codesync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.zzf.codesync.core.merkle.TreeSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class NegotiateRequest {
    private final String projectId;
    private final TreeSnapshot snapshot;
    private final List<String> unreadablePaths;

    public NegotiateRequest(String projectId, TreeSnapshot snapshot) {
        this(projectId, snapshot, null);
    }

    /**
     * @param unreadablePaths paths the client saw but could not hash this cycle; the server keeps
     *                        their acknowledged state instead of treating them as removed
     */
    @JsonCreator
    public NegotiateRequest(
            @JsonProperty("projectId") String projectId,
            @JsonProperty("snapshot") TreeSnapshot snapshot,
            @JsonProperty("unreadablePaths") List<String> unreadablePaths
    ) {
        this.projectId = projectId;
        this.snapshot = snapshot;
        this.unreadablePaths = unreadablePaths == null
                ? Collections.<String>emptyList()
                : Collections.unmodifiableList(new ArrayList<String>(unreadablePaths));
    }

    public String getProjectId() {
        return projectId;
    }

    public TreeSnapshot getSnapshot() {
        return snapshot;
    }

    public List<String> getUnreadablePaths() {
        return unreadablePaths;
    }
}
