package com.zzf.codesync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.zzf.codesync.core.merkle.ChangeSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Canonical change set computed by the server against its acknowledged snapshot, and the
 * session that the following push and commit calls must quote.
 */
public final class NegotiateResponse {
    private final String sessionId;
    private final List<String> changedPaths;
    private final List<String> added;
    private final List<String> modified;
    private final List<String> removed;

    @JsonCreator
    public NegotiateResponse(
            @JsonProperty("sessionId") String sessionId,
            @JsonProperty("changedPaths") List<String> changedPaths,
            @JsonProperty("added") List<String> added,
            @JsonProperty("modified") List<String> modified,
            @JsonProperty("removed") List<String> removed
    ) {
        this.sessionId = sessionId;
        this.changedPaths = copy(changedPaths);
        this.added = copy(added);
        this.modified = copy(modified);
        this.removed = copy(removed);
    }

    public static NegotiateResponse of(String sessionId, ChangeSet changes) {
        return new NegotiateResponse(sessionId, new ArrayList<String>(changes.changedPaths()),
                new ArrayList<String>(changes.getAdded()), new ArrayList<String>(changes.getModified()),
                new ArrayList<String>(changes.getRemoved()));
    }

    @JsonIgnore
    public ChangeSet toChangeSet() {
        return new ChangeSet(added, modified, removed);
    }

    public String getSessionId() {
        return sessionId;
    }

    public List<String> getChangedPaths() {
        return changedPaths;
    }

    public List<String> getAdded() {
        return added;
    }

    public List<String> getModified() {
        return modified;
    }

    public List<String> getRemoved() {
        return removed;
    }

    private static List<String> copy(List<String> in) {
        return in == null ? Collections.<String>emptyList() : Collections.unmodifiableList(new ArrayList<String>(in));
    }
}
