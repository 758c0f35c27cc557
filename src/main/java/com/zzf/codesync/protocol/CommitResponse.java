package com.zzf.codesync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of closing a session. {@code pendingRetry} lists the paths whose previous leaf was
 * kept because they were rejected or never pushed; they reappear in the next diff.
 */
public final class CommitResponse {
    private final boolean committed;
    private final String acknowledgedRootHash;
    private final List<String> accepted;
    private final List<RejectedPath> rejected;
    private final List<String> pendingRetry;
    private final int evicted;

    @JsonCreator
    public CommitResponse(
            @JsonProperty("committed") boolean committed,
            @JsonProperty("acknowledgedRootHash") String acknowledgedRootHash,
            @JsonProperty("accepted") List<String> accepted,
            @JsonProperty("rejected") List<RejectedPath> rejected,
            @JsonProperty("pendingRetry") List<String> pendingRetry,
            @JsonProperty("evicted") int evicted
    ) {
        this.committed = committed;
        this.acknowledgedRootHash = acknowledgedRootHash;
        this.accepted = accepted == null ? Collections.<String>emptyList() : Collections.unmodifiableList(new ArrayList<String>(accepted));
        this.rejected = rejected == null ? Collections.<RejectedPath>emptyList() : Collections.unmodifiableList(new ArrayList<RejectedPath>(rejected));
        this.pendingRetry = pendingRetry == null ? Collections.<String>emptyList() : Collections.unmodifiableList(new ArrayList<String>(pendingRetry));
        this.evicted = evicted;
    }

    public boolean isCommitted() {
        return committed;
    }

    public String getAcknowledgedRootHash() {
        return acknowledgedRootHash;
    }

    public List<String> getAccepted() {
        return accepted;
    }

    public List<RejectedPath> getRejected() {
        return rejected;
    }

    public List<String> getPendingRetry() {
        return pendingRetry;
    }

    public int getEvicted() {
        return evicted;
    }
}
