package com.zzf.codesync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class PushChangesResponse {
    private final List<String> accepted;
    private final List<RejectedPath> rejected;
    private final List<String> warnings;

    @JsonCreator
    public PushChangesResponse(
            @JsonProperty("accepted") List<String> accepted,
            @JsonProperty("rejected") List<RejectedPath> rejected,
            @JsonProperty("warnings") List<String> warnings
    ) {
        this.accepted = accepted == null ? Collections.<String>emptyList() : Collections.unmodifiableList(new ArrayList<String>(accepted));
        this.rejected = rejected == null ? Collections.<RejectedPath>emptyList() : Collections.unmodifiableList(new ArrayList<RejectedPath>(rejected));
        this.warnings = warnings == null ? Collections.<String>emptyList() : Collections.unmodifiableList(new ArrayList<String>(warnings));
    }

    public List<String> getAccepted() {
        return accepted;
    }

    public List<RejectedPath> getRejected() {
        return rejected;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
