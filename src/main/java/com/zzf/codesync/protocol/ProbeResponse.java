package com.zzf.codesync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class ProbeResponse {
    private final boolean upToDate;
    private final String acknowledgedRootHash;

    @JsonCreator
    public ProbeResponse(
            @JsonProperty("upToDate") boolean upToDate,
            @JsonProperty("acknowledgedRootHash") String acknowledgedRootHash
    ) {
        this.upToDate = upToDate;
        this.acknowledgedRootHash = acknowledgedRootHash;
    }

    public boolean isUpToDate() {
        return upToDate;
    }

    public String getAcknowledgedRootHash() {
        return acknowledgedRootHash;
    }
}
