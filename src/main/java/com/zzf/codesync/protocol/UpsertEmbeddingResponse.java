package com.zzf.codesync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class UpsertEmbeddingResponse {
    private final boolean stored;

    @JsonCreator
    public UpsertEmbeddingResponse(@JsonProperty("stored") boolean stored) {
        this.stored = stored;
    }

    public boolean isStored() {
        return stored;
    }
}
