package com.zzf.codesync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class PushRemovalsResponse {
    private final boolean ack;
    private final int staged;

    @JsonCreator
    public PushRemovalsResponse(@JsonProperty("ack") boolean ack, @JsonProperty("staged") int staged) {
        this.ack = ack;
        this.staged = staged;
    }

    public boolean isAck() {
        return ack;
    }

    public int getStaged() {
        return staged;
    }
}
