package com.zzf.codesync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class RegisterProjectResponse {
    private final String projectId;
    private final String message;
    private final long registeredAt;

    @JsonCreator
    public RegisterProjectResponse(
            @JsonProperty("projectId") String projectId,
            @JsonProperty("message") String message,
            @JsonProperty("registeredAt") long registeredAt
    ) {
        this.projectId = projectId;
        this.message = message;
        this.registeredAt = registeredAt;
    }

    public String getProjectId() {
        return projectId;
    }

    public String getMessage() {
        return message;
    }

    public long getRegisteredAt() {
        return registeredAt;
    }
}
