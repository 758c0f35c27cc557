package com.zzf.codesync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class HealthResponse {
    private final String status;
    private final String message;
    private final int projectsCount;
    private final long uptime;

    @JsonCreator
    public HealthResponse(
            @JsonProperty("status") String status,
            @JsonProperty("message") String message,
            @JsonProperty("projectsCount") int projectsCount,
            @JsonProperty("uptime") long uptime
    ) {
        this.status = status;
        this.message = message;
        this.projectsCount = projectsCount;
        this.uptime = uptime;
    }

    public String getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public int getProjectsCount() {
        return projectsCount;
    }

    /**
     * Seconds since the service started.
     */
    public long getUptime() {
        return uptime;
    }
}
