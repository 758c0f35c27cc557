package com.zzf.codesync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class RegisterProjectRequest {
    private final String projectPath;
    private final String projectName;

    @JsonCreator
    public RegisterProjectRequest(
            @JsonProperty("projectPath") String projectPath,
            @JsonProperty("projectName") String projectName
    ) {
        this.projectPath = projectPath;
        this.projectName = projectName;
    }

    public String getProjectPath() {
        return projectPath;
    }

    public String getProjectName() {
        return projectName;
    }
}
