package com.zzf.codesync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ProjectListResponse {
    private final int projectsCount;
    private final List<ProjectSummary> projects;

    @JsonCreator
    public ProjectListResponse(
            @JsonProperty("projectsCount") int projectsCount,
            @JsonProperty("projects") List<ProjectSummary> projects
    ) {
        this.projectsCount = projectsCount;
        this.projects = projects == null ? Collections.<ProjectSummary>emptyList() : Collections.unmodifiableList(new ArrayList<ProjectSummary>(projects));
    }

    public int getProjectsCount() {
        return projectsCount;
    }

    public List<ProjectSummary> getProjects() {
        return projects;
    }
}
