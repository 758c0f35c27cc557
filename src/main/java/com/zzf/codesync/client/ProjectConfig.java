package com.zzf.codesync.client;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A project the client keeps in sync: where it lives locally, the id the server knows it by,
 * and how its watcher is triggered.
 */
public final class ProjectConfig {
    private final String projectId;
    private final Path root;
    private final String name;
    private final boolean fileEvents;
    private final long debounceMs;
    private final long intervalMs;

    public ProjectConfig(String projectId, Path root, String name, boolean fileEvents, long debounceMs, long intervalMs) {
        if (projectId == null || projectId.trim().isEmpty()) {
            throw new IllegalArgumentException("projectId is required");
        }
        this.projectId = projectId;
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.name = name;
        this.fileEvents = fileEvents;
        this.debounceMs = Math.max(0, debounceMs);
        this.intervalMs = Math.max(0, intervalMs);
    }

    public static ProjectConfig of(String projectId, Path root) {
        return new ProjectConfig(projectId, root, null, false, 0, 0);
    }

    public String getProjectId() {
        return projectId;
    }

    public Path getRoot() {
        return root;
    }

    public String getName() {
        return name;
    }

    public boolean isFileEvents() {
        return fileEvents;
    }

    public long getDebounceMs() {
        return debounceMs;
    }

    /**
     * Period of the timer trigger; 0 disables it.
     */
    public long getIntervalMs() {
        return intervalMs;
    }

    @Override
    public String toString() {
        return "ProjectConfig{" + projectId + " @ " + root + "}";
    }
}
