package com.zzf.codesync.client;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Walks up from a start directory to the nearest directory that looks like a project root.
 */
public final class ProjectRootDetector {
    public static final List<String> DEFAULT_MARKERS = Collections.unmodifiableList(Arrays.asList(
            ".git", "pom.xml", "build.gradle", "package.json", "pyproject.toml", "Cargo.toml", "go.mod",
            "requirements.txt", "setup.py"
    ));

    private final List<String> markers;

    public ProjectRootDetector() {
        this(DEFAULT_MARKERS);
    }

    public ProjectRootDetector(List<String> markers) {
        this.markers = markers;
    }

    public Optional<Path> detect(Path start) {
        if (start == null) {
            return Optional.empty();
        }
        Path cur = start.toAbsolutePath().normalize();
        if (Files.isRegularFile(cur)) {
            cur = cur.getParent();
        }
        while (cur != null) {
            for (String marker : markers) {
                if (Files.exists(cur.resolve(marker))) {
                    return Optional.of(cur);
                }
            }
            cur = cur.getParent();
        }
        return Optional.empty();
    }

    /**
     * The detected root, or {@code start} itself when no marker is found.
     */
    public Path detectOrSelf(Path start) {
        return detect(start).orElse(start.toAbsolutePath().normalize());
    }
}
