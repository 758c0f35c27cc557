package com.zzf.codesync.core.scan;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

public final class EnumerationResult {
    private final Path root;
    private final List<FileRecord> records;
    private final List<RejectedFile> rejects;

    public EnumerationResult(Path root, List<FileRecord> records, List<RejectedFile> rejects) {
        this.root = root;
        this.records = Collections.unmodifiableList(records);
        this.rejects = Collections.unmodifiableList(rejects);
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Tracked files sorted by relative path.
     */
    public List<FileRecord> getRecords() {
        return records;
    }

    public List<RejectedFile> getRejects() {
        return rejects;
    }
}
