package com.zzf.codesync.core.merkle;

import com.zzf.codesync.core.scan.FileRecord;
import com.zzf.codesync.core.scan.RejectedFile;

import java.util.List;

public final class BuildResult {
    private final MerkleTree tree;
    private final List<FileRecord> records;
    private final List<RejectedFile> rejects;

    public BuildResult(MerkleTree tree, List<FileRecord> records, List<RejectedFile> rejects) {
        this.tree = tree;
        this.records = records;
        this.rejects = rejects;
    }

    public MerkleTree getTree() {
        return tree;
    }

    public List<FileRecord> getRecords() {
        return records;
    }

    public List<RejectedFile> getRejects() {
        return rejects;
    }
}
