package com.zzf.codesync.model;

public class HashMismatchException extends SyncException {
    private final String path;
    private final String claimedHash;
    private final String actualHash;

    public HashMismatchException(String path, String claimedHash, String actualHash) {
        super(SyncErrorCode.HASH_MISMATCH, "content hash mismatch path=" + path + " claimed=" + claimedHash + " actual=" + actualHash);
        this.path = path;
        this.claimedHash = claimedHash;
        this.actualHash = actualHash;
    }

    public String getPath() {
        return path;
    }

    public String getClaimedHash() {
        return claimedHash;
    }

    public String getActualHash() {
        return actualHash;
    }
}
