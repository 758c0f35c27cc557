package com.zzf.codesync.core.pipeline;

import com.zzf.codesync.model.SyncErrorCode;

import java.util.Collections;
import java.util.List;

/**
 * Result of running one file through chunk, embed, encrypt and upsert.
 */
public final class IngestOutcome {
    private final String path;
    private final boolean accepted;
    private final SyncErrorCode rejectCode;
    private final String rejectReason;
    private final List<String> chunkHashes;
    private final List<String> storedHashes;
    private final int embedded;
    private final int skipped;
    private final List<String> warnings;
    private final long embedNanos;

    private IngestOutcome(String path, boolean accepted, SyncErrorCode rejectCode, String rejectReason,
                          List<String> chunkHashes, List<String> storedHashes, int embedded, int skipped,
                          List<String> warnings, long embedNanos) {
        this.path = path;
        this.accepted = accepted;
        this.rejectCode = rejectCode;
        this.rejectReason = rejectReason;
        this.chunkHashes = Collections.unmodifiableList(chunkHashes);
        this.storedHashes = Collections.unmodifiableList(storedHashes);
        this.embedded = embedded;
        this.skipped = skipped;
        this.warnings = Collections.unmodifiableList(warnings);
        this.embedNanos = embedNanos;
    }

    public static IngestOutcome accepted(String path, List<String> chunkHashes, List<String> storedHashes,
                                         int embedded, int skipped, List<String> warnings, long embedNanos) {
        return new IngestOutcome(path, true, null, null, chunkHashes, storedHashes, embedded, skipped, warnings, embedNanos);
    }

    public static IngestOutcome rejected(String path, SyncErrorCode code, String reason, List<String> storedHashes,
                                         List<String> warnings, long embedNanos) {
        return new IngestOutcome(path, false, code, reason, Collections.<String>emptyList(), storedHashes, 0, 0, warnings, embedNanos);
    }

    public String getPath() {
        return path;
    }

    public boolean isAccepted() {
        return accepted;
    }

    public SyncErrorCode getRejectCode() {
        return rejectCode;
    }

    public String getRejectReason() {
        return rejectReason;
    }

    /**
     * Chunk hashes of the file in chunk order. Empty for rejected or binary files.
     */
    public List<String> getChunkHashes() {
        return chunkHashes;
    }

    /**
     * Hashes this run actually wrote to the store, including those of a rejected file.
     */
    public List<String> getStoredHashes() {
        return storedHashes;
    }

    public int getEmbedded() {
        return embedded;
    }

    public int getSkipped() {
        return skipped;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public long getEmbedNanos() {
        return embedNanos;
    }
}
