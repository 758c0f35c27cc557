package com.zzf.codesync.client;

import com.zzf.codesync.core.merkle.ChangeSet;
import com.zzf.codesync.model.SyncErrorCode;
import com.zzf.codesync.protocol.RejectedPath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What one sync cycle did. {@link #isSuccess()} is true only when the server now holds exactly
 * the client tree.
 */
public final class CycleResult {
    private final String projectId;
    private final String traceId;
    private final CycleStatus status;
    private final String clientRootHash;
    private final String acknowledgedRootHash;
    private final ChangeSet changeSet;
    private final List<String> accepted;
    private final List<RejectedPath> rejected;
    private final List<String> pending;
    private final List<String> warnings;
    private final SyncErrorCode errorCode;
    private final String errorMessage;
    private final long tookMs;

    private CycleResult(Builder b) {
        this.projectId = b.projectId;
        this.traceId = b.traceId;
        this.status = b.status;
        this.clientRootHash = b.clientRootHash;
        this.acknowledgedRootHash = b.acknowledgedRootHash;
        this.changeSet = b.changeSet == null ? ChangeSet.empty() : b.changeSet;
        this.accepted = Collections.unmodifiableList(new ArrayList<String>(b.accepted));
        this.rejected = Collections.unmodifiableList(new ArrayList<RejectedPath>(b.rejected));
        this.pending = Collections.unmodifiableList(new ArrayList<String>(b.pending));
        this.warnings = Collections.unmodifiableList(new ArrayList<String>(b.warnings));
        this.errorCode = b.errorCode;
        this.errorMessage = b.errorMessage;
        this.tookMs = b.tookMs;
    }

    public static Builder builder(String projectId, String traceId) {
        return new Builder(projectId, traceId);
    }

    public boolean isSuccess() {
        return (status == CycleStatus.UP_TO_DATE || status == CycleStatus.COMMITTED)
                && rejected.isEmpty() && pending.isEmpty();
    }

    public String getProjectId() {
        return projectId;
    }

    public String getTraceId() {
        return traceId;
    }

    public CycleStatus getStatus() {
        return status;
    }

    public String getClientRootHash() {
        return clientRootHash;
    }

    public String getAcknowledgedRootHash() {
        return acknowledgedRootHash;
    }

    public ChangeSet getChangeSet() {
        return changeSet;
    }

    public List<String> getAccepted() {
        return accepted;
    }

    public List<RejectedPath> getRejected() {
        return rejected;
    }

    public List<String> getPending() {
        return pending;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public SyncErrorCode getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public long getTookMs() {
        return tookMs;
    }

    @Override
    public String toString() {
        return "CycleResult{" + projectId + " " + status + " accepted=" + accepted.size() + " rejected=" + rejected.size()
                + " pending=" + pending.size() + (errorCode == null ? "" : " error=" + errorCode) + "}";
    }

    public static final class Builder {
        private final String projectId;
        private final String traceId;
        private CycleStatus status;
        private String clientRootHash;
        private String acknowledgedRootHash;
        private ChangeSet changeSet;
        private final List<String> accepted = new ArrayList<String>();
        private final List<RejectedPath> rejected = new ArrayList<RejectedPath>();
        private final List<String> pending = new ArrayList<String>();
        private final List<String> warnings = new ArrayList<String>();
        private SyncErrorCode errorCode;
        private String errorMessage;
        private long tookMs;

        private Builder(String projectId, String traceId) {
            this.projectId = projectId;
            this.traceId = traceId;
        }

        public Builder clientRootHash(String v) {
            this.clientRootHash = v;
            return this;
        }

        public Builder acknowledgedRootHash(String v) {
            this.acknowledgedRootHash = v;
            return this;
        }

        public Builder changeSet(ChangeSet v) {
            this.changeSet = v;
            return this;
        }

        public Builder accepted(List<String> v) {
            this.accepted.addAll(v);
            return this;
        }

        public Builder rejected(List<RejectedPath> v) {
            this.rejected.addAll(v);
            return this;
        }

        public Builder pending(List<String> v) {
            this.pending.addAll(v);
            return this;
        }

        public Builder warning(String v) {
            this.warnings.add(v);
            return this;
        }

        public Builder warnings(List<String> v) {
            this.warnings.addAll(v);
            return this;
        }

        public Builder error(SyncErrorCode code, String message) {
            this.errorCode = code;
            this.errorMessage = message;
            return this;
        }

        public CycleResult build(CycleStatus status, long tookMs) {
            this.status = status;
            this.tookMs = tookMs;
            return new CycleResult(this);
        }
    }
}
