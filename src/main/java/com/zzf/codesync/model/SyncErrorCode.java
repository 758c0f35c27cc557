package com.zzf.codesync.model;

public enum SyncErrorCode {
    ENUMERATION(false),
    HASH_MISMATCH(true),
    TRANSIENT_NETWORK(true),
    ENCRYPTION(false),
    CHUNK_TOO_LARGE(false),
    EMBEDDING_PROVIDER(true),
    NOT_IN_CHANGE_SET(true),
    UNKNOWN_SESSION(true),
    INVALID_SNAPSHOT(false),
    INVALID_REQUEST(false),
    INTERNAL(false);

    private final boolean retryable;

    SyncErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static SyncErrorCode parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            return INTERNAL;
        }
        try {
            return SyncErrorCode.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return INTERNAL;
        }
    }
}
