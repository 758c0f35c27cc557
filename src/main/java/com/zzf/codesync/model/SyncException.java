package com.zzf.codesync.model;

/**
 * Base of every failure the sync engine reports. The error code decides whether the
 * failure is isolated to one path or aborts the cycle, and how it is rendered over HTTP.
 */
public class SyncException extends RuntimeException {
    private final SyncErrorCode errorCode;

    public SyncException(SyncErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SyncException(SyncErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public SyncErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
