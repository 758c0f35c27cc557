package com.zzf.codesync.model;

public class EnumerationException extends SyncException {
    public EnumerationException(String message) {
        super(SyncErrorCode.ENUMERATION, message);
    }

    public EnumerationException(String message, Throwable cause) {
        super(SyncErrorCode.ENUMERATION, message, cause);
    }
}
