package com.zzf.codesync.model;

public class TransientNetworkException extends SyncException {
    public TransientNetworkException(String message) {
        super(SyncErrorCode.TRANSIENT_NETWORK, message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(SyncErrorCode.TRANSIENT_NETWORK, message, cause);
    }
}
