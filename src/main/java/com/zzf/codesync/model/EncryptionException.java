package com.zzf.codesync.model;

/**
 * Raised when a vector cannot be sealed or opened. Always fatal for the cycle: nothing is
 * ever sent unencrypted in its place.
 */
public class EncryptionException extends SyncException {
    public EncryptionException(String message) {
        super(SyncErrorCode.ENCRYPTION, message);
    }

    public EncryptionException(String message, Throwable cause) {
        super(SyncErrorCode.ENCRYPTION, message, cause);
    }
}
