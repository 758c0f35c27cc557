package com.zzf.codesync.model;

public class EmbeddingProviderException extends SyncException {
    public EmbeddingProviderException(String message) {
        super(SyncErrorCode.EMBEDDING_PROVIDER, message);
    }

    public EmbeddingProviderException(String message, Throwable cause) {
        super(SyncErrorCode.EMBEDDING_PROVIDER, message, cause);
    }
}
