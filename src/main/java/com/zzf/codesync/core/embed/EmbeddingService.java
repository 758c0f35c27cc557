package com.zzf.codesync.core.embed;

/**
 * Capability interface over an embedding provider. Implementations throw
 * {@link com.zzf.codesync.model.EmbeddingProviderException} when a vector cannot be
 * obtained; callers decide whether to retry.
 */
public interface EmbeddingService {
    float[] embed(String text);

    String providerName();
}
