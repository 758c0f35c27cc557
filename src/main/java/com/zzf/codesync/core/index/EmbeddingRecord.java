package com.zzf.codesync.core.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Encrypted embedding of one chunk, keyed by the chunk's content hash. Holds neither the
 * chunk text nor the plain vector.
 */
public final class EmbeddingRecord {
    private final String chunkHash;
    private final byte[] encryptedVector;
    private final byte[] nonce;
    private final String keyId;

    @JsonCreator
    public EmbeddingRecord(
            @JsonProperty("chunkHash") String chunkHash,
            @JsonProperty("encryptedVector") byte[] encryptedVector,
            @JsonProperty("nonce") byte[] nonce,
            @JsonProperty("keyId") String keyId
    ) {
        this.chunkHash = chunkHash;
        this.encryptedVector = encryptedVector;
        this.nonce = nonce;
        this.keyId = keyId;
    }

    public String getChunkHash() {
        return chunkHash;
    }

    public byte[] getEncryptedVector() {
        return encryptedVector;
    }

    public byte[] getNonce() {
        return nonce;
    }

    public String getKeyId() {
        return keyId;
    }
}
