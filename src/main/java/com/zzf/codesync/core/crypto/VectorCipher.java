package com.zzf.codesync.core.crypto;

import com.zzf.codesync.core.index.EmbeddingRecord;
import com.zzf.codesync.model.EncryptionException;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

/**
 * Seals embedding vectors with AES-GCM. Every call draws a fresh 96-bit nonce and binds the
 * chunk hash as additional authenticated data, so a record cannot be replayed under a
 * different key.
 */
public class VectorCipher {
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int NONCE_BYTES = 12;
    private static final int TAG_BITS = 128;

    private final KeyRing keyRing;
    private final SecureRandom random;

    public VectorCipher(KeyRing keyRing) {
        this(keyRing, new SecureRandom());
    }

    public VectorCipher(KeyRing keyRing, SecureRandom random) {
        this.keyRing = keyRing;
        this.random = random;
    }

    public EmbeddingRecord seal(String chunkHash, float[] vector) {
        if (chunkHash == null || vector == null) {
            throw new EncryptionException("chunkHash and vector are required");
        }
        byte[] nonce = new byte[NONCE_BYTES];
        random.nextBytes(nonce);
        try {
            Cipher c = Cipher.getInstance(TRANSFORMATION);
            c.init(Cipher.ENCRYPT_MODE, keyRing.activeKey(), new GCMParameterSpec(TAG_BITS, nonce));
            c.updateAAD(chunkHash.getBytes(StandardCharsets.UTF_8));
            byte[] sealed = c.doFinal(toBytes(vector));
            return new EmbeddingRecord(chunkHash, sealed, nonce, keyRing.getActiveKeyId());
        } catch (GeneralSecurityException | RuntimeException e) {
            throw new EncryptionException("cannot seal vector chunkHash=" + chunkHash + ": " + e.getMessage(), e);
        }
    }

    public float[] open(EmbeddingRecord record) {
        if (record == null || record.getEncryptedVector() == null || record.getNonce() == null) {
            throw new EncryptionException("record is incomplete");
        }
        try {
            Cipher c = Cipher.getInstance(TRANSFORMATION);
            c.init(Cipher.DECRYPT_MODE, keyRing.key(record.getKeyId()), new GCMParameterSpec(TAG_BITS, record.getNonce()));
            c.updateAAD(record.getChunkHash().getBytes(StandardCharsets.UTF_8));
            return fromBytes(c.doFinal(record.getEncryptedVector()));
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("cannot open record chunkHash=" + record.getChunkHash() + ": " + e.getMessage(), e);
        }
    }

    static byte[] toBytes(float[] v) {
        ByteBuffer buf = ByteBuffer.allocate(v.length * 4);
        for (float f : v) {
            buf.putFloat(f);
        }
        return buf.array();
    }

    static float[] fromBytes(byte[] b) {
        if (b.length % 4 != 0) {
            throw new EncryptionException("plaintext length " + b.length + " is not a float array");
        }
        ByteBuffer buf = ByteBuffer.wrap(b);
        float[] v = new float[b.length / 4];
        for (int i = 0; i < v.length; i++) {
            v[i] = buf.getFloat();
        }
        return v;
    }
}
