package com.zzf.codesync.core.crypto;

import com.zzf.codesync.model.EncryptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * AES keys by id. New records are always sealed with the active key; older keys stay
 * available for opening records written before a rotation.
 */
public final class KeyRing {
    private static final Logger logger = LoggerFactory.getLogger(KeyRing.class);

    private final String activeKeyId;
    private final Map<String, SecretKey> keys;

    public KeyRing(String activeKeyId, Map<String, SecretKey> keys) {
        if (activeKeyId == null || activeKeyId.trim().isEmpty()) {
            throw new IllegalArgumentException("activeKeyId is blank");
        }
        if (keys == null || !keys.containsKey(activeKeyId)) {
            throw new IllegalArgumentException("no key for active keyId=" + activeKeyId);
        }
        this.activeKeyId = activeKeyId;
        this.keys = Collections.unmodifiableMap(new LinkedHashMap<String, SecretKey>(keys));
    }

    /**
     * Decodes base64 AES keys (16, 24 or 32 bytes each).
     */
    public static KeyRing fromBase64(String activeKeyId, Map<String, String> encodedKeys) {
        Map<String, SecretKey> keys = new LinkedHashMap<String, SecretKey>();
        for (Map.Entry<String, String> e : encodedKeys.entrySet()) {
            byte[] raw;
            try {
                raw = Base64.getDecoder().decode(e.getValue().trim());
            } catch (IllegalArgumentException ex) {
                throw new EncryptionException("key " + e.getKey() + " is not valid base64", ex);
            }
            if (raw.length != 16 && raw.length != 24 && raw.length != 32) {
                throw new EncryptionException("key " + e.getKey() + " has invalid length " + raw.length);
            }
            keys.put(e.getKey(), new SecretKeySpec(raw, "AES"));
        }
        return new KeyRing(activeKeyId, keys);
    }

    public static KeyRing ephemeral(String keyId) {
        try {
            KeyGenerator generator = KeyGenerator.getInstance("AES");
            generator.init(256);
            Map<String, SecretKey> keys = new LinkedHashMap<String, SecretKey>();
            keys.put(keyId, generator.generateKey());
            logger.warn("crypto.keyring ephemeral keyId={} records will not be readable after restart", keyId);
            return new KeyRing(keyId, keys);
        } catch (NoSuchAlgorithmException e) {
            throw new EncryptionException("AES not available", e);
        }
    }

    public String getActiveKeyId() {
        return activeKeyId;
    }

    public SecretKey activeKey() {
        return keys.get(activeKeyId);
    }

    public SecretKey key(String keyId) {
        SecretKey key = keyId == null ? null : keys.get(keyId);
        if (key == null) {
            throw new EncryptionException("unknown keyId=" + keyId);
        }
        return key;
    }
}
