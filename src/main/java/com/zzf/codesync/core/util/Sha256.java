package com.zzf.codesync.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.regex.Pattern;

public final class Sha256 {
    private static final Pattern HEX_DIGEST = Pattern.compile("^[0-9a-f]{64}$");

    private Sha256() {
    }

    public static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String hex(byte[] data) {
        return toHex(newDigest().digest(data == null ? new byte[0] : data));
    }

    public static String hex(String text) {
        return hex((text == null ? "" : text).getBytes(StandardCharsets.UTF_8));
    }

    public static boolean isDigest(String value) {
        return value != null && HEX_DIGEST.matcher(value).matches();
    }

    public static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            sb.append(Character.forDigit((v >>> 4) & 0xF, 16));
            sb.append(Character.forDigit(v & 0xF, 16));
        }
        return sb.toString();
    }
}
