package com.zzf.codesync.core.embed;

import com.zzf.codesync.core.util.Sha256;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Offline provider: hashes identifier tokens of the chunk into signed buckets, so chunks sharing
 * names land close together. Text without any token falls back to a digest of the whole text.
 */
public final class Sha256EmbeddingService implements EmbeddingService {
    private final int dimension;

    public Sha256EmbeddingService(int dimension) {
        this.dimension = Math.max(1, dimension);
    }

    @Override
    public float[] embed(String text) {
        String source = text == null ? "" : text;
        float[] vector = new float[dimension];
        MessageDigest digest = Sha256.newDigest();
        List<String> tokens = tokens(source);
        for (String token : tokens) {
            byte[] h = digest.digest(token.getBytes(StandardCharsets.UTF_8));
            int bucket = (((h[0] & 0xFF) << 24) | ((h[1] & 0xFF) << 16) | ((h[2] & 0xFF) << 8) | (h[3] & 0xFF)) & Integer.MAX_VALUE;
            vector[bucket % dimension] += (h[4] & 1) == 0 ? 1.0f : -1.0f;
        }
        if (tokens.isEmpty()) {
            byte[] h = digest.digest(source.getBytes(StandardCharsets.UTF_8));
            for (int i = 0; i < dimension; i++) {
                vector[i] = (h[i % h.length] & 0xFF) / 127.5f - 1.0f;
            }
        }
        return normalize(vector);
    }

    @Override
    public String providerName() {
        return "sha256";
    }

    /**
     * Lower-cased identifier parts; camelCase and snake_case names are split into their words
     * and also kept whole.
     */
    static List<String> tokens(String text) {
        List<String> out = new ArrayList<String>();
        int i = 0;
        while (i < text.length()) {
            if (!Character.isLetterOrDigit(text.charAt(i))) {
                i++;
                continue;
            }
            int start = i;
            while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                i++;
            }
            String word = text.substring(start, i);
            List<String> parts = splitIdentifier(word);
            for (String part : parts) {
                out.add(part.toLowerCase(Locale.ROOT));
            }
            if (parts.size() > 1) {
                out.add(word.toLowerCase(Locale.ROOT));
            }
        }
        return out;
    }

    private static List<String> splitIdentifier(String word) {
        List<String> parts = new ArrayList<String>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (c == '_') {
                flush(parts, current);
                continue;
            }
            boolean boundary = Character.isUpperCase(c) && current.length() > 0
                    && (Character.isLowerCase(current.charAt(current.length() - 1))
                    || (i + 1 < word.length() && Character.isLowerCase(word.charAt(i + 1))));
            if (boundary) {
                flush(parts, current);
            }
            current.append(c);
        }
        flush(parts, current);
        return parts;
    }

    private static void flush(List<String> parts, StringBuilder current) {
        if (current.length() > 0) {
            parts.add(current.toString());
            current.setLength(0);
        }
    }

    private static float[] normalize(float[] v) {
        double sum = 0.0;
        for (float x : v) {
            sum += (double) x * x;
        }
        if (sum == 0.0) {
            return v;
        }
        double norm = Math.sqrt(sum);
        for (int i = 0; i < v.length; i++) {
            v[i] = (float) (v[i] / norm);
        }
        return v;
    }
}
