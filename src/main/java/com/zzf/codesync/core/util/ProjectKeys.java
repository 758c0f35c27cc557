package com.zzf.codesync.core.util;

import java.util.Locale;

/**
 * Stable, filesystem-safe keys derived from a project identifier.
 */
public final class ProjectKeys {
    private ProjectKeys() {
    }

    public static String projectKey(String projectId) {
        String normalized = normalize(projectId);
        if (normalized.isEmpty()) {
            return "default";
        }
        return Sha256.hex(normalized).substring(0, 12);
    }

    /**
     * Trims, converts backslashes, strips trailing slashes and lower-cases, so that the same
     * project path typed on different platforms maps to one key.
     */
    public static String normalize(String projectId) {
        if (projectId == null) {
            return "";
        }
        String s = projectId.trim();
        if (s.isEmpty()) {
            return "";
        }
        s = s.replace('\\', '/');
        while (s.length() > 1 && s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        return s.toLowerCase(Locale.ROOT);
    }
}
