package com.zzf.codesync.core.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides which paths of a project never enter the tree.
 * <p>
 * Built-in names are matched against every path segment. Patterns from
 * {@value #IGNORE_FILE} follow a small glob dialect: a pattern without a slash matches a
 * file or directory name anywhere, a pattern with a slash matches the path relative to the
 * project root, and a trailing slash restricts the pattern to directories.
 */
public final class IgnoreRules {
    private static final Logger logger = LoggerFactory.getLogger(IgnoreRules.class);

    public static final String IGNORE_FILE = ".codesyncignore";

    private static final Set<String> DEFAULT_NAMES = Collections.unmodifiableSet(new LinkedHashSet<String>(Arrays.asList(
            ".git", ".gitignore", ".env", ".DS_Store", ".idea", ".gradle", ".codesync",
            "node_modules", "build", "out", "target", "dist", ".vs"
    )));

    private final Set<String> names;
    private final List<Rule> rules;

    private IgnoreRules(Set<String> names, List<Rule> rules) {
        this.names = names;
        this.rules = rules;
    }

    public static IgnoreRules defaults() {
        return new IgnoreRules(lowerCase(DEFAULT_NAMES), Collections.<Rule>emptyList());
    }

    public static IgnoreRules of(List<String> patterns) {
        List<Rule> rules = new ArrayList<Rule>();
        if (patterns != null) {
            for (String p : patterns) {
                Rule rule = Rule.parse(p);
                if (rule != null) {
                    rules.add(rule);
                }
            }
        }
        return new IgnoreRules(lowerCase(DEFAULT_NAMES), Collections.unmodifiableList(rules));
    }

    public static IgnoreRules load(Path projectRoot) {
        Path file = projectRoot == null ? null : projectRoot.resolve(IGNORE_FILE);
        if (file == null || !Files.isRegularFile(file)) {
            return defaults();
        }
        try {
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            IgnoreRules rules = of(lines);
            logger.info("ignore.load ok file={} rules={}", file, rules.rules.size());
            return rules;
        } catch (IOException e) {
            logger.warn("ignore.load fail file={} err={} fallback=defaults", file, e.toString());
            return defaults();
        }
    }

    /**
     * True when the path itself or any of its parent directories is ignored.
     */
    public boolean isIgnored(String relativePath, boolean directory) {
        if (relativePath == null || relativePath.isEmpty()) {
            return false;
        }
        String[] segments = relativePath.replace('\\', '/').split("/");
        StringBuilder prefix = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            String segment = segments[i];
            if (segment.isEmpty()) {
                continue;
            }
            if (prefix.length() > 0) {
                prefix.append('/');
            }
            prefix.append(segment);
            boolean isDir = i < segments.length - 1 || directory;
            if (names.contains(segment.toLowerCase(Locale.ROOT))) {
                return true;
            }
            for (Rule rule : rules) {
                if (rule.matches(prefix.toString(), segment, isDir)) {
                    return true;
                }
            }
        }
        return false;
    }

    public int size() {
        return names.size() + rules.size();
    }

    private static Set<String> lowerCase(Set<String> in) {
        Set<String> out = new LinkedHashSet<String>();
        for (String s : in) {
            out.add(s.toLowerCase(Locale.ROOT));
        }
        return Collections.unmodifiableSet(out);
    }

    private static final class Rule {
        private final PathMatcher matcher;
        private final boolean anchored;
        private final boolean directoryOnly;

        private Rule(PathMatcher matcher, boolean anchored, boolean directoryOnly) {
            this.matcher = matcher;
            this.anchored = anchored;
            this.directoryOnly = directoryOnly;
        }

        private static Rule parse(String line) {
            if (line == null) {
                return null;
            }
            String p = line.trim();
            if (p.isEmpty() || p.startsWith("#")) {
                return null;
            }
            boolean directoryOnly = p.endsWith("/");
            while (p.endsWith("/")) {
                p = p.substring(0, p.length() - 1);
            }
            while (p.startsWith("/")) {
                p = p.substring(1);
            }
            if (p.isEmpty()) {
                return null;
            }
            boolean anchored = p.indexOf('/') >= 0;
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + p);
            return new Rule(matcher, anchored, directoryOnly);
        }

        private boolean matches(String relativePath, String name, boolean directory) {
            if (directoryOnly && !directory) {
                return false;
            }
            Path candidate = anchored ? Paths.get(relativePath) : Paths.get(name);
            return matcher.matches(candidate);
        }
    }
}
