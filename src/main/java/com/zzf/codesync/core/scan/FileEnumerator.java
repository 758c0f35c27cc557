package com.zzf.codesync.core.scan;

import com.zzf.codesync.core.util.Sha256;
import com.zzf.codesync.model.EnumerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Walks a project root and produces one {@link FileRecord} per tracked regular file.
 * Symbolic links are not followed. Files that cannot be read land in the reject list
 * instead of failing the whole pass.
 */
public final class FileEnumerator {
    private static final Logger logger = LoggerFactory.getLogger(FileEnumerator.class);

    public static final long DEFAULT_MAX_FILE_BYTES = 5L * 1024L * 1024L;

    private final IgnoreRules ignoreRules;
    private final FileContentReader reader;
    private final long maxFileBytes;

    public FileEnumerator(IgnoreRules ignoreRules) {
        this(ignoreRules, FileContentReader.DEFAULT, DEFAULT_MAX_FILE_BYTES);
    }

    public FileEnumerator(IgnoreRules ignoreRules, FileContentReader reader, long maxFileBytes) {
        this.ignoreRules = ignoreRules == null ? IgnoreRules.defaults() : ignoreRules;
        this.reader = reader == null ? FileContentReader.DEFAULT : reader;
        this.maxFileBytes = maxFileBytes <= 0 ? DEFAULT_MAX_FILE_BYTES : maxFileBytes;
    }

    public EnumerationResult enumerate(Path root) {
        long t0 = System.nanoTime();
        if (root == null || !Files.exists(root)) {
            throw new EnumerationException("root does not exist: " + root);
        }
        if (!Files.isDirectory(root)) {
            throw new EnumerationException("root is not a directory: " + root);
        }
        if (!Files.isReadable(root)) {
            throw new EnumerationException("root is not readable: " + root);
        }
        Path base = root.toAbsolutePath().normalize();
        logger.info("enumerate.start root={}", base);
        List<FileRecord> records = new ArrayList<FileRecord>();
        List<RejectedFile> rejects = new ArrayList<RejectedFile>();
        try {
            Files.walkFileTree(base, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(base)) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (ignoreRules.isIgnored(relative(base, dir), true)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs == null || !attrs.isRegularFile()) {
                        return FileVisitResult.CONTINUE;
                    }
                    String rel = relative(base, file);
                    if (ignoreRules.isIgnored(rel, false)) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (attrs.size() > maxFileBytes) {
                        rejects.add(new RejectedFile(rel, "file_too_large size=" + attrs.size()));
                        return FileVisitResult.CONTINUE;
                    }
                    try {
                        byte[] content = reader.read(file);
                        records.add(new FileRecord(rel, Sha256.hex(content), content.length, attrs.lastModifiedTime().toMillis()));
                    } catch (IOException | RuntimeException e) {
                        logger.warn("enumerate.reject path={} err={}", rel, e.toString());
                        rejects.add(new RejectedFile(rel, "unreadable: " + e.getClass().getSimpleName()));
                    }
                    if (records.size() % 500 == 0 && !records.isEmpty()) {
                        logger.info("enumerate.progress root={} files={}", base, records.size());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                    if (file.equals(base)) {
                        throw exc;
                    }
                    String rel = relative(base, file);
                    if (!ignoreRules.isIgnored(rel, false)) {
                        logger.warn("enumerate.reject path={} err={}", rel, exc.toString());
                        rejects.add(new RejectedFile(rel, "unreadable: " + exc.getClass().getSimpleName()));
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            logger.warn("enumerate.fail root={} err={}", base, e.toString());
            throw new EnumerationException("cannot enumerate root: " + base, e);
        }
        records.sort(Comparator.comparing(FileRecord::getPath));
        rejects.sort(Comparator.comparing(RejectedFile::getPath));
        long tookMs = (System.nanoTime() - t0) / 1_000_000L;
        logger.info("enumerate.ok root={} files={} rejects={} tookMs={}", base, records.size(), rejects.size(), tookMs);
        return new EnumerationResult(base, records, rejects);
    }

    static String relative(Path base, Path p) {
        return base.relativize(p).toString().replace('\\', '/');
    }
}
