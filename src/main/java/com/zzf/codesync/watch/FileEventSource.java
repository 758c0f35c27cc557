package com.zzf.codesync.watch;

import com.zzf.codesync.core.scan.IgnoreRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Recursive {@link WatchService} over a project root. Every relevant event, and every overflow,
 * calls {@code onChange}; callers debounce.
 */
public final class FileEventSource implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(FileEventSource.class);

    private final Path root;
    private final IgnoreRules ignoreRules;
    private final Runnable onChange;
    private final Map<WatchKey, Path> keys = new ConcurrentHashMap<WatchKey, Path>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private WatchService watchService;
    private Thread thread;

    public FileEventSource(Path root, IgnoreRules ignoreRules, Runnable onChange) {
        this.root = root.toAbsolutePath().normalize();
        this.ignoreRules = ignoreRules;
        this.onChange = onChange;
    }

    public void start() throws IOException {
        if (!Files.isDirectory(root)) {
            throw new NotDirectoryException(root.toString());
        }
        if (running.getAndSet(true)) {
            return;
        }
        watchService = FileSystems.getDefault().newWatchService();
        registerAll(root);
        thread = new Thread(this::runLoop, "codesync-watch-" + root.getFileName());
        thread.setDaemon(true);
        thread.start();
        logger.info("watch.events.start root={} dirs={}", root, keys.size());
    }

    @Override
    public void close() {
        if (!running.getAndSet(false)) {
            return;
        }
        try {
            watchService.close();
        } catch (IOException e) {
            logger.warn("watch.events.close root={} err={}", root, e.toString());
        }
        if (thread != null) {
            thread.interrupt();
        }
        logger.info("watch.events.stop root={}", root);
    }

    public int watchedDirectories() {
        return keys.size();
    }

    private void runLoop() {
        while (running.get()) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            Path dir = keys.get(key);
            boolean relevant = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW || dir == null) {
                    relevant = true;
                    continue;
                }
                Path child = dir.resolve((Path) event.context());
                boolean directory = Files.isDirectory(child);
                if (ignoreRules.isIgnored(relative(child), directory)) {
                    continue;
                }
                if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE && directory) {
                    try {
                        registerAll(child);
                    } catch (IOException e) {
                        logger.warn("watch.events.register_failed dir={} err={}", child, e.toString());
                    }
                }
                relevant = true;
            }
            if (!key.reset()) {
                keys.remove(key);
            }
            if (relevant) {
                onChange.run();
            }
        }
    }

    private void registerAll(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(root) && ignoreRules.isIgnored(relative(dir), true)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                WatchKey key = dir.register(watchService,
                        StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_DELETE,
                        StandardWatchEventKinds.ENTRY_MODIFY);
                keys.put(key, dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                logger.warn("watch.events.skip path={} err={}", file, exc.toString());
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private String relative(Path p) {
        return root.relativize(p).toString().replace('\\', '/');
    }
}
