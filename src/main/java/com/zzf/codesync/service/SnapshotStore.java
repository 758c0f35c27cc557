package com.zzf.codesync.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.codesync.config.SyncProperties;
import com.zzf.codesync.core.merkle.MerkleTree;
import com.zzf.codesync.core.merkle.TreeSnapshot;
import com.zzf.codesync.core.merkle.TreeSnapshotCodec;
import com.zzf.codesync.model.SyncErrorCode;
import com.zzf.codesync.model.SyncException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * JSON files under the storage directory:
 * {@code projects/<projectKey>.json} and {@code snapshots/<projectKey>/<rootHash>.json}.
 * Writes go to a temp file first and are moved into place, so a crash never leaves a
 * half-written snapshot behind.
 */
@Slf4j
@Service
public class SnapshotStore {

    private final Path storageDir;
    private final ObjectMapper objectMapper;
    private final ConcurrentHashMap<String, ReadWriteLock> locks = new ConcurrentHashMap<>();

    @Autowired
    public SnapshotStore(SyncProperties properties, ObjectMapper objectMapper) {
        this(Paths.get(properties.getServer().getStorageDir()), objectMapper);
    }

    public SnapshotStore(Path storageDir, ObjectMapper objectMapper) {
        this.storageDir = storageDir.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        try {
            Files.createDirectories(storageDir.resolve("projects"));
            Files.createDirectories(storageDir.resolve("snapshots"));
            log.info("storage.init dir={}", storageDir);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create storage directory " + storageDir, e);
        }
    }

    public Path getStorageDir() {
        return storageDir;
    }

    public void saveProject(ProjectRecord record) {
        write(List.of("projects", record.getProjectKey()), record);
    }

    public ProjectRecord loadProject(String projectKey) {
        return read(List.of("projects", projectKey), ProjectRecord.class);
    }

    public List<ProjectRecord> loadProjects() {
        List<ProjectRecord> out = new ArrayList<>();
        for (List<String> key : list(List.of("projects"))) {
            ProjectRecord r = read(key, ProjectRecord.class);
            if (r != null) {
                out.add(r);
            }
        }
        return out;
    }

    public void saveSnapshot(String projectKey, MerkleTree tree) {
        write(List.of("snapshots", projectKey, tree.getRootHash()), TreeSnapshotCodec.toSnapshot(tree));
    }

    /**
     * @return the verified tree, or null when no snapshot with that root hash exists
     * @throws SyncException {@code INVALID_SNAPSHOT} when the file is unreadable or fails verification
     */
    public MerkleTree loadSnapshot(String projectKey, String rootHash) {
        TreeSnapshot snapshot;
        try {
            snapshot = read(List.of("snapshots", projectKey, rootHash), TreeSnapshot.class);
        } catch (UncheckedIOException e) {
            throw new SyncException(SyncErrorCode.INVALID_SNAPSHOT, "snapshot unreadable projectKey=" + projectKey + " rootHash=" + rootHash, e);
        }
        if (snapshot == null) {
            return null;
        }
        MerkleTree tree = TreeSnapshotCodec.fromSnapshot(snapshot);
        if (!tree.getRootHash().equals(rootHash)) {
            throw new SyncException(SyncErrorCode.INVALID_SNAPSHOT, "snapshot file name does not match its root hash projectKey=" + projectKey);
        }
        return tree;
    }

    public void deleteSnapshot(String projectKey, String rootHash) {
        remove(List.of("snapshots", projectKey, rootHash));
    }

    private ReadWriteLock getLock(Path path) {
        return locks.computeIfAbsent(path.toString(), k -> new ReentrantReadWriteLock());
    }

    <T> T read(List<String> key, Class<T> clazz) {
        Path target = getTargetPath(key);
        ReadWriteLock lock = getLock(target);
        lock.readLock().lock();
        try {
            if (!Files.exists(target)) {
                return null;
            }
            return objectMapper.readValue(target.toFile(), clazz);
        } catch (IOException e) {
            log.error("storage.read failed path={}", target, e);
            throw new UncheckedIOException("cannot read " + target, e);
        } finally {
            lock.readLock().unlock();
        }
    }

    <T> void write(List<String> key, T content) {
        Path target = getTargetPath(key);
        ReadWriteLock lock = getLock(target);
        lock.writeLock().lock();
        try {
            Files.createDirectories(target.getParent());
            Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), content);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("storage.write failed path={}", target, e);
            throw new UncheckedIOException("cannot write " + target, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    void remove(List<String> key) {
        Path target = getTargetPath(key);
        ReadWriteLock lock = getLock(target);
        lock.writeLock().lock();
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot remove " + target, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    List<List<String>> list(List<String> prefix) {
        Path root = storageDir;
        for (String p : prefix) {
            root = root.resolve(p);
        }
        if (!Files.isDirectory(root)) {
            return new ArrayList<>();
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.toString().endsWith(".json"))
                    .map(p -> {
                        Path relative = storageDir.relativize(p);
                        List<String> key = new ArrayList<>();
                        for (int i = 0; i < relative.getNameCount(); i++) {
                            String name = relative.getName(i).toString();
                            if (i == relative.getNameCount() - 1) {
                                name = name.substring(0, name.length() - 5);
                            }
                            key.add(name);
                        }
                        return key;
                    })
                    .sorted((a, b) -> String.join("/", a).compareTo(String.join("/", b)))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list " + root, e);
        }
    }

    private Path getTargetPath(List<String> key) {
        Path path = storageDir;
        for (int i = 0; i < key.size(); i++) {
            String part = key.get(i);
            if (part.contains("/") || part.contains("\\") || part.equals("..")) {
                throw new IllegalArgumentException("invalid storage key segment: " + part);
            }
            if (i == key.size() - 1) {
                part += ".json";
            }
            path = path.resolve(part);
        }
        return path;
    }
}
