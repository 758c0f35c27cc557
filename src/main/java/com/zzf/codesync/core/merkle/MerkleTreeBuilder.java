package com.zzf.codesync.core.merkle;

import com.zzf.codesync.core.scan.EnumerationResult;
import com.zzf.codesync.core.scan.FileEnumerator;
import com.zzf.codesync.core.scan.FileRecord;
import com.zzf.codesync.core.scan.IgnoreRules;
import com.zzf.codesync.core.util.Sha256;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Assembles {@link MerkleTree}s. Files are leaves carrying their content hash; a directory
 * hashes its children as (name, hash) pairs sorted by name, so the result never depends on
 * the order in which files were discovered.
 */
public final class MerkleTreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(MerkleTreeBuilder.class);

    private final FileEnumerator enumerator;

    public MerkleTreeBuilder() {
        this(null);
    }

    public MerkleTreeBuilder(FileEnumerator enumerator) {
        this.enumerator = enumerator;
    }

    /**
     * Enumerates {@code root} and builds its tree. Ignore rules come from the enumerator
     * given at construction, or from the project's ignore file when none was given.
     */
    public BuildResult build(Path root) {
        long t0 = System.nanoTime();
        FileEnumerator e = enumerator != null ? enumerator : new FileEnumerator(IgnoreRules.load(root));
        EnumerationResult enumeration = e.enumerate(root);
        MerkleTree tree = fromRecords(enumeration.getRecords());
        logger.info("tree.build ok root={} files={} rejects={} rootHash={} tookMs={}",
                enumeration.getRoot(), tree.fileCount(), enumeration.getRejects().size(), tree.getRootHash(), (System.nanoTime() - t0) / 1_000_000L);
        return new BuildResult(tree, enumeration.getRecords(), enumeration.getRejects());
    }

    public static MerkleTree fromRecords(Collection<FileRecord> records) {
        Map<String, String> leaves = new LinkedHashMap<String, String>();
        for (FileRecord r : records) {
            leaves.put(r.getPath(), r.getContentHash());
        }
        return fromLeaves(leaves);
    }

    /**
     * Builds a tree from relative file paths and their content hashes. Directories are
     * implied by the paths; a directory without files cannot be expressed and so never
     * appears.
     */
    public static MerkleTree fromLeaves(Map<String, String> leafHashes) {
        Dir root = new Dir();
        for (Map.Entry<String, String> entry : leafHashes.entrySet()) {
            String path = entry.getKey();
            String hash = entry.getValue();
            if (!Sha256.isDigest(hash)) {
                throw new IllegalArgumentException("invalid leaf hash for " + path + ": " + hash);
            }
            String[] parts = splitPath(path);
            Dir dir = root;
            for (int i = 0; i < parts.length - 1; i++) {
                Object existing = dir.entries.get(parts[i]);
                if (existing instanceof String) {
                    throw new IllegalArgumentException("path used as file and directory: " + parts[i] + " in " + path);
                }
                Dir next = (Dir) existing;
                if (next == null) {
                    next = new Dir();
                    dir.entries.put(parts[i], next);
                }
                dir = next;
            }
            String leafName = parts[parts.length - 1];
            if (dir.entries.get(leafName) instanceof Dir) {
                throw new IllegalArgumentException("path used as file and directory: " + path);
            }
            dir.entries.put(leafName, hash);
        }
        return new MerkleTree(freeze("", root));
    }

    public static String directoryHash(List<TreeNode> sortedChildren) {
        MessageDigest md = Sha256.newDigest();
        for (TreeNode child : sortedChildren) {
            md.update(child.getName().getBytes(StandardCharsets.UTF_8));
            md.update((byte) 0);
            md.update(child.getHash().getBytes(StandardCharsets.UTF_8));
            md.update((byte) '\n');
        }
        return Sha256.toHex(md.digest());
    }

    static String[] splitPath(String path) {
        if (path == null || path.isEmpty() || path.startsWith("/") || path.endsWith("/") || path.contains("\\")) {
            throw new IllegalArgumentException("invalid relative path: " + path);
        }
        String[] parts = path.split("/");
        for (String part : parts) {
            if (!isValidName(part)) {
                throw new IllegalArgumentException("invalid relative path: " + path);
            }
        }
        return parts;
    }

    static boolean isValidName(String name) {
        return name != null && !name.isEmpty() && !".".equals(name) && !"..".equals(name)
                && name.indexOf('/') < 0 && name.indexOf('\\') < 0 && name.indexOf('\0') < 0;
    }

    private static TreeNode freeze(String name, Dir dir) {
        List<TreeNode> children = new ArrayList<TreeNode>(dir.entries.size());
        for (Map.Entry<String, Object> entry : dir.entries.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof String) {
                children.add(TreeNode.file(entry.getKey(), (String) value));
            } else {
                children.add(freeze(entry.getKey(), (Dir) value));
            }
        }
        return new TreeNode(name, NodeKind.DIRECTORY, directoryHash(children), children);
    }

    private static final class Dir {
        // String = leaf hash, Dir = subdirectory; TreeMap keeps names sorted
        private final TreeMap<String, Object> entries = new TreeMap<String, Object>();
    }
}
