package com.zzf.codesync.core.merkle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A complete, immutable snapshot of a project tree. Instances are only created from a
 * fully assembled root, so a half-built tree can never be observed.
 * <p>
 * Nodes are additionally indexed by relative path ("" is the root, "src/Main.java" a
 * leaf) which stands in for parent pointers.
 */
public final class MerkleTree {
    private final TreeNode root;
    private final Map<String, TreeNode> byPath;
    private final SortedMap<String, String> leafHashes;

    public MerkleTree(TreeNode root) {
        if (root == null || !root.isDirectory()) {
            throw new IllegalArgumentException("root must be a directory node");
        }
        this.root = root;
        Map<String, TreeNode> index = new LinkedHashMap<String, TreeNode>();
        SortedMap<String, String> leaves = new TreeMap<String, String>();
        indexNode(root, "", index, leaves);
        this.byPath = Collections.unmodifiableMap(index);
        this.leafHashes = Collections.unmodifiableSortedMap(leaves);
    }

    public static MerkleTree empty() {
        return new MerkleTree(new TreeNode("", NodeKind.DIRECTORY, MerkleTreeBuilder.directoryHash(Collections.<TreeNode>emptyList()), null));
    }

    public String getRootHash() {
        return root.getHash();
    }

    public TreeNode getRoot() {
        return root;
    }

    public Optional<TreeNode> find(String path) {
        return Optional.ofNullable(byPath.get(path == null ? "" : path));
    }

    /**
     * Leaf path to content hash, sorted by path.
     */
    public SortedMap<String, String> leafHashes() {
        return leafHashes;
    }

    public int fileCount() {
        return leafHashes.size();
    }

    public boolean isEmpty() {
        return leafHashes.isEmpty();
    }

    /**
     * Directory paths from the root down to the parent of {@code path}, root first.
     * Empty when the path is not in the tree.
     */
    public List<String> ancestors(String path) {
        if (path == null || path.isEmpty() || !byPath.containsKey(path)) {
            return Collections.emptyList();
        }
        List<String> out = new ArrayList<String>();
        out.add("");
        String[] parts = path.split("/");
        StringBuilder prefix = new StringBuilder();
        TreeNode node = root;
        for (int i = 0; i < parts.length - 1; i++) {
            node = node.child(parts[i]);
            if (node == null) {
                return Collections.emptyList();
            }
            if (prefix.length() > 0) {
                prefix.append('/');
            }
            prefix.append(parts[i]);
            out.add(prefix.toString());
        }
        return out;
    }

    private static void indexNode(TreeNode node, String path, Map<String, TreeNode> index, SortedMap<String, String> leaves) {
        index.put(path, node);
        if (node.isFile()) {
            leaves.put(path, node.getHash());
            return;
        }
        for (TreeNode child : node.getChildren()) {
            indexNode(child, path.isEmpty() ? child.getName() : path + "/" + child.getName(), index, leaves);
        }
    }

    @Override
    public String toString() {
        return "MerkleTree(files=" + leafHashes.size() + ", root=" + getRootHash().substring(0, 8) + "...)";
    }
}
