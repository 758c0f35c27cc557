package com.zzf.codesync.core.merkle;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes the {@link ChangeSet} between two snapshots of the same project.
 * <p>
 * Nodes at the same path with equal hashes are assumed identical and their subtrees are
 * never visited, so the cost follows the number of changed subtrees rather than the
 * number of files.
 */
public final class TreeDiffer {

    /**
     * @param previous last acknowledged snapshot, or {@code null} when there is none
     * @param current  freshly built snapshot
     */
    public ChangeSet diff(MerkleTree previous, MerkleTree current) {
        if (current == null) {
            throw new IllegalArgumentException("current tree is required");
        }
        Set<String> added = new TreeSet<String>();
        Set<String> modified = new TreeSet<String>();
        Set<String> removed = new TreeSet<String>();
        TreeNode prevRoot = previous == null ? null : previous.getRoot();
        compare(prevRoot, current.getRoot(), "", added, modified, removed);
        return new ChangeSet(added, modified, removed);
    }

    private void compare(TreeNode prev, TreeNode cur, String path,
                         Set<String> added, Set<String> modified, Set<String> removed) {
        if (prev == null && cur == null) {
            return;
        }
        if (prev == null) {
            collectLeaves(cur, path, added);
            return;
        }
        if (cur == null) {
            collectLeaves(prev, path, removed);
            return;
        }
        if (prev.getKind() != cur.getKind()) {
            collectLeaves(prev, path, removed);
            collectLeaves(cur, path, added);
            return;
        }
        if (prev.getHash().equals(cur.getHash())) {
            return;
        }
        if (cur.isFile()) {
            modified.add(path);
            return;
        }
        List<TreeNode> a = prev.getChildren();
        List<TreeNode> b = cur.getChildren();
        int i = 0;
        int j = 0;
        while (i < a.size() || j < b.size()) {
            TreeNode left = i < a.size() ? a.get(i) : null;
            TreeNode right = j < b.size() ? b.get(j) : null;
            int cmp;
            if (left == null) {
                cmp = 1;
            } else if (right == null) {
                cmp = -1;
            } else {
                cmp = left.getName().compareTo(right.getName());
            }
            if (cmp == 0) {
                compare(left, right, join(path, left.getName()), added, modified, removed);
                i++;
                j++;
            } else if (cmp < 0) {
                compare(left, null, join(path, left.getName()), added, modified, removed);
                i++;
            } else {
                compare(null, right, join(path, right.getName()), added, modified, removed);
                j++;
            }
        }
    }

    private static void collectLeaves(TreeNode node, String path, Set<String> out) {
        if (node.isFile()) {
            out.add(path);
            return;
        }
        for (TreeNode child : node.getChildren()) {
            collectLeaves(child, join(path, child.getName()), out);
        }
    }

    private static String join(String parent, String name) {
        return parent.isEmpty() ? name : parent + "/" + name;
    }
}
