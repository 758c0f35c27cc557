package com.zzf.codesync.core.merkle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable node of a {@link MerkleTree}. Children are kept sorted by name and nodes hold
 * no reference to their parent; containment questions are answered by walking from the
 * root.
 */
public final class TreeNode {
    private final String name;
    private final NodeKind kind;
    private final String hash;
    private final List<TreeNode> children;

    @JsonCreator
    public TreeNode(
            @JsonProperty("name") String name,
            @JsonProperty("kind") NodeKind kind,
            @JsonProperty("hash") String hash,
            @JsonProperty("children") List<TreeNode> children
    ) {
        this.name = name == null ? "" : name;
        this.kind = kind == null ? NodeKind.FILE : kind;
        this.hash = hash;
        this.children = children == null || children.isEmpty()
                ? Collections.<TreeNode>emptyList()
                : Collections.unmodifiableList(new ArrayList<TreeNode>(children));
    }

    public static TreeNode file(String name, String hash) {
        return new TreeNode(name, NodeKind.FILE, hash, null);
    }

    public String getName() {
        return name;
    }

    public NodeKind getKind() {
        return kind;
    }

    public String getHash() {
        return hash;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<TreeNode> getChildren() {
        return children;
    }

    @JsonIgnore
    public boolean isFile() {
        return kind == NodeKind.FILE;
    }

    @JsonIgnore
    public boolean isDirectory() {
        return kind == NodeKind.DIRECTORY;
    }

    public TreeNode child(String childName) {
        int lo = 0;
        int hi = children.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            int cmp = children.get(mid).name.compareTo(childName);
            if (cmp == 0) {
                return children.get(mid);
            }
            if (cmp < 0) {
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return kind + ":" + name + "@" + (hash == null ? "null" : hash.substring(0, Math.min(8, hash.length())));
    }
}
