package com.zzf.codesync.core.merkle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Serialized form of a {@link MerkleTree}, used on the wire and on disk.
 */
public final class TreeSnapshot {
    private final String rootHash;
    private final TreeNode root;

    @JsonCreator
    public TreeSnapshot(@JsonProperty("rootHash") String rootHash, @JsonProperty("root") TreeNode root) {
        this.rootHash = rootHash;
        this.root = root;
    }

    public String getRootHash() {
        return rootHash;
    }

    public TreeNode getRoot() {
        return root;
    }
}
