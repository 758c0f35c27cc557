package com.zzf.codesync.core.merkle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.codesync.core.util.Sha256;
import com.zzf.codesync.model.SyncErrorCode;
import com.zzf.codesync.model.SyncException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts trees to and from {@link TreeSnapshot}. Decoding re-derives every directory
 * hash, so a snapshot whose hashes do not add up is refused instead of being trusted.
 */
public final class TreeSnapshotCodec {
    private final ObjectMapper mapper;

    public TreeSnapshotCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static TreeSnapshot toSnapshot(MerkleTree tree) {
        return new TreeSnapshot(tree.getRootHash(), tree.getRoot());
    }

    public static MerkleTree fromSnapshot(TreeSnapshot snapshot) {
        if (snapshot == null || snapshot.getRoot() == null) {
            throw invalid("snapshot has no root");
        }
        TreeNode root = snapshot.getRoot();
        if (!root.isDirectory()) {
            throw invalid("snapshot root is not a directory");
        }
        verify(root, "", true);
        if (snapshot.getRootHash() != null && !snapshot.getRootHash().equals(root.getHash())) {
            throw invalid("rootHash " + snapshot.getRootHash() + " does not match root node " + root.getHash());
        }
        return new MerkleTree(root);
    }

    public String encode(MerkleTree tree) {
        try {
            return mapper.writeValueAsString(toSnapshot(tree));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode tree", e);
        }
    }

    public MerkleTree decode(String json) {
        TreeSnapshot snapshot;
        try {
            snapshot = mapper.readValue(json, TreeSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new SyncException(SyncErrorCode.INVALID_SNAPSHOT, "malformed snapshot: " + e.getOriginalMessage(), e);
        }
        return fromSnapshot(snapshot);
    }

    private static void verify(TreeNode node, String path, boolean isRoot) {
        if (!isRoot && !MerkleTreeBuilder.isValidName(node.getName())) {
            throw invalid("invalid node name at " + path + ": '" + node.getName() + "'");
        }
        if (!Sha256.isDigest(node.getHash())) {
            throw invalid("invalid hash at " + (path.isEmpty() ? "<root>" : path));
        }
        if (node.isFile()) {
            if (!node.getChildren().isEmpty()) {
                throw invalid("file node has children at " + path);
            }
            return;
        }
        List<TreeNode> children = node.getChildren();
        if (children.isEmpty() && !isRoot) {
            throw invalid("empty directory at " + path);
        }
        Set<String> seen = new HashSet<String>();
        for (int i = 0; i < children.size(); i++) {
            TreeNode child = children.get(i);
            if (!seen.add(child.getName())) {
                throw invalid("duplicate child '" + child.getName() + "' at " + path);
            }
            if (i > 0 && children.get(i - 1).getName().compareTo(child.getName()) > 0) {
                throw invalid("children not sorted at " + (path.isEmpty() ? "<root>" : path));
            }
            verify(child, path.isEmpty() ? child.getName() : path + "/" + child.getName(), false);
        }
        String expected = MerkleTreeBuilder.directoryHash(children);
        if (!expected.equals(node.getHash())) {
            throw invalid("directory hash mismatch at " + (path.isEmpty() ? "<root>" : path));
        }
    }

    private static SyncException invalid(String message) {
        return new SyncException(SyncErrorCode.INVALID_SNAPSHOT, message);
    }
}
