package com.zzf.codesync.core.merkle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.codesync.core.util.Sha256;
import com.zzf.codesync.model.SyncErrorCode;
import com.zzf.codesync.model.SyncException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class TreeSnapshotCodecTest {

    private final TreeSnapshotCodec codec = new TreeSnapshotCodec(new ObjectMapper());

    @Test
    public void testEncodeDecodeKeepsHashes() {
        MerkleTree tree = TreeDifferTest.tree("a.txt", "a", "src/Main.java", "main", "src/util/S.java", "s");
        MerkleTree decoded = codec.decode(codec.encode(tree));
        assertEquals(tree.getRootHash(), decoded.getRootHash());
        assertEquals(tree.leafHashes(), decoded.leafHashes());
    }

    @Test
    public void testTamperedLeafHashRejected() {
        MerkleTree tree = TreeDifferTest.tree("a.txt", "a", "b.txt", "b");
        String json = codec.encode(tree).replace(Sha256.hex("a"), Sha256.hex("tampered"));

        SyncException e = assertThrows(SyncException.class, () -> codec.decode(json));
        assertEquals(SyncErrorCode.INVALID_SNAPSHOT, e.getErrorCode());
    }

    @Test
    public void testMalformedJsonRejected() {
        SyncException e = assertThrows(SyncException.class, () -> codec.decode("{not json"));
        assertEquals(SyncErrorCode.INVALID_SNAPSHOT, e.getErrorCode());
    }

    @Test
    public void testUnsortedChildrenRejected() {
        TreeNode a = TreeNode.file("a.txt", Sha256.hex("a"));
        TreeNode b = TreeNode.file("b.txt", Sha256.hex("b"));
        TreeNode root = new TreeNode("", NodeKind.DIRECTORY, MerkleTreeBuilder.directoryHash(Arrays.asList(b, a)), Arrays.asList(b, a));

        SyncException e = assertThrows(SyncException.class, () -> TreeSnapshotCodec.fromSnapshot(new TreeSnapshot(root.getHash(), root)));
        assertEquals(SyncErrorCode.INVALID_SNAPSHOT, e.getErrorCode());
    }

    @Test
    public void testRootHashMustMatchRootNode() {
        TreeNode a = TreeNode.file("a.txt", Sha256.hex("a"));
        TreeNode root = new TreeNode("", NodeKind.DIRECTORY, MerkleTreeBuilder.directoryHash(Collections.singletonList(a)), Collections.singletonList(a));

        assertThrows(SyncException.class, () -> TreeSnapshotCodec.fromSnapshot(new TreeSnapshot(Sha256.hex("other"), root)));
        assertThrows(SyncException.class, () -> TreeSnapshotCodec.fromSnapshot(null));
    }

    @Test
    public void testDotDotNameRejected() {
        TreeNode evil = TreeNode.file("..", Sha256.hex("x"));
        TreeNode root = new TreeNode("", NodeKind.DIRECTORY, MerkleTreeBuilder.directoryHash(Collections.singletonList(evil)), Collections.singletonList(evil));
        assertThrows(SyncException.class, () -> TreeSnapshotCodec.fromSnapshot(new TreeSnapshot(root.getHash(), root)));
    }
}
