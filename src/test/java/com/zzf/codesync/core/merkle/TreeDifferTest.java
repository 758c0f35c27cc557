package com.zzf.codesync.core.merkle;

import com.zzf.codesync.core.util.Sha256;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TreeDifferTest {

    private final TreeDiffer differ = new TreeDiffer();

    @Test
    public void testIdenticalTreesProduceEmptyChangeSet() {
        MerkleTree tree = tree("a.txt", "a", "src/Main.java", "main");
        assertTrue(differ.diff(tree, tree).isEmpty());
        assertTrue(differ.diff(tree, tree("src/Main.java", "main", "a.txt", "a")).isEmpty());
    }

    @Test
    public void testNoPreviousTreeMeansEverythingAdded() {
        ChangeSet changes = differ.diff(null, tree("a.txt", "a", "src/Main.java", "main"));
        assertEquals(Arrays.asList("a.txt", "src/Main.java"), list(changes.getAdded()));
        assertTrue(changes.getModified().isEmpty());
        assertTrue(changes.getRemoved().isEmpty());
    }

    @Test
    public void testAddedModifiedRemoved() {
        MerkleTree before = tree("keep.txt", "k", "edit.txt", "e1", "gone/old.txt", "o");
        MerkleTree after = tree("keep.txt", "k", "edit.txt", "e2", "new/file.txt", "n");

        ChangeSet changes = differ.diff(before, after);

        assertEquals(Collections.singletonList("new/file.txt"), list(changes.getAdded()));
        assertEquals(Collections.singletonList("edit.txt"), list(changes.getModified()));
        assertEquals(Collections.singletonList("gone/old.txt"), list(changes.getRemoved()));
        assertEquals(Arrays.asList("edit.txt", "new/file.txt"), list(changes.changedPaths()));
    }

    @Test
    public void testRenameIsRemoveAndAdd() {
        ChangeSet changes = differ.diff(tree("src/A.java", "same"), tree("src/B.java", "same"));
        assertEquals(Collections.singletonList("src/B.java"), list(changes.getAdded()));
        assertEquals(Collections.singletonList("src/A.java"), list(changes.getRemoved()));
        assertTrue(changes.getModified().isEmpty());
    }

    @Test
    public void testFileReplacedByDirectory() {
        ChangeSet changes = differ.diff(tree("docs", "file"), tree("docs/index.md", "idx", "docs/guide.md", "g"));
        assertEquals(Collections.singletonList("docs"), list(changes.getRemoved()));
        assertEquals(Arrays.asList("docs/guide.md", "docs/index.md"), list(changes.getAdded()));
    }

    @Test
    public void testAllRemoved() {
        ChangeSet changes = differ.diff(tree("a.txt", "a", "b/c.txt", "c"), MerkleTree.empty());
        assertEquals(Arrays.asList("a.txt", "b/c.txt"), list(changes.getRemoved()));
        assertEquals(2, changes.size());
    }

    static MerkleTree tree(String... pathsAndContents) {
        Map<String, String> leaves = new TreeMap<String, String>();
        for (int i = 0; i < pathsAndContents.length; i += 2) {
            leaves.put(pathsAndContents[i], Sha256.hex(pathsAndContents[i + 1]));
        }
        return MerkleTreeBuilder.fromLeaves(leaves);
    }

    private static java.util.List<String> list(java.util.Collection<String> in) {
        return new java.util.ArrayList<String>(in);
    }
}
