package com.zzf.codesync.core.merkle;

import com.zzf.codesync.core.util.Sha256;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MerkleTreeBuilderTest {

    @Test
    public void testRootHashIndependentOfInsertionOrder() {
        Map<String, String> forward = new LinkedHashMap<String, String>();
        forward.put("a.txt", Sha256.hex("a"));
        forward.put("src/Main.java", Sha256.hex("main"));
        forward.put("src/util/Strings.java", Sha256.hex("strings"));

        Map<String, String> reverse = new LinkedHashMap<String, String>();
        reverse.put("src/util/Strings.java", Sha256.hex("strings"));
        reverse.put("src/Main.java", Sha256.hex("main"));
        reverse.put("a.txt", Sha256.hex("a"));

        assertEquals(MerkleTreeBuilder.fromLeaves(forward).getRootHash(), MerkleTreeBuilder.fromLeaves(reverse).getRootHash());
    }

    @Test
    public void testLeafChangeOnlyTouchesAncestors() {
        Map<String, String> leaves = new TreeMap<String, String>();
        leaves.put("src/a/One.java", Sha256.hex("one"));
        leaves.put("src/b/Two.java", Sha256.hex("two"));
        MerkleTree before = MerkleTreeBuilder.fromLeaves(leaves);

        leaves.put("src/a/One.java", Sha256.hex("one v2"));
        MerkleTree after = MerkleTreeBuilder.fromLeaves(leaves);

        assertNotEquals(before.getRootHash(), after.getRootHash());
        assertNotEquals(hash(before, "src"), hash(after, "src"));
        assertNotEquals(hash(before, "src/a"), hash(after, "src/a"));
        assertEquals(hash(before, "src/b"), hash(after, "src/b"));
        assertEquals(hash(before, "src/b/Two.java"), hash(after, "src/b/Two.java"));
    }

    @Test
    public void testDirectoryHashFormula() {
        String leaf = Sha256.hex("x");
        MerkleTree tree = MerkleTreeBuilder.fromLeaves(java.util.Collections.singletonMap("x.txt", leaf));

        String expected = Sha256.hex("x.txt\0" + leaf + "\n");
        assertEquals(expected, tree.getRootHash());
    }

    @Test
    public void testEmptyTree() {
        MerkleTree empty = MerkleTree.empty();
        assertTrue(empty.isEmpty());
        assertEquals(Sha256.hex(new byte[0]), empty.getRootHash());
        assertEquals(empty.getRootHash(), MerkleTreeBuilder.fromLeaves(new TreeMap<String, String>()).getRootHash());
    }

    @Test
    public void testFileAndDirectoryConflictRejected() {
        Map<String, String> leaves = new LinkedHashMap<String, String>();
        leaves.put("src", Sha256.hex("file"));
        leaves.put("src/Main.java", Sha256.hex("main"));
        assertThrows(IllegalArgumentException.class, () -> MerkleTreeBuilder.fromLeaves(leaves));
    }

    @Test
    public void testInvalidPathsRejected() {
        assertThrows(IllegalArgumentException.class, () -> MerkleTreeBuilder.fromLeaves(java.util.Collections.singletonMap("../x", Sha256.hex("x"))));
        assertThrows(IllegalArgumentException.class, () -> MerkleTreeBuilder.fromLeaves(java.util.Collections.singletonMap("/abs", Sha256.hex("x"))));
        assertThrows(IllegalArgumentException.class, () -> MerkleTreeBuilder.fromLeaves(java.util.Collections.singletonMap("a.txt", "nothex")));
    }

    @Test
    public void testAncestorsRootFirst() {
        MerkleTree tree = MerkleTreeBuilder.fromLeaves(java.util.Collections.singletonMap("a/b/c.txt", Sha256.hex("c")));
        assertEquals(java.util.Arrays.asList("", "a", "a/b"), tree.ancestors("a/b/c.txt"));
        assertTrue(tree.ancestors("missing.txt").isEmpty());
    }

    @Test
    public void testBuildFromDisk(@TempDir Path dir) throws Exception {
        Files.createDirectories(dir.resolve("src"));
        Files.createDirectories(dir.resolve("target"));
        Files.write(dir.resolve("src/Main.java"), "class Main {}".getBytes(StandardCharsets.UTF_8));
        Files.write(dir.resolve("README.md"), "# readme".getBytes(StandardCharsets.UTF_8));
        Files.write(dir.resolve("target/Main.class"), new byte[]{1, 2, 3});

        BuildResult result = new MerkleTreeBuilder().build(dir);
        MerkleTree tree = result.getTree();

        assertEquals(2, tree.fileCount());
        assertEquals(Sha256.hex("class Main {}"), tree.leafHashes().get("src/Main.java"));
        assertFalse(tree.find("target").isPresent());
        assertTrue(result.getRejects().isEmpty());

        BuildResult again = new MerkleTreeBuilder().build(dir);
        assertEquals(tree.getRootHash(), again.getTree().getRootHash());
    }

    private static String hash(MerkleTree tree, String path) {
        return tree.find(path).orElseThrow(AssertionError::new).getHash();
    }
}
