package com.zzf.codesync.core.scan;

import com.zzf.codesync.core.util.Sha256;
import com.zzf.codesync.model.EnumerationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FileEnumeratorTest {

    @Test
    public void testRecordsSortedWithHashes(@TempDir Path dir) throws Exception {
        write(dir, "b.txt", "bee");
        write(dir, "a/z.txt", "zed");
        write(dir, "node_modules/lib.js", "ignored");

        EnumerationResult result = new FileEnumerator(IgnoreRules.defaults()).enumerate(dir);

        assertEquals(2, result.getRecords().size());
        assertEquals("a/z.txt", result.getRecords().get(0).getPath());
        assertEquals("b.txt", result.getRecords().get(1).getPath());
        assertEquals(Sha256.hex("bee"), result.getRecords().get(1).getContentHash());
        assertEquals(3L, result.getRecords().get(1).getSize());
        assertTrue(result.getRejects().isEmpty());
    }

    @Test
    public void testUnreadableAndOversizedFilesRejected(@TempDir Path dir) throws Exception {
        write(dir, "ok.txt", "fine");
        write(dir, "locked.txt", "secret");
        write(dir, "big.bin", "0123456789abcdef");

        FileContentReader reader = file -> {
            if (file.getFileName().toString().equals("locked.txt")) {
                throw new IOException("permission denied");
            }
            return Files.readAllBytes(file);
        };
        EnumerationResult result = new FileEnumerator(IgnoreRules.defaults(), reader, 10).enumerate(dir);

        assertEquals(1, result.getRecords().size());
        assertEquals("ok.txt", result.getRecords().get(0).getPath());
        assertEquals(2, result.getRejects().size());
        assertEquals("big.bin", result.getRejects().get(0).getPath());
        assertTrue(result.getRejects().get(0).getReason().startsWith("file_too_large"));
        assertEquals("locked.txt", result.getRejects().get(1).getPath());
        assertTrue(result.getRejects().get(1).getReason().startsWith("unreadable"));
    }

    @Test
    public void testMissingRootFails(@TempDir Path dir) throws Exception {
        FileEnumerator enumerator = new FileEnumerator(IgnoreRules.defaults());
        assertThrows(EnumerationException.class, () -> enumerator.enumerate(dir.resolve("nope")));
        Path file = write(dir, "file.txt", "x");
        assertThrows(EnumerationException.class, () -> enumerator.enumerate(file));
    }

    private static Path write(Path root, String rel, String content) throws IOException {
        Path p = root.resolve(rel);
        Files.createDirectories(p.getParent());
        return Files.write(p, content.getBytes(StandardCharsets.UTF_8));
    }
}
