package com.zzf.codesync.core.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@FunctionalInterface
public interface FileContentReader {
    FileContentReader DEFAULT = Files::readAllBytes;

    byte[] read(Path file) throws IOException;
}
