package com.catalog.indexer.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File writes that create missing parent directories first.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes UTF-8 content to a file, replacing it if present.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        createParentDirectories(filePath);
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    public static void createParentDirectories(Path filePath) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
    }
}
