package com.github.stormino.hlsdl.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Utility class for file path operations.
 */
@Slf4j
@UtilityClass
public class PathUtils {

    /**
     * Expand a leading "~" to the user's home directory.
     *
     * @param path Path as configured
     * @return Absolute, normalized path
     */
    public static Path expandHome(String path) {
        if (path.equals("~")) {
            return Paths.get(System.getProperty("user.home"));
        }
        if (path.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home"), path.substring(2)).toAbsolutePath().normalize();
        }
        return Paths.get(path).toAbsolutePath().normalize();
    }

    /**
     * Create directory structure if it doesn't exist.
     *
     * @param path Directory path to create, may be null for the working directory
     * @return true if directory exists or was created successfully, false otherwise
     */
    public static boolean createDirectoryStructure(Path path) {
        if (path == null) {
            return true;
        }
        try {
            if (!Files.exists(path)) {
                Files.createDirectories(path);
                log.debug("Created directory structure: {}", path);
            }
            return true;
        } catch (IOException e) {
            log.error("Failed to create directory structure: {}", path, e);
            return false;
        }
    }

    /**
     * Ensure path ends with specific extension.
     *
     * @param filename Original filename
     * @param extension Desired extension (with or without leading dot)
     * @return Filename with correct extension
     */
    public static String ensureExtension(String filename, String extension) {
        String normalizedExt = extension.startsWith(".") ? extension : "." + extension;

        if (filename == null || filename.isBlank()) {
            return "unnamed" + normalizedExt;
        }

        if (filename.toLowerCase().endsWith(normalizedExt.toLowerCase())) {
            return filename;
        }

        return filename + normalizedExt;
    }

    /**
     * Size of a file, or 0 when it does not exist or cannot be read.
     */
    public static long sizeOrZero(Path file) {
        try {
            return Files.isRegularFile(file) ? Files.size(file) : 0L;
        } catch (IOException e) {
            log.debug("Could not read size of {}: {}", file, e.getMessage());
            return 0L;
        }
    }
}
