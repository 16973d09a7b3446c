package com.bookforge.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        return getExtension(fileName.toString());
    }

    /**
     * Gets the extension of a file name or URL path.
     *
     * @param name file name
     * @return extension without dot, or empty string
     */
    public static String getExtension(String name) {
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        int lastDot = name.lastIndexOf('.');
        return lastDot > slash + 1 ? name.substring(lastDot + 1) : "";
    }

    /**
     * Guesses an image media type from its extension.
     *
     * @param name image file name
     * @return media type, {@code application/octet-stream} when unknown
     */
    public static String imageMediaType(String name) {
        return switch (getExtension(name).toLowerCase(Locale.ROOT)) {
            case "png" -> "image/png";
            case "jpg", "jpeg" -> "image/jpeg";
            case "gif" -> "image/gif";
            case "svg" -> "image/svg+xml";
            case "webp" -> "image/webp";
            default -> "application/octet-stream";
        };
    }

    /**
     * Deletes a directory and everything below it. Missing paths are ignored.
     *
     * @param root directory to delete
     * @throws IOException if a file cannot be deleted
     */
    public static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        }
    }
}
