package com.bookforge.core.renderer;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One named entry of a packaged container.
 *
 * <p>Entries compare by content: two entries are equal when path, stored flag and bytes match.
 *
 * @param path entry path inside the container, using {@code /}
 * @param bytes entry content
 * @param stored true to store the entry uncompressed
 */
public record ContainerEntry(String path, byte[] bytes, boolean stored) {

    public ContainerEntry {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(bytes, "bytes must not be null");
        if (path.isBlank() || path.startsWith("/")) {
            throw new IllegalArgumentException("path must be relative: " + path);
        }
    }

    /**
     * Creates a compressed UTF-8 text entry.
     *
     * @param path entry path
     * @param text entry content
     * @return container entry
     */
    public static ContainerEntry text(String path, String text) {
        return new ContainerEntry(path, text.getBytes(StandardCharsets.UTF_8), false);
    }

    /**
     * Creates an uncompressed UTF-8 text entry.
     *
     * @param path entry path
     * @param text entry content
     * @return container entry
     */
    public static ContainerEntry storedText(String path, String text) {
        return new ContainerEntry(path, text.getBytes(StandardCharsets.UTF_8), true);
    }

    public String text() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ContainerEntry other)) {
            return false;
        }
        return stored == other.stored && path.equals(other.path) && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(path, stored) + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "ContainerEntry[path=" + path + ", bytes=" + bytes.length + ", stored=" + stored + "]";
    }
}
