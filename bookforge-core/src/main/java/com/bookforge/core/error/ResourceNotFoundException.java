package com.bookforge.core.error;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Thrown when a referenced chapter file or override resource does not exist.
 */
public class ResourceNotFoundException extends BookException {

    private final Path path;

    public ResourceNotFoundException(Path path) {
        super("File not found: " + path);
        this.path = Objects.requireNonNull(path, "path must not be null");
    }

    public ResourceNotFoundException(Path path, Throwable cause) {
        super("File not found: " + path, cause);
        this.path = Objects.requireNonNull(path, "path must not be null");
    }

    /**
     * Returns the missing file.
     *
     * @return path that could not be found
     */
    public Path getPath() {
        return path;
    }
}
