package com.bookforge.core.error;

import java.nio.file.Path;

/**
 * Thrown when a chapter file cannot be read as UTF-8 text.
 *
 * <p>Markup problems never raise this exception: malformed inline syntax degrades
 * to literal text. Only I/O and encoding level failures do.
 */
public class ParseException extends BookException {

    private final Path file;

    public ParseException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }

    /**
     * Returns the chapter file that failed to parse.
     *
     * @return offending file
     */
    public Path getFile() {
        return file;
    }
}
