package com.bookforge.core.error;

import java.util.OptionalInt;

/**
 * Thrown when a renderer cannot produce its artifact.
 *
 * <p>Covers template expansion failures, output that cannot be encoded as UTF-8,
 * resources missing during container assembly, unresolved footnote references and
 * failing external commands.
 */
public class RenderException extends BookException {

    private final String format;
    private final Integer chapter;

    public RenderException(String format, String message) {
        this(format, null, message, null);
    }

    public RenderException(String format, String message, Throwable cause) {
        this(format, null, message, cause);
    }

    public RenderException(String format, Integer chapter, String message, Throwable cause) {
        super(describe(format, chapter, message), cause);
        this.format = format;
        this.chapter = chapter;
    }

    private static String describe(String format, Integer chapter, String message) {
        StringBuilder sb = new StringBuilder();
        if (format != null) {
            sb.append('[').append(format).append("] ");
        }
        if (chapter != null) {
            sb.append("chapter ").append(chapter + 1).append(": ");
        }
        return sb.append(message).toString();
    }

    /**
     * Returns the identifier of the output format that failed.
     *
     * @return format id, or null when raised outside a renderer
     */
    public String getFormat() {
        return format;
    }

    /**
     * Returns the zero-based index of the chapter in error.
     *
     * @return chapter index if the failure is tied to one chapter
     */
    public OptionalInt getChapter() {
        return chapter == null ? OptionalInt.empty() : OptionalInt.of(chapter);
    }
}
