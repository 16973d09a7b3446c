package com.bookforge.core.book;

import java.util.Optional;

/**
 * Descriptive metadata of a book.
 *
 * @param lang language tag (e.g. "en", "fr")
 * @param author author name
 * @param title book title
 * @param description optional description
 * @param subject optional subject
 * @param cover optional cover image path, relative to the book directory
 */
public record BookMetadata(
    String lang,
    String author,
    String title,
    String description,
    String subject,
    String cover
) {
    public static final String DEFAULT_LANG = "en";
    public static final String DEFAULT_AUTHOR = "Anonymous";
    public static final String DEFAULT_TITLE = "Untitled";

    /**
     * Compact constructor applying defaults.
     */
    public BookMetadata {
        if (lang == null || lang.isBlank()) {
            lang = DEFAULT_LANG;
        }
        if (author == null) {
            author = DEFAULT_AUTHOR;
        }
        if (title == null) {
            title = DEFAULT_TITLE;
        }
    }

    public static BookMetadata defaults() {
        return new BookMetadata(null, null, null, null, null, null);
    }

    public Optional<String> descriptionValue() {
        return Optional.ofNullable(description);
    }

    public Optional<String> subjectValue() {
        return Optional.ofNullable(subject);
    }

    public Optional<String> coverValue() {
        return Optional.ofNullable(cover);
    }
}
