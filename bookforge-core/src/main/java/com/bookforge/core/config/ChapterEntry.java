package com.bookforge.core.config;

import com.bookforge.core.book.ChapterNumber;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A chapter declared in the configuration, before parsing.
 *
 * @param number numbering policy from the directive
 * @param file absolute path of the chapter file
 */
public record ChapterEntry(ChapterNumber number, Path file) {

    public ChapterEntry {
        Objects.requireNonNull(number, "number must not be null");
        Objects.requireNonNull(file, "file must not be null");
    }
}
