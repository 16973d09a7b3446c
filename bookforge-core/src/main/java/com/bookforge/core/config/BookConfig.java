package com.bookforge.core.config;

import com.bookforge.core.book.BookMetadata;
import com.bookforge.core.book.BookOptions;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of loading a book configuration file.
 *
 * <p>All paths are absolute: relative paths in the file are resolved against
 * {@code baseDirectory}, the directory containing the configuration file.
 *
 * <p><b>Example {@code .book} file:</b>
 * <pre>{@code
 * author: Jane Doe
 * title: A Short Book
 * lang: fr
 * output_epub: book.epub
 * output_html: book.html
 *
 * ! preface.md
 * + chapter_01.md
 * 5. chapter_05.md
 * - epilogue.md
 * }</pre>
 *
 * @param metadata book metadata
 * @param options rendering options
 * @param outputs output path per requested format
 * @param chapters chapters in declaration order
 * @param baseDirectory directory of the configuration file
 */
public record BookConfig(
    BookMetadata metadata,
    BookOptions options,
    Map<OutputFormat, Path> outputs,
    List<ChapterEntry> chapters,
    Path baseDirectory
) {
    /**
     * Compact constructor with validation.
     */
    public BookConfig {
        Objects.requireNonNull(metadata, "metadata must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(baseDirectory, "baseDirectory must not be null");
        outputs = outputs == null || outputs.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(outputs));
        chapters = chapters == null ? List.of() : List.copyOf(chapters);
    }

    /**
     * Returns whether at least one output format was configured.
     *
     * @return true if any output path is set
     */
    public boolean hasOutputs() {
        return !outputs.isEmpty();
    }
}
