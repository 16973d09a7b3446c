package com.bookforge.core.book;

import com.bookforge.core.cleaner.Cleaner;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A fully parsed book, read-only for the duration of every render.
 *
 * <p>Built once by {@link BookLoader} (or directly in tests) and then shared by
 * reference between renderers, possibly on different threads.
 *
 * @param metadata descriptive metadata
 * @param options rendering options
 * @param baseDirectory absolute directory against which cover, images and overrides resolve
 * @param chapters chapters in declaration order
 */
public record Book(
    BookMetadata metadata,
    BookOptions options,
    Path baseDirectory,
    List<Chapter> chapters
) {
    /**
     * Compact constructor with validation.
     */
    public Book {
        Objects.requireNonNull(metadata, "metadata must not be null");
        Objects.requireNonNull(options, "options must not be null");
        baseDirectory = baseDirectory == null
            ? Path.of("").toAbsolutePath()
            : baseDirectory.toAbsolutePath().normalize();
        chapters = chapters == null ? List.of() : List.copyOf(chapters);
    }

    /**
     * Returns the cleaner matching this book's language and options.
     *
     * @return selected cleaner
     */
    public Cleaner cleaner() {
        return Cleaner.forLanguage(metadata.lang(), options.autoclean(), options.nbChar());
    }

    /**
     * Resolves a path from the configuration against the book directory.
     *
     * @param path relative or absolute path
     * @return absolute path
     */
    public Path resolve(String path) {
        return baseDirectory.resolve(path).normalize();
    }
}
