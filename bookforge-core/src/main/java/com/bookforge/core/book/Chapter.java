package com.bookforge.core.book;

import com.bookforge.core.token.Token;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A parsed chapter: its numbering policy, its tokens and the file it came from.
 *
 * @param number numbering policy
 * @param content top-level tokens in source order
 * @param source chapter file, null for chapters built in memory
 */
public record Chapter(ChapterNumber number, List<Token> content, Path source) {

    public Chapter {
        Objects.requireNonNull(number, "number must not be null");
        content = content == null ? List.of() : List.copyOf(content);
    }

    public Chapter(ChapterNumber number, List<Token> content) {
        this(number, content, null);
    }
}
