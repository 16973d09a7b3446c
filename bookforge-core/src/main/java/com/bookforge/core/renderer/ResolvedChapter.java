package com.bookforge.core.renderer;

import com.bookforge.core.book.Chapter;
import com.bookforge.core.numbering.ChapterDisplay;
import com.bookforge.core.token.Header;
import com.bookforge.core.token.Token;
import com.bookforge.core.token.Tokens;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A chapter together with its display state.
 *
 * <p>The chapter title is the first top-level level-1 heading. It is taken out of the
 * body because renderers emit it as the chapter header.
 *
 * @param index zero-based position in the book
 * @param chapter parsed chapter
 * @param display numbering resolution for this chapter
 */
public record ResolvedChapter(int index, Chapter chapter, ChapterDisplay display) {

    public ResolvedChapter {
        Objects.requireNonNull(chapter, "chapter must not be null");
        Objects.requireNonNull(display, "display must not be null");
    }

    /**
     * Returns the plain-text chapter title.
     *
     * @return title if the chapter has a level-1 heading
     */
    public Optional<String> title() {
        return Tokens.findTitle(chapter.content()).map(header -> Tokens.plainText(header.children()).trim());
    }

    /**
     * Returns whether a header is emitted for this chapter.
     *
     * @return true when the title is shown and exists
     */
    public boolean hasHeader() {
        return display.showTitle() && title().isPresent();
    }

    /**
     * Returns the chapter content without its title heading.
     *
     * @return body tokens
     */
    public List<Token> body() {
        Optional<Header> title = Tokens.findTitle(chapter.content());
        if (title.isEmpty()) {
            return chapter.content();
        }
        List<Token> body = new ArrayList<>(chapter.content());
        body.remove(title.get());
        return body;
    }

    /**
     * Returns the one-based number used in file names such as {@code chapter_001.xhtml}.
     *
     * @return index + 1
     */
    public int ordinal() {
        return index + 1;
    }
}
