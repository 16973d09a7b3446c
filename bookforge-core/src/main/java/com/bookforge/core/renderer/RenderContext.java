package com.bookforge.core.renderer;

import com.bookforge.core.book.Book;
import com.bookforge.core.book.Chapter;
import com.bookforge.core.book.ChapterNumber;
import com.bookforge.core.error.RenderException;
import com.bookforge.core.numbering.ChapterDisplay;
import com.bookforge.core.numbering.HeaderFormatter;
import com.bookforge.core.numbering.NumberingResolver;
import com.bookforge.core.template.TemplateEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Context provided to renderers during execution.
 *
 * <p>Immutable and shared between renderers running on different threads.
 *
 * @param book parsed book
 * @param chapters chapters with their numbering resolved
 * @param templates template engine
 */
public record RenderContext(
    Book book,
    List<ResolvedChapter> chapters,
    TemplateEngine templates
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(book, "book must not be null");
        Objects.requireNonNull(templates, "templates must not be null");
        chapters = chapters == null ? List.of() : List.copyOf(chapters);
    }

    /**
     * Resolves numbering once for a book.
     *
     * @param book parsed book
     * @return render context
     */
    public static RenderContext of(Book book) {
        List<ChapterNumber> numbers = book.chapters().stream().map(Chapter::number).toList();
        List<ChapterDisplay> displays = NumberingResolver.resolve(numbers, book.options().numbering());
        List<ResolvedChapter> resolved = new ArrayList<>(displays.size());
        for (int i = 0; i < displays.size(); i++) {
            resolved.add(new ResolvedChapter(i, book.chapters().get(i), displays.get(i)));
        }
        return new RenderContext(book, resolved, new TemplateEngine());
    }

    /**
     * Returns a formatter for the configured numbering template.
     *
     * @return header formatter
     */
    public HeaderFormatter headerFormatter() {
        return new HeaderFormatter(templates, book.options().numberingTemplate());
    }

    /**
     * Computes the header text of a chapter, unescaped.
     *
     * @param chapter resolved chapter with a header
     * @param format format id for error messages
     * @return header text
     * @throws RenderException if the numbering template cannot be expanded
     */
    public String headerText(ResolvedChapter chapter, String format) throws RenderException {
        String title = chapter.title().orElse("");
        try {
            return headerFormatter().format(chapter.display(), title);
        } catch (RenderException e) {
            throw new RenderException(format, chapter.index(), e.getMessage(), e);
        }
    }
}
