package com.bookforge.core.renderer;

import com.bookforge.core.book.BookOptions;
import com.bookforge.core.book.BookMetadata;
import com.bookforge.core.book.ChapterNumber;
import com.bookforge.core.error.RenderException;
import com.bookforge.core.token.Header;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ResolvedChapterTest extends RendererTestBase {

    @Test
    void title_isPlainTextOfFirstLevelOneHeading() {
        RenderContext context = RenderContext.of(book("## Intro\n\n# The *Real* Title\n\nText\n"));

        ResolvedChapter chapter = context.chapters().get(0);

        assertThat(chapter.title()).hasValue("The Real Title");
        assertThat(chapter.body()).noneMatch(t -> t instanceof Header header && header.level() == 1);
        assertThat(chapter.body()).hasSize(2);
    }

    @Test
    void chapterWithoutTitle_hasNoHeaderButKeepsItsNumber() throws RenderException {
        RenderContext context = RenderContext.of(book("No heading here.\n", "# Second\n"));

        assertThat(context.chapters().get(0).hasHeader()).isFalse();
        assertThat(context.headerText(context.chapters().get(1), "html")).isEqualTo("2. Second");
    }

    @Test
    void headerText_usesNumberingTemplateAndDisplay() throws RenderException {
        BookOptions options = new BookOptions(true, "Chapter {{number}} - {{title}}", ' ', true, false, 2,
            null, null, null, null, null, null, null);
        RenderContext context = RenderContext.of(book(BookMetadata.defaults(), options, List.of(
            chapter(ChapterNumber.unnumbered(), "# Prologue\n"),
            chapter(ChapterNumber.specified(4), "# Four\n"))));

        assertThat(context.headerText(context.chapters().get(0), "html")).isEqualTo("Prologue");
        assertThat(context.headerText(context.chapters().get(1), "html")).isEqualTo("Chapter 4 - Four");
    }

    @Test
    void headerText_withNumberingDisabled_returnsTitleOnly() throws RenderException {
        RenderContext context = RenderContext.of(book(BookMetadata.defaults(),
            BookOptions.defaults().withNumbering(false), List.of(chapter(ChapterNumber.automatic(), "# Title\n"))));

        assertThat(context.headerText(context.chapters().get(0), "html")).isEqualTo("Title");
    }

    @Test
    void headerText_withBrokenTemplate_reportsFormatAndChapter() {
        BookOptions options = new BookOptions(true, "{{chapter}} {{title}}", ' ', true, false, 2,
            null, null, null, null, null, null, null);
        RenderContext context = RenderContext.of(book(BookMetadata.defaults(), options,
            List.of(chapter(ChapterNumber.automatic(), "# Title\n"))));

        assertThatThrownBy(() -> context.headerText(context.chapters().get(0), "tex"))
            .isInstanceOf(RenderException.class)
            .hasMessageStartingWith("[tex] chapter 1:");
    }
}
