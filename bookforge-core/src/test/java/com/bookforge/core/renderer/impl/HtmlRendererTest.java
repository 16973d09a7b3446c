package com.bookforge.core.renderer.impl;

import com.bookforge.core.book.BookMetadata;
import com.bookforge.core.book.BookOptions;
import com.bookforge.core.book.ChapterNumber;
import com.bookforge.core.error.RenderException;
import com.bookforge.core.error.ResourceNotFoundException;
import com.bookforge.core.renderer.RendererTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Functional tests for {@link HtmlRenderer}.
 */
class HtmlRendererTest extends RendererTestBase {

    private final HtmlRenderer renderer = new HtmlRenderer();

    @Test
    void render_withPlainParagraph_wrapsItInParagraphElement() throws Exception {
        // When
        String html = renderText(renderer, book("Hello, world.\n"));

        // Then
        assertThat(html).contains("<p>Hello, world.</p>");
        assertThat(html).startsWith("<!DOCTYPE html>");
    }

    @Test
    void render_escapesMetadataInTemplate() throws Exception {
        BookMetadata metadata = new BookMetadata("en", "Tom & Jerry", "<Cats & \"Mice\">", null, null, null);

        String html = renderText(renderer, book(metadata, BookOptions.defaults(), List.of()));

        assertThat(html).contains("<title>&lt;Cats &amp; &quot;Mice&quot;&gt;</title>");
        assertThat(html).contains("Tom &amp; Jerry");
        assertThat(html).doesNotContain("<Cats");
    }

    @Test
    void render_numbersHeadersAndBuildsTableOfContents() throws Exception {
        String html = renderText(renderer, book(BookMetadata.defaults(), BookOptions.defaults(), List.of(
            chapter(ChapterNumber.unnumbered(), "# Preface\n\nWhy.\n"),
            chapter(ChapterNumber.automatic(), "# Start\n\nGo.\n"),
            chapter(ChapterNumber.hidden(), "# Secret\n\nHidden title.\n"))));

        assertThat(html).contains("<h1>Preface</h1>");
        assertThat(html).contains("<h1>1. Start</h1>");
        assertThat(html).doesNotContain("Secret");
        assertThat(html).contains("<p>Hidden title.</p>");
        assertThat(html).contains("<a href=\"#chapter-2\">1. Start</a>");
    }

    @Test
    void render_escapesHeaderText() throws Exception {
        String html = renderText(renderer, book("# Fish & <Chips>\n"));

        assertThat(html).contains("<h1>1. Fish &amp; &lt;Chips&gt;</h1>");
    }

    @Test
    void render_writesFootnotesAfterChapter() throws Exception {
        String html = renderText(renderer, book("# One\n\nText[^n].\n\n[^n]: The note.\n"));

        assertThat(html).contains("<a class=\"footnote-ref\" id=\"c1-fnref1\" href=\"#c1-fn1\"><sup>1</sup></a>");
        assertThat(html).contains("<div class=\"footnote\" id=\"c1-fn1\">");
        assertThat(html).contains("The note.");
        assertThat(html.indexOf("Text")).isLessThan(html.indexOf("class=\"footnotes\""));
    }

    @Test
    void render_embedsLocalImagesAsDataUri() throws Exception {
        writePng("img/dot.png", 2, 2);

        String html = renderText(renderer, book("![A dot](img/dot.png)\n"));

        assertThat(html).contains("<img src=\"data:image/png;base64,");
        assertThat(html).contains("alt=\"A dot\"");
    }

    @Test
    void render_keepsRemoteImageUrls() throws Exception {
        String html = renderText(renderer, book("![Logo](https://example.org/logo.png)\n"));

        assertThat(html).contains("<img src=\"https://example.org/logo.png\"");
    }

    @Test
    void render_withMissingImage_failsWithResourceCause() {
        assertThatThrownBy(() -> renderText(renderer, book("![Gone](img/missing.png)\n")))
            .isInstanceOf(RenderException.class)
            .hasMessageStartingWith("[html]")
            .hasCauseInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void render_withCssOverride_usesIt() throws Exception {
        writeFile("style/custom.css", "body { font-family: serif; }");
        BookOptions options = new BookOptions(true, null, ' ', true, false, 2,
            null, null, "style/custom.css", null, null, null, null);

        String html = renderText(renderer, book(BookMetadata.defaults(), options, List.of()));

        assertThat(html).contains("body { font-family: serif; }");
    }

    @Test
    void render_withTemplateOverrideUsingUnknownPlaceholder_fails() throws Exception {
        writeFile("page.html", "<html>{{content}}{{footer}}</html>");
        BookOptions options = new BookOptions(true, null, ' ', true, false, 2,
            null, null, null, "page.html", null, null, null);

        assertThatThrownBy(() -> renderText(renderer, book(BookMetadata.defaults(), options, List.of())))
            .isInstanceOf(RenderException.class)
            .hasMessageContaining("footer");
    }

    @Test
    void render_isDeterministic() throws Exception {
        String first = renderText(renderer, book("# A\n\n*x* and **y**\n", "# B\n\n> q\n"));
        String second = renderText(renderer, book("# A\n\n*x* and **y**\n", "# B\n\n> q\n"));

        assertThat(first).isEqualTo(second);
    }
}
