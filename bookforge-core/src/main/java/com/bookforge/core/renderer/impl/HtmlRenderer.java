package com.bookforge.core.renderer.impl;

import com.bookforge.core.book.Book;
import com.bookforge.core.config.OutputFormat;
import com.bookforge.core.error.RenderException;
import com.bookforge.core.renderer.BookRenderer;
import com.bookforge.core.renderer.ChapterProgress;
import com.bookforge.core.renderer.FootnoteIndex;
import com.bookforge.core.renderer.ImageCatalog;
import com.bookforge.core.renderer.RenderContext;
import com.bookforge.core.renderer.RenderedArtifact;
import com.bookforge.core.renderer.ResolvedChapter;
import com.bookforge.core.renderer.TextArtifact;
import com.bookforge.core.template.Escaper;
import com.bookforge.core.template.Templates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * Renders the whole book as one self-contained HTML page.
 *
 * <p>The stylesheet is inlined and local images are embedded as {@code data:} URIs, so
 * the page has no external dependencies besides remote images. A table of contents
 * links to every chapter with a header; footnotes are listed at the end of each chapter.
 *
 * <p>Template variables: {@code author}, {@code title}, {@code lang}, {@code description},
 * {@code subject}, {@code stylesheet}, {@code toc}, {@code content}.
 */
public class HtmlRenderer implements BookRenderer {

    private static final Logger log = LoggerFactory.getLogger(HtmlRenderer.class);

    private static final String FORMAT = "html";

    @Override
    public String getId() {
        return FORMAT;
    }

    @Override
    public String getDisplayName() {
        return "Standalone HTML";
    }

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.HTML;
    }

    @Override
    public RenderedArtifact render(RenderContext context) throws RenderException {
        Book book = context.book();
        String template = Templates.load(book, book.options().htmlTemplateOverride(), Templates.HTML_TEMPLATE, FORMAT);
        String stylesheet = Templates.load(book, book.options().htmlCssOverride(), Templates.HTML_CSS, FORMAT);
        Map<String, String> images = embedImages(context);

        StringBuilder toc = new StringBuilder("<ul>\n");
        StringBuilder content = new StringBuilder();
        for (ResolvedChapter chapter : context.chapters()) {
            String anchor = "chapter-" + chapter.ordinal();
            ChapterProgress progress = new ChapterProgress(chapter, FORMAT);
            content.append("<section class=\"chapter\" id=\"").append(anchor).append("\">\n");

            if (chapter.hasHeader()) {
                progress.beginHeader();
                String header = Escaper.XML.apply(context.headerText(chapter, FORMAT));
                content.append("<h1>").append(header).append("</h1>\n");
                toc.append("<li><a href=\"#").append(anchor).append("\">").append(header).append("</a></li>\n");
            }

            progress.beginBody();
            FootnoteIndex footnotes = FootnoteIndex.of(chapter.chapter().content());
            HtmlBodyWriter writer = new HtmlBodyWriter(footnotes, "c" + chapter.ordinal() + "-",
                url -> images.getOrDefault(url, url));
            writer.write(chapter.body());
            writer.writeFootnotes();
            progress.finish(footnotes);

            content.append(writer.result()).append("</section>\n");
            log.debug("Rendered chapter {} to HTML", chapter.ordinal());
        }
        toc.append("</ul>\n");

        Map<String, String> variables = Templates.metadataVariables(book.metadata(), Escaper.XML);
        variables.put("stylesheet", stylesheet);
        variables.put("toc", toc.toString());
        variables.put("content", content.toString());
        String page;
        try {
            page = context.templates().expand(template, variables);
        } catch (RenderException e) {
            throw new RenderException(FORMAT, e.getMessage(), e);
        }
        return new TextArtifact("text/html", page);
    }

    private static Map<String, String> embedImages(RenderContext context) throws RenderException {
        Map<String, String> sources = new HashMap<>();
        ImageCatalog catalog = ImageCatalog.collect(context.book(), context.chapters(), "");
        for (ImageCatalog.ImageResource image : catalog.images()) {
            byte[] bytes = ImageCatalog.readRequired(image.path(), FORMAT);
            sources.put(image.url(), "data:" + image.mediaType() + ";base64,"
                + Base64.getEncoder().encodeToString(bytes));
        }
        return sources;
    }
}
