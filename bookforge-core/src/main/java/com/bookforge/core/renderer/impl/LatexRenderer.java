package com.bookforge.core.renderer.impl;

import com.bookforge.core.book.Book;
import com.bookforge.core.config.OutputFormat;
import com.bookforge.core.error.RenderException;
import com.bookforge.core.renderer.BookRenderer;
import com.bookforge.core.renderer.ChapterProgress;
import com.bookforge.core.renderer.FootnoteIndex;
import com.bookforge.core.renderer.RenderContext;
import com.bookforge.core.renderer.RenderedArtifact;
import com.bookforge.core.renderer.ResolvedChapter;
import com.bookforge.core.renderer.TextArtifact;
import com.bookforge.core.template.Escaper;
import com.bookforge.core.template.Templates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

/**
 * Renders the book as a single LaTeX source.
 *
 * <p>Chapters become {@code \chapter*} with a manual table-of-contents line, so the
 * numbering shown is the one computed by the numbering resolver rather than LaTeX's.
 * Hidden and untitled chapters only start a new page.
 *
 * <p>Template variables: {@code author}, {@code title}, {@code lang}, {@code description},
 * {@code subject}, {@code babel_lang}, {@code content}.
 */
public class LatexRenderer implements BookRenderer {

    private static final Logger log = LoggerFactory.getLogger(LatexRenderer.class);

    private static final String FORMAT = "tex";

    private static final Map<String, String> BABEL_LANGUAGES = Map.ofEntries(
        Map.entry("en", "english"),
        Map.entry("fr", "french"),
        Map.entry("de", "ngerman"),
        Map.entry("es", "spanish"),
        Map.entry("it", "italian"),
        Map.entry("pt", "portuguese"),
        Map.entry("nl", "dutch"),
        Map.entry("ru", "russian"),
        Map.entry("pl", "polish"),
        Map.entry("sv", "swedish")
    );

    @Override
    public String getId() {
        return FORMAT;
    }

    @Override
    public String getDisplayName() {
        return "LaTeX source";
    }

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.TEX;
    }

    @Override
    public RenderedArtifact render(RenderContext context) throws RenderException {
        return new TextArtifact("application/x-tex", renderSource(context, FORMAT));
    }

    /**
     * Produces the LaTeX source of the book.
     *
     * @param context render context
     * @param format format id reported in errors ({@code tex} or {@code pdf})
     * @return LaTeX source
     * @throws RenderException if a template fails or a footnote is unresolved
     */
    String renderSource(RenderContext context, String format) throws RenderException {
        Book book = context.book();
        String template = Templates.load(book, book.options().texTemplateOverride(), Templates.LATEX_TEMPLATE, format);

        StringBuilder content = new StringBuilder();
        for (ResolvedChapter chapter : context.chapters()) {
            ChapterProgress progress = new ChapterProgress(chapter, format);
            if (chapter.hasHeader()) {
                progress.beginHeader();
                String header = Escaper.LATEX.apply(context.headerText(chapter, format));
                content.append("\\chapter*{").append(header).append("}\n")
                    .append("\\addcontentsline{toc}{chapter}{").append(header).append("}\n\n");
            } else {
                content.append("\\clearpage\n\n");
            }

            progress.beginBody();
            FootnoteIndex footnotes = FootnoteIndex.of(chapter.chapter().content());
            LatexBodyWriter writer = new LatexBodyWriter(book, footnotes);
            writer.write(chapter.body());
            progress.finish(footnotes);
            content.append(writer.result());
            log.debug("Rendered chapter {} to LaTeX", chapter.ordinal());
        }

        Map<String, String> variables = Templates.metadataVariables(book.metadata(), Escaper.LATEX);
        variables.put("babel_lang", babelLanguage(book.metadata().lang()));
        variables.put("content", content.toString());
        try {
            return context.templates().expand(template, variables);
        } catch (RenderException e) {
            throw new RenderException(format, e.getMessage(), e);
        }
    }

    static String babelLanguage(String lang) {
        String primary = lang.toLowerCase(Locale.ROOT);
        int separator = primary.indexOf('-') >= 0 ? primary.indexOf('-') : primary.indexOf('_');
        if (separator > 0) {
            primary = primary.substring(0, separator);
        }
        return BABEL_LANGUAGES.getOrDefault(primary, "english");
    }
}
