package com.bookforge.core.numbering;

import com.bookforge.core.error.RenderException;
import com.bookforge.core.template.TemplateEngine;

import java.util.Map;

/**
 * Produces chapter header text from the numbering template.
 */
public class HeaderFormatter {

    private final TemplateEngine engine;
    private final String template;

    public HeaderFormatter(TemplateEngine engine, String template) {
        this.engine = engine;
        this.template = template;
    }

    /**
     * Formats the header of a chapter.
     *
     * <p>The title is substituted raw; callers escape the result for their format.
     *
     * @param display chapter display state
     * @param title plain-text chapter title
     * @return header text, the bare title for unnumbered chapters
     * @throws RenderException if the template cannot be expanded
     */
    public String format(ChapterDisplay display, String title) throws RenderException {
        if (display.number().isEmpty()) {
            return title;
        }
        return format(display.number().getAsInt(), title);
    }

    /**
     * Expands the numbering template for a numbered chapter.
     *
     * @param number display number
     * @param title plain-text chapter title
     * @return expanded header text
     * @throws RenderException if the template cannot be expanded
     */
    public String format(int number, String title) throws RenderException {
        return engine.expand(template, Map.of("number", Integer.toString(number), "title", title));
    }
}
