package com.bookforge.core.renderer;

import com.bookforge.core.config.OutputFormat;
import com.bookforge.core.error.RenderException;

/**
 * Interface for renderers that turn a parsed book into one output format.
 *
 * <p>Every renderer receives the same token trees and the same numbering resolution
 * through {@link RenderContext}; they differ only in how tokens map to the target
 * syntax and in the shape of the {@link RenderedArtifact} they return. Renderers hold
 * no state between calls and never write files themselves.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class PlainTextRenderer implements BookRenderer {
 *     @Override
 *     public String getId() {
 *         return "txt";
 *     }
 *
 *     @Override
 *     public RenderedArtifact render(RenderContext context) throws RenderException {
 *         StringBuilder sb = new StringBuilder();
 *         for (ResolvedChapter chapter : context.chapters()) {
 *             sb.append(Tokens.plainText(chapter.body())).append('\n');
 *         }
 *         return new TextArtifact(sb.toString());
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.bookforge.core.renderer.BookRenderer}
 *
 * @see RenderContext
 * @see RenderedArtifact
 */
public interface BookRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Matches {@link OutputFormat#getId()} of the format it produces.
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Returns human-readable name for this renderer.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the output format this renderer produces.
     *
     * @return output format
     */
    OutputFormat getFormat();

    /**
     * Renders the whole book.
     *
     * @param context book, resolved chapters and template engine
     * @return rendered artifact
     * @throws RenderException if a template fails, a required resource is missing,
     *                         a footnote reference is unresolved or an external command fails
     */
    RenderedArtifact render(RenderContext context) throws RenderException;
}
