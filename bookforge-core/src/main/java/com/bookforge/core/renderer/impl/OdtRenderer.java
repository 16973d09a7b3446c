package com.bookforge.core.renderer.impl;

import com.bookforge.core.book.Book;
import com.bookforge.core.config.OutputFormat;
import com.bookforge.core.error.RenderException;
import com.bookforge.core.renderer.BookRenderer;
import com.bookforge.core.renderer.ChapterProgress;
import com.bookforge.core.renderer.ContainerArtifact;
import com.bookforge.core.renderer.ContainerEntry;
import com.bookforge.core.renderer.FootnoteIndex;
import com.bookforge.core.renderer.ImageCatalog;
import com.bookforge.core.renderer.RenderContext;
import com.bookforge.core.renderer.RenderedArtifact;
import com.bookforge.core.renderer.ResolvedChapter;
import com.bookforge.core.template.Escaper;
import com.bookforge.core.template.Templates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Packages the book as an OpenDocument Text container.
 *
 * <p>Entry order: stored {@code mimetype}, {@code META-INF/manifest.xml},
 * {@code content.xml}, {@code styles.xml}, {@code meta.xml}, then {@code Pictures/*}
 * for every local image. A referenced image that cannot be read fails the render.
 */
public class OdtRenderer implements BookRenderer {

    private static final Logger log = LoggerFactory.getLogger(OdtRenderer.class);

    private static final String FORMAT = "odt";
    private static final String MEDIA_TYPE = "application/vnd.oasis.opendocument.text";

    private static final double MAX_WIDTH_CM = 15.0;
    private static final double DEFAULT_WIDTH_CM = 10.0;
    private static final double DEFAULT_HEIGHT_CM = 7.5;
    private static final double CM_PER_PIXEL = 2.54 / 96.0;

    @Override
    public String getId() {
        return FORMAT;
    }

    @Override
    public String getDisplayName() {
        return "OpenDocument Text";
    }

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.ODT;
    }

    @Override
    public RenderedArtifact render(RenderContext context) throws RenderException {
        Book book = context.book();
        Map<String, String> meta = Templates.metadataVariables(book.metadata(), Escaper.XML);

        ImageCatalog catalog = ImageCatalog.collect(book, context.chapters(), "Pictures/");
        List<ContainerEntry> pictures = new ArrayList<>();
        Map<String, OdtBodyWriter.OdtImage> images = new HashMap<>();
        for (ImageCatalog.ImageResource image : catalog.images()) {
            byte[] bytes = ImageCatalog.readRequired(image.path(), FORMAT);
            pictures.add(new ContainerEntry(image.entryName(), bytes, true));
            images.put(image.url(), measure(image.entryName(), bytes));
        }

        StringBuilder body = new StringBuilder();
        body.append("<text:p text:style-name=\"Title\">").append(meta.get("title")).append("</text:p>\n")
            .append("<text:p text:style-name=\"Subtitle\">").append(meta.get("author")).append("</text:p>\n");

        for (ResolvedChapter chapter : context.chapters()) {
            ChapterProgress progress = new ChapterProgress(chapter, FORMAT);
            if (chapter.hasHeader()) {
                progress.beginHeader();
                body.append("<text:h text:style-name=\"Heading_20_1\" text:outline-level=\"1\">")
                    .append(Escaper.XML.apply(context.headerText(chapter, FORMAT)))
                    .append("</text:h>\n");
            }
            progress.beginBody();
            FootnoteIndex footnotes = FootnoteIndex.of(chapter.chapter().content());
            OdtBodyWriter writer = new OdtBodyWriter(footnotes, "c" + chapter.ordinal() + "-", images);
            writer.write(chapter.body());
            progress.finish(footnotes);
            body.append(writer.result());
            log.debug("Rendered chapter {} to ODT", chapter.ordinal());
        }

        Map<String, String> contentVariables = new HashMap<>(meta);
        contentVariables.put("body", body.toString());

        List<ContainerEntry> entries = new ArrayList<>();
        entries.add(ContainerEntry.storedText("mimetype", MEDIA_TYPE));
        entries.add(ContainerEntry.text("META-INF/manifest.xml", manifest(catalog)));
        entries.add(ContainerEntry.text("content.xml", expand(context, Templates.builtin(Templates.ODT_CONTENT), contentVariables)));
        entries.add(ContainerEntry.text("styles.xml", expand(context, Templates.builtin(Templates.ODT_STYLES), meta)));
        entries.add(ContainerEntry.text("meta.xml", expand(context, Templates.builtin(Templates.ODT_META), meta)));
        entries.addAll(pictures);
        return new ContainerArtifact(MEDIA_TYPE, entries);
    }

    private static String expand(RenderContext context, String template, Map<String, String> variables)
            throws RenderException {
        try {
            return context.templates().expand(template, variables);
        } catch (RenderException e) {
            throw new RenderException(FORMAT, e.getMessage(), e);
        }
    }

    private static String manifest(ImageCatalog catalog) {
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
            .append("<manifest:manifest xmlns:manifest=\"urn:oasis:names:tc:opendocument:xmlns:manifest:1.0\" manifest:version=\"1.2\">\n")
            .append(" <manifest:file-entry manifest:full-path=\"/\" manifest:version=\"1.2\" manifest:media-type=\"")
            .append(MEDIA_TYPE).append("\"/>\n")
            .append(" <manifest:file-entry manifest:full-path=\"content.xml\" manifest:media-type=\"text/xml\"/>\n")
            .append(" <manifest:file-entry manifest:full-path=\"styles.xml\" manifest:media-type=\"text/xml\"/>\n")
            .append(" <manifest:file-entry manifest:full-path=\"meta.xml\" manifest:media-type=\"text/xml\"/>\n");
        for (ImageCatalog.ImageResource image : catalog.images()) {
            sb.append(" <manifest:file-entry manifest:full-path=\"").append(image.entryName())
                .append("\" manifest:media-type=\"").append(image.mediaType()).append("\"/>\n");
        }
        sb.append("</manifest:manifest>\n");
        return sb.toString();
    }

    /**
     * Computes the display size of an image, at 96 dpi and no wider than the text area.
     */
    static OdtBodyWriter.OdtImage measure(String href, byte[] bytes) {
        BufferedImage image = null;
        try {
            image = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException e) {
            log.debug("Could not decode {}: {}", href, e.getMessage());
        }
        if (image == null) {
            return new OdtBodyWriter.OdtImage(href, DEFAULT_WIDTH_CM, DEFAULT_HEIGHT_CM);
        }
        double width = image.getWidth() * CM_PER_PIXEL;
        double height = image.getHeight() * CM_PER_PIXEL;
        if (width > MAX_WIDTH_CM) {
            height = height * MAX_WIDTH_CM / width;
            width = MAX_WIDTH_CM;
        }
        return new OdtBodyWriter.OdtImage(href, width, height);
    }
}
