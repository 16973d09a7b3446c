package com.bookforge.core.renderer.impl;

import com.bookforge.core.book.Book;
import com.bookforge.core.book.BookMetadata;
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
import com.bookforge.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Packages the book as an EPUB 2 or EPUB 3 container.
 *
 * <p>Entry order:
 * <ol>
 *   <li>{@code mimetype}, stored uncompressed</li>
 *   <li>{@code META-INF/container.xml}</li>
 *   <li>{@code OEBPS/content.opf}, from the package template of the configured version</li>
 *   <li>{@code OEBPS/toc.ncx}</li>
 *   <li>{@code OEBPS/nav.xhtml} (EPUB 3 only)</li>
 *   <li>{@code OEBPS/stylesheet.css}</li>
 *   <li>{@code OEBPS/cover.xhtml} and the cover image, when a cover is declared</li>
 *   <li>{@code OEBPS/title_page.xhtml}</li>
 *   <li>{@code OEBPS/chapter_NNN.xhtml}, one per chapter</li>
 *   <li>{@code OEBPS/images/*}, every local image used by chapters</li>
 * </ol>
 *
 * <p>A declared cover, a referenced image or a configured override that cannot be read
 * fails the render.
 */
public class EpubRenderer implements BookRenderer {

    private static final Logger log = LoggerFactory.getLogger(EpubRenderer.class);

    private static final String FORMAT = "epub";
    private static final String MEDIA_TYPE = "application/epub+zip";
    private static final String XHTML = "application/xhtml+xml";

    private static final String CONTAINER_XML = """
        <?xml version="1.0" encoding="UTF-8"?>
        <container version="1.0" xmlns="urn:oasis:names:tc:opendocument:xmlns:container">
          <rootfiles>
            <rootfile full-path="OEBPS/content.opf" media-type="application/oebps-package+xml"/>
          </rootfiles>
        </container>
        """;

    @Override
    public String getId() {
        return FORMAT;
    }

    @Override
    public String getDisplayName() {
        return "EPUB (version 2 or 3)";
    }

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.EPUB;
    }

    @Override
    public RenderedArtifact render(RenderContext context) throws RenderException {
        Book book = context.book();
        BookMetadata metadata = book.metadata();
        boolean epub3 = book.options().epubVersion() == 3;
        Map<String, String> meta = Templates.metadataVariables(metadata, Escaper.XML);

        String chapterTemplate = Templates.builtin(epub3 ? Templates.EPUB3_CHAPTER : Templates.EPUB2_CHAPTER);
        String opfTemplate = Templates.load(book, book.options().epubTemplateOverride(),
            epub3 ? Templates.EPUB3_OPF : Templates.EPUB2_OPF, FORMAT);
        String stylesheet = Templates.load(book, book.options().epubCssOverride(), Templates.EPUB_CSS, FORMAT);

        ImageCatalog catalog = ImageCatalog.collect(book, context.chapters(), "images/");
        List<ContainerEntry> images = new ArrayList<>();
        for (ImageCatalog.ImageResource image : catalog.images()) {
            images.add(new ContainerEntry("OEBPS/" + image.entryName(),
                ImageCatalog.readRequired(image.path(), FORMAT), false));
        }

        ContainerEntry coverImage = null;
        if (metadata.coverValue().isPresent()) {
            Path coverPath = book.resolve(metadata.coverValue().get());
            String extension = FileUtils.getExtension(coverPath).toLowerCase(Locale.ROOT);
            coverImage = new ContainerEntry("OEBPS/images/cover" + (extension.isEmpty() ? "" : "." + extension),
                ImageCatalog.readRequired(coverPath, FORMAT), false);
        }

        Manifest manifest = new Manifest(epub3);
        List<ContainerEntry> pages = new ArrayList<>();

        if (coverImage != null) {
            String imageHref = coverImage.path().substring("OEBPS/".length());
            manifest.item("cover-image", imageHref, FileUtils.imageMediaType(imageHref), epub3 ? "cover-image" : null);
            String body = "<div class=\"cover\"><img src=\"" + imageHref + "\" alt=\"" + meta.get("title") + "\" /></div>\n";
            pages.add(ContainerEntry.text("OEBPS/cover.xhtml", page(context, chapterTemplate, meta, meta.get("title"), body)));
            manifest.item("cover", "cover.xhtml", XHTML, null);
            manifest.spine("cover");
        }

        String titleBody = "<div class=\"title-page\">\n<h1 class=\"title\">" + meta.get("title")
            + "</h1>\n<h2 class=\"author\">" + meta.get("author") + "</h2>\n</div>\n";
        pages.add(ContainerEntry.text("OEBPS/title_page.xhtml", page(context, chapterTemplate, meta, meta.get("title"), titleBody)));
        manifest.item("title_page", "title_page.xhtml", XHTML, null);
        manifest.spine("title_page");

        List<NavPoint> navPoints = new ArrayList<>();
        for (ResolvedChapter chapter : context.chapters()) {
            String file = String.format("chapter_%03d.xhtml", chapter.ordinal());
            String id = String.format("chapter_%03d", chapter.ordinal());
            StringBuilder body = new StringBuilder();
            String pageTitle = meta.get("title");
            ChapterProgress progress = new ChapterProgress(chapter, FORMAT);

            if (chapter.hasHeader()) {
                progress.beginHeader();
                String header = Escaper.XML.apply(context.headerText(chapter, FORMAT));
                body.append("<h1>").append(header).append("</h1>\n");
                navPoints.add(new NavPoint(id, file, header));
                pageTitle = header;
            }

            progress.beginBody();
            FootnoteIndex footnotes = FootnoteIndex.of(chapter.chapter().content());
            HtmlBodyWriter writer = new HtmlBodyWriter(footnotes, "",
                url -> catalog.lookup(url).map(ImageCatalog.ImageResource::entryName).orElse(url));
            writer.write(chapter.body());
            writer.writeFootnotes();
            progress.finish(footnotes);
            body.append(writer.result());

            pages.add(ContainerEntry.text("OEBPS/" + file, page(context, chapterTemplate, meta, pageTitle, body.toString())));
            manifest.item(id, file, XHTML, null);
            manifest.spine(id);
            log.debug("Rendered chapter {} to EPUB", chapter.ordinal());
        }

        for (int i = 0; i < catalog.images().size(); i++) {
            ImageCatalog.ImageResource image = catalog.images().get(i);
            manifest.item(String.format("image_%03d", i + 1), image.entryName(), image.mediaType(), null);
        }
        manifest.item("ncx", "toc.ncx", "application/x-dtbncx+xml", null);
        manifest.item("stylesheet", "stylesheet.css", "text/css", null);
        if (epub3) {
            manifest.item("nav", "nav.xhtml", XHTML, "nav");
        }

        String uuid = "urn:uuid:" + UUID.nameUUIDFromBytes(
            (metadata.title() + '\u0000' + metadata.author()).getBytes(StandardCharsets.UTF_8));
        Map<String, String> opfVariables = new LinkedHashMap<>(meta);
        opfVariables.put("uuid", uuid);
        opfVariables.put("modified", DateTimeFormatter.ISO_INSTANT.format(Instant.now().truncatedTo(ChronoUnit.SECONDS)));
        opfVariables.put("optional_metadata", optionalMetadata(metadata, coverImage != null && !epub3));
        opfVariables.put("manifest", manifest.items());
        opfVariables.put("spine", manifest.itemRefs());
        opfVariables.put("guide", coverImage != null
            ? "<reference type=\"cover\" title=\"Cover\" href=\"cover.xhtml\" />"
            : "<reference type=\"title-page\" title=\"Title\" href=\"title_page.xhtml\" />");

        List<ContainerEntry> entries = new ArrayList<>();
        entries.add(ContainerEntry.storedText("mimetype", MEDIA_TYPE));
        entries.add(ContainerEntry.text("META-INF/container.xml", CONTAINER_XML));
        entries.add(ContainerEntry.text("OEBPS/content.opf", expand(context, opfTemplate, opfVariables)));
        entries.add(ContainerEntry.text("OEBPS/toc.ncx", tocNcx(meta, uuid, navPoints)));
        if (epub3) {
            entries.add(ContainerEntry.text("OEBPS/nav.xhtml", navXhtml(meta, navPoints)));
        }
        entries.add(ContainerEntry.text("OEBPS/stylesheet.css", stylesheet));
        if (coverImage != null) {
            entries.add(coverImage);
        }
        entries.addAll(pages);
        entries.addAll(images);

        log.debug("EPUB {} container with {} entries", epub3 ? 3 : 2, entries.size());
        return new ContainerArtifact(MEDIA_TYPE, entries);
    }

    private static String page(RenderContext context, String template, Map<String, String> meta,
                               String pageTitle, String content) throws RenderException {
        Map<String, String> variables = new LinkedHashMap<>(meta);
        variables.put("chapter_title", pageTitle);
        variables.put("content", content);
        return expand(context, template, variables);
    }

    private static String expand(RenderContext context, String template, Map<String, String> variables)
            throws RenderException {
        try {
            return context.templates().expand(template, variables);
        } catch (RenderException e) {
            throw new RenderException(FORMAT, e.getMessage(), e);
        }
    }

    private static String optionalMetadata(BookMetadata metadata, boolean coverMeta) {
        StringBuilder sb = new StringBuilder();
        metadata.descriptionValue().ifPresent(description ->
            sb.append("    <dc:description>").append(Escaper.XML.apply(description)).append("</dc:description>\n"));
        metadata.subjectValue().ifPresent(subject ->
            sb.append("    <dc:subject>").append(Escaper.XML.apply(subject)).append("</dc:subject>\n"));
        if (coverMeta) {
            sb.append("    <meta name=\"cover\" content=\"cover-image\" />\n");
        }
        return sb.toString();
    }

    private static String tocNcx(Map<String, String> meta, String uuid, List<NavPoint> navPoints) {
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
            .append("<ncx xmlns=\"http://www.daisy.org/z3986/2005/ncx/\" version=\"2005-1\">\n")
            .append("  <head>\n")
            .append("    <meta name=\"dtb:uid\" content=\"").append(uuid).append("\" />\n")
            .append("    <meta name=\"dtb:depth\" content=\"1\" />\n")
            .append("    <meta name=\"dtb:totalPageCount\" content=\"0\" />\n")
            .append("    <meta name=\"dtb:maxPageNumber\" content=\"0\" />\n")
            .append("  </head>\n")
            .append("  <docTitle><text>").append(meta.get("title")).append("</text></docTitle>\n")
            .append("  <docAuthor><text>").append(meta.get("author")).append("</text></docAuthor>\n")
            .append("  <navMap>\n");
        int order = 1;
        sb.append("    <navPoint id=\"navpoint-title\" playOrder=\"").append(order++).append("\">\n")
            .append("      <navLabel><text>").append(meta.get("title")).append("</text></navLabel>\n")
            .append("      <content src=\"title_page.xhtml\" />\n")
            .append("    </navPoint>\n");
        for (NavPoint point : navPoints) {
            sb.append("    <navPoint id=\"navpoint-").append(point.id()).append("\" playOrder=\"").append(order++).append("\">\n")
                .append("      <navLabel><text>").append(point.label()).append("</text></navLabel>\n")
                .append("      <content src=\"").append(point.file()).append("\" />\n")
                .append("    </navPoint>\n");
        }
        sb.append("  </navMap>\n</ncx>\n");
        return sb.toString();
    }

    private static String navXhtml(Map<String, String> meta, List<NavPoint> navPoints) {
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
            .append("<!DOCTYPE html>\n")
            .append("<html xmlns=\"http://www.w3.org/1999/xhtml\" xmlns:epub=\"http://www.idpf.org/2007/ops\" lang=\"")
            .append(meta.get("lang")).append("\" xml:lang=\"").append(meta.get("lang")).append("\">\n")
            .append("<head>\n<meta charset=\"UTF-8\" />\n<title>").append(meta.get("title")).append("</title>\n</head>\n")
            .append("<body>\n<nav epub:type=\"toc\" id=\"toc\">\n<h1>").append(meta.get("title")).append("</h1>\n<ol>\n")
            .append("<li><a href=\"title_page.xhtml\">").append(meta.get("title")).append("</a></li>\n");
        for (NavPoint point : navPoints) {
            sb.append("<li><a href=\"").append(point.file()).append("\">").append(point.label()).append("</a></li>\n");
        }
        sb.append("</ol>\n</nav>\n</body>\n</html>\n");
        return sb.toString();
    }

    private record NavPoint(String id, String file, String label) {
    }

    /**
     * Manifest items and spine references of the package document.
     */
    private static final class Manifest {

        private final boolean epub3;
        private final StringBuilder items = new StringBuilder();
        private final StringBuilder spine = new StringBuilder();

        Manifest(boolean epub3) {
            this.epub3 = epub3;
        }

        void item(String id, String href, String mediaType, String properties) {
            items.append("    <item id=\"").append(id).append("\" href=\"").append(href)
                .append("\" media-type=\"").append(mediaType).append('"');
            if (epub3 && properties != null) {
                items.append(" properties=\"").append(properties).append('"');
            }
            items.append(" />\n");
        }

        void spine(String id) {
            spine.append("    <itemref idref=\"").append(id).append("\" />\n");
        }

        String items() {
            return items.toString();
        }

        String itemRefs() {
            return spine.toString();
        }
    }
}
