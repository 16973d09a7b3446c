package com.bookforge.core.renderer;

import com.bookforge.core.book.Book;
import com.bookforge.core.book.BookMetadata;
import com.bookforge.core.book.BookOptions;
import com.bookforge.core.book.Chapter;
import com.bookforge.core.book.ChapterNumber;
import com.bookforge.core.parser.MarkdownParser;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Base class for renderer functional tests.
 *
 * <p>Provides common test infrastructure including:
 * <ul>
 *   <li>Temporary book directory for chapter files, images and overrides</li>
 *   <li>Helpers building books from Markdown snippets</li>
 *   <li>Helpers reading back rendered artifacts and containers</li>
 * </ul>
 */
public abstract class RendererTestBase {

    @TempDir
    protected Path tempDir;

    protected final MarkdownParser parser = new MarkdownParser();

    /**
     * Entry of a rendered container as read back from the zip stream.
     *
     * @param name entry path
     * @param method {@link ZipEntry#STORED} or {@link ZipEntry#DEFLATED}
     * @param bytes entry content
     */
    protected record ReadEntry(String name, int method, byte[] bytes) {

        public String text() {
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    /**
     * Creates a chapter from Markdown.
     *
     * @param number numbering policy
     * @param markdown chapter source
     * @return chapter
     */
    protected Chapter chapter(ChapterNumber number, String markdown) {
        return new Chapter(number, parser.parse(markdown));
    }

    /**
     * Creates a book with default metadata and options, one automatic chapter per snippet.
     *
     * @param markdown chapter sources
     * @return book rooted at the temp directory
     */
    protected Book book(String... markdown) {
        List<Chapter> chapters = new ArrayList<>();
        for (String source : markdown) {
            chapters.add(chapter(ChapterNumber.automatic(), source));
        }
        return book(BookMetadata.defaults(), BookOptions.defaults(), chapters);
    }

    /**
     * Creates a book rooted at the temp directory.
     *
     * @param metadata book metadata
     * @param options rendering options
     * @param chapters chapters
     * @return book
     */
    protected Book book(BookMetadata metadata, BookOptions options, List<Chapter> chapters) {
        return new Book(metadata, options, tempDir, chapters);
    }

    /**
     * Renders a book and returns the artifact bytes.
     *
     * @param renderer renderer under test
     * @param book book to render
     * @return serialized artifact
     * @throws Exception if rendering fails
     */
    protected byte[] render(BookRenderer renderer, Book book) throws Exception {
        RenderedArtifact artifact = renderer.render(RenderContext.of(book));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        artifact.writeTo(out);
        return out.toByteArray();
    }

    /**
     * Renders a book to text.
     *
     * @param renderer renderer producing a text artifact
     * @param book book to render
     * @return artifact content
     * @throws Exception if rendering fails
     */
    protected String renderText(BookRenderer renderer, Book book) throws Exception {
        return new String(render(renderer, book), StandardCharsets.UTF_8);
    }

    /**
     * Reads every entry of a zip container, in stream order.
     *
     * @param zip container bytes
     * @return entries keyed by path
     * @throws IOException if the container is malformed
     */
    protected Map<String, ReadEntry> readZip(byte[] zip) throws IOException {
        Map<String, ReadEntry> entries = new LinkedHashMap<>();
        try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(zip))) {
            ZipEntry entry;
            while ((entry = in.getNextEntry()) != null) {
                entries.put(entry.getName(), new ReadEntry(entry.getName(), entry.getMethod(), in.readAllBytes()));
            }
        }
        return entries;
    }

    /**
     * Writes a small PNG image into the book directory.
     *
     * @param relativePath path relative to the temp directory
     * @param width image width in pixels
     * @param height image height in pixels
     * @return the image file
     * @throws IOException if the image cannot be written
     */
    protected Path writePng(String relativePath, int width, int height) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        ImageIO.write(new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB), "png", file.toFile());
        return file;
    }

    /**
     * Writes a text file into the book directory.
     *
     * @param relativePath path relative to the temp directory
     * @param content file content
     * @return the written file
     * @throws IOException if the file cannot be written
     */
    protected Path writeFile(String relativePath, String content) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }
}
