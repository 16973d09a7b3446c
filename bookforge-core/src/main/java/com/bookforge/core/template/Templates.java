package com.bookforge.core.template;

import com.bookforge.core.book.Book;
import com.bookforge.core.book.BookMetadata;
import com.bookforge.core.error.RenderException;
import com.bookforge.core.error.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Built-in templates shipped on the classpath under {@code templates/}, and user overrides.
 */
public final class Templates {

    private static final Logger log = LoggerFactory.getLogger(Templates.class);

    public static final String EPUB_CSS = "epub/stylesheet.css";
    public static final String EPUB2_OPF = "epub/content.opf";
    public static final String EPUB3_OPF = "epub3/content.opf";
    public static final String EPUB2_CHAPTER = "epub/chapter.xhtml";
    public static final String EPUB3_CHAPTER = "epub3/chapter.xhtml";
    public static final String HTML_TEMPLATE = "html/template.html";
    public static final String HTML_CSS = "html/stylesheet.css";
    public static final String LATEX_TEMPLATE = "latex/template.tex";
    public static final String ODT_CONTENT = "odt/content.xml";
    public static final String ODT_STYLES = "odt/styles.xml";
    public static final String ODT_META = "odt/meta.xml";

    /**
     * Names accepted by {@link #builtin(String)}.
     */
    public static final List<String> BUILTIN_NAMES = List.of(
        EPUB_CSS, EPUB2_OPF, EPUB3_OPF, EPUB2_CHAPTER, EPUB3_CHAPTER,
        HTML_TEMPLATE, HTML_CSS, LATEX_TEMPLATE, ODT_CONTENT, ODT_STYLES, ODT_META
    );

    private static final String RESOURCE_ROOT = "templates/";

    private Templates() {
        // Utility class
    }

    /**
     * Reads a built-in template.
     *
     * @param name one of {@link #BUILTIN_NAMES}
     * @return template text
     * @throws IllegalArgumentException if no such template is bundled
     */
    public static String builtin(String name) {
        String resource = RESOURCE_ROOT + name;
        try (InputStream in = Templates.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Unknown built-in template: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read built-in template " + name, e);
        }
    }

    /**
     * Returns the override file when one is configured, the built-in template otherwise.
     *
     * @param book book whose directory overrides resolve against
     * @param override configured override path, if any
     * @param name built-in fallback name
     * @param format format id used in error messages
     * @return template text
     * @throws RenderException if a configured override cannot be read
     */
    public static String load(Book book, Optional<String> override, String name, String format)
            throws RenderException {
        if (override.isEmpty()) {
            return builtin(name);
        }
        Path path = book.resolve(override.get());
        log.debug("Using override {} instead of built-in {}", path, name);
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new RenderException(format, "override not found: " + path, new ResourceNotFoundException(path, e));
        } catch (IOException e) {
            throw new RenderException(format, "could not read override " + path, e);
        }
    }

    /**
     * Builds the metadata variables every template can use, escaped for the target format.
     *
     * @param metadata book metadata
     * @param escaper escaping of the target format
     * @return variables {@code author}, {@code title}, {@code lang}, {@code description}, {@code subject}
     */
    public static Map<String, String> metadataVariables(BookMetadata metadata, UnaryOperator<String> escaper) {
        Map<String, String> variables = new LinkedHashMap<>();
        variables.put("author", escaper.apply(metadata.author()));
        variables.put("title", escaper.apply(metadata.title()));
        variables.put("lang", escaper.apply(metadata.lang()));
        variables.put("description", escaper.apply(metadata.descriptionValue().orElse("")));
        variables.put("subject", escaper.apply(metadata.subjectValue().orElse("")));
        return variables;
    }
}
