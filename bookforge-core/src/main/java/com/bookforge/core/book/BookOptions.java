package com.bookforge.core.book;

import java.util.Optional;

/**
 * Rendering options of a book.
 *
 * <p>Override paths ({@code epubCss}, {@code epubTemplate}, {@code htmlCss},
 * {@code htmlTemplate}, {@code texTemplate}) are optional. When set they replace the
 * built-in resource; a configured file that does not exist is an error.
 *
 * @param numbering whether chapters are numbered at all
 * @param numberingTemplate template for numbered chapter headers
 * @param nbChar character inserted where a non-breaking space belongs
 * @param autoclean whether text runs are cleaned while parsing
 * @param verbose whether to report rendering details
 * @param epubVersion EPUB packaging version, 2 or 3
 * @param epubCss optional EPUB stylesheet override
 * @param epubTemplate optional EPUB package document template override
 * @param htmlCss optional HTML stylesheet override
 * @param htmlTemplate optional HTML page template override
 * @param texTemplate optional LaTeX template override
 * @param texCommand command turning LaTeX into PDF
 * @param tempDir directory for intermediate files
 */
public record BookOptions(
    boolean numbering,
    String numberingTemplate,
    char nbChar,
    boolean autoclean,
    boolean verbose,
    int epubVersion,
    String epubCss,
    String epubTemplate,
    String htmlCss,
    String htmlTemplate,
    String texTemplate,
    String texCommand,
    String tempDir
) {
    public static final String DEFAULT_NUMBERING_TEMPLATE = "{{number}}. {{title}}";
    public static final String DEFAULT_TEX_COMMAND = "pdflatex";

    /**
     * Compact constructor applying defaults and validating the EPUB version.
     */
    public BookOptions {
        if (numberingTemplate == null) {
            numberingTemplate = DEFAULT_NUMBERING_TEMPLATE;
        }
        if (epubVersion != 2 && epubVersion != 3) {
            throw new IllegalArgumentException("epubVersion must be 2 or 3: " + epubVersion);
        }
        if (texCommand == null || texCommand.isBlank()) {
            texCommand = DEFAULT_TEX_COMMAND;
        }
        if (tempDir == null || tempDir.isBlank()) {
            tempDir = ".";
        }
    }

    /**
     * Creates the default options: numbering on, autoclean on, EPUB 2, {@code pdflatex}.
     *
     * @return default options
     */
    public static BookOptions defaults() {
        return new BookOptions(true, DEFAULT_NUMBERING_TEMPLATE, ' ', true, false, 2,
            null, null, null, null, null, DEFAULT_TEX_COMMAND, ".");
    }

    public Optional<String> epubCssOverride() {
        return Optional.ofNullable(epubCss);
    }

    public Optional<String> epubTemplateOverride() {
        return Optional.ofNullable(epubTemplate);
    }

    public Optional<String> htmlCssOverride() {
        return Optional.ofNullable(htmlCss);
    }

    public Optional<String> htmlTemplateOverride() {
        return Optional.ofNullable(htmlTemplate);
    }

    public Optional<String> texTemplateOverride() {
        return Optional.ofNullable(texTemplate);
    }

    /**
     * Returns a copy with a different EPUB version.
     *
     * @param version 2 or 3
     * @return updated options
     */
    public BookOptions withEpubVersion(int version) {
        return new BookOptions(numbering, numberingTemplate, nbChar, autoclean, verbose, version,
            epubCss, epubTemplate, htmlCss, htmlTemplate, texTemplate, texCommand, tempDir);
    }

    /**
     * Returns a copy with numbering switched on or off.
     *
     * @param enabled whether chapters are numbered
     * @return updated options
     */
    public BookOptions withNumbering(boolean enabled) {
        return new BookOptions(enabled, numberingTemplate, nbChar, autoclean, verbose, epubVersion,
            epubCss, epubTemplate, htmlCss, htmlTemplate, texTemplate, texCommand, tempDir);
    }
}
