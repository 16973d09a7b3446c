package com.bookforge.core.config;

import java.util.Locale;
import java.util.Optional;

/**
 * Output formats a book can be published to.
 */
public enum OutputFormat {
    EPUB("epub", "output_epub"),
    HTML("html", "output_html"),
    TEX("tex", "output_tex"),
    PDF("pdf", "output_pdf"),
    ODT("odt", "output_odt");

    private final String id;
    private final String optionKey;

    OutputFormat(String id, String optionKey) {
        this.id = id;
        this.optionKey = optionKey;
    }

    /**
     * Returns the lowercase identifier used on the command line and in logs.
     *
     * @return format id
     */
    public String getId() {
        return id;
    }

    /**
     * Returns the configuration option that sets this format's output path.
     *
     * @return option key, e.g. {@code output_epub}
     */
    public String getOptionKey() {
        return optionKey;
    }

    /**
     * Looks up a format by id, case-insensitively.
     *
     * @param id format id
     * @return matching format
     */
    public static Optional<OutputFormat> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (OutputFormat format : values()) {
            if (format.id.equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
