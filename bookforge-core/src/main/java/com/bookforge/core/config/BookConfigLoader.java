package com.bookforge.core.config;

import com.bookforge.core.book.BookMetadata;
import com.bookforge.core.book.BookOptions;
import com.bookforge.core.book.ChapterNumber;
import com.bookforge.core.error.ConfigException;
import com.bookforge.core.error.ResourceNotFoundException;
import com.bookforge.core.util.FileUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads book configuration files.
 *
 * <p>Two syntaxes are accepted:
 * <ul>
 *   <li><b>{@code .book}</b> (any extension other than YAML) - one directive per line:
 *     {@code option: value}, {@code + file} (numbered), {@code - file} (unnumbered),
 *     {@code ! file} (hidden), {@code N. file} (numbered N). Blank lines and lines
 *     starting with {@code #} are ignored.</li>
 *   <li><b>YAML</b> ({@code .yaml}, {@code .yml}) - read with Jackson: a mapping of the
 *     same option names to scalars, plus a {@code chapters} list of chapter directives.</li>
 * </ul>
 *
 * <p>Option names accept either {@code _} or {@code -} as separator. Relative paths are
 * resolved against the configuration file's directory; the process working directory
 * is never changed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * BookConfig config = BookConfigLoader.load(Paths.get("novel/novel.book"));
 * Book book = new BookLoader().load(config);
 * }</pre>
 */
public class BookConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(BookConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Option keys understood by the loader, in documentation order.
     */
    public static final List<String> OPTIONS = List.of(
        "author", "title", "lang", "description", "subject", "cover",
        "numbering", "numbering_template", "autoclean", "nb_char", "verbose",
        "temp_dir", "tex_command", "tex_template",
        "epub_version", "epub_css", "epub_template",
        "html_css", "html_template",
        "output_epub", "output_html", "output_tex", "output_pdf", "output_odt"
    );

    private BookConfigLoader() {
        // Utility class
    }

    /**
     * Loads a configuration file, choosing the syntax from its extension.
     *
     * @param configPath path to the configuration file
     * @return loaded configuration with absolute paths
     * @throws ResourceNotFoundException if the file does not exist
     * @throws ConfigException if the file is unreadable or contains invalid directives
     */
    public static BookConfig load(Path configPath) throws ResourceNotFoundException, ConfigException {
        Path absolute = configPath.toAbsolutePath().normalize();
        Path baseDirectory = absolute.getParent() != null ? absolute.getParent() : absolute;

        String content;
        try {
            content = Files.readString(absolute, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new ResourceNotFoundException(absolute, e);
        } catch (CharacterCodingException e) {
            throw new ConfigException("file contains invalid UTF-8, could not parse it", absolute.toString(), e);
        } catch (IOException e) {
            throw new ConfigException("file could not be read", absolute.toString(), e);
        }

        log.debug("Loading configuration from: {}", absolute);
        String extension = FileUtils.getExtension(absolute).toLowerCase(Locale.ROOT);
        BookConfig config = extension.equals("yaml") || extension.equals("yml")
            ? parseYaml(content, baseDirectory)
            : parse(content, baseDirectory);
        log.info("Loaded configuration from: {} ({} chapters)", absolute, config.chapters().size());
        return config;
    }

    /**
     * Parses configuration text in the line syntax.
     *
     * @param content configuration text
     * @param baseDirectory directory against which relative paths resolve
     * @return parsed configuration
     * @throws ConfigException on the first invalid line
     */
    public static BookConfig parse(String content, Path baseDirectory) throws ConfigException {
        Builder builder = new Builder(baseDirectory);
        for (String rawLine : content.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (isChapterDirective(line)) {
                builder.addChapter(line);
            } else {
                int colon = line.indexOf(':');
                if (colon < 0) {
                    throw new ConfigException("option setting must be of the form option: value", line);
                }
                builder.setOption(line.substring(0, colon).trim(), line.substring(colon + 1).trim(), line);
            }
        }
        return builder.build();
    }

    /**
     * Parses configuration text in the YAML syntax.
     *
     * @param content YAML text
     * @param baseDirectory directory against which relative paths resolve
     * @return parsed configuration
     * @throws ConfigException if the YAML is malformed or contains invalid options
     */
    public static BookConfig parseYaml(String content, Path baseDirectory) throws ConfigException {
        Map<String, Object> root;
        try {
            root = YAML_MAPPER.readValue(content, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new ConfigException("could not parse YAML configuration: " + e.getOriginalMessage(), null, e);
        }

        Builder builder = new Builder(baseDirectory);
        if (root == null) {
            return builder.build();
        }
        for (Map.Entry<String, Object> entry : root.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (normalizeKey(key).equals("chapters")) {
                if (!(value instanceof List<?> list)) {
                    throw new ConfigException("chapters must be a list of chapter directives", key);
                }
                for (Object directive : list) {
                    String line = String.valueOf(directive).trim();
                    if (!isChapterDirective(line)) {
                        throw new ConfigException("invalid chapter directive", line);
                    }
                    builder.addChapter(line);
                }
            } else if (value instanceof Map<?, ?> || value instanceof List<?>) {
                throw new ConfigException("option value must be a scalar", key);
            } else {
                String text = value == null ? "" : String.valueOf(value);
                builder.setOption(key, text, key + ": " + text);
            }
        }
        return builder.build();
    }

    private static boolean isChapterDirective(String line) {
        char first = line.charAt(0);
        return first == '+' || first == '-' || first == '!' || Character.isDigit(first);
    }

    private static String normalizeKey(String key) {
        return key.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }

    /**
     * Accumulates options and chapters while a file is being read.
     */
    private static final class Builder {

        private final Path baseDirectory;
        private final Map<OutputFormat, Path> outputs = new EnumMap<>(OutputFormat.class);
        private final List<ChapterEntry> chapters = new ArrayList<>();

        private String lang;
        private String author;
        private String title;
        private String description;
        private String subject;
        private String cover;

        private boolean numbering = true;
        private String numberingTemplate = BookOptions.DEFAULT_NUMBERING_TEMPLATE;
        private char nbChar = ' ';
        private boolean autoclean = true;
        private boolean verbose;
        private int epubVersion = 2;
        private String epubCss;
        private String epubTemplate;
        private String htmlCss;
        private String htmlTemplate;
        private String texTemplate;
        private String texCommand = BookOptions.DEFAULT_TEX_COMMAND;
        private String tempDir = ".";

        Builder(Path baseDirectory) {
            this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
        }

        void addChapter(String line) throws ConfigException {
            char first = line.charAt(0);
            if (first == '-') {
                chapters.add(new ChapterEntry(ChapterNumber.unnumbered(), resolve(filename(line.substring(1), line))));
            } else if (first == '+') {
                chapters.add(new ChapterEntry(ChapterNumber.automatic(), resolve(filename(line.substring(1), line))));
            } else if (first == '!') {
                chapters.add(new ChapterEntry(ChapterNumber.hidden(), resolve(filename(line.substring(1), line))));
            } else {
                int separator = indexOfAny(line, ".:+");
                if (separator < 0) {
                    throw new ConfigException("ill-formatted line specifying chapter number", line);
                }
                int number;
                try {
                    number = Integer.parseInt(line.substring(0, separator).trim());
                } catch (NumberFormatException e) {
                    throw new ConfigException("error parsing integer", line, e);
                }
                String file = filename(line.substring(separator + 1), line);
                chapters.add(new ChapterEntry(ChapterNumber.specified(number), resolve(file)));
            }
        }

        void setOption(String rawKey, String value, String line) throws ConfigException {
            String key = normalizeKey(rawKey);
            switch (key) {
                case "author" -> author = value;
                case "title" -> title = value;
                case "lang" -> lang = value;
                case "description" -> description = value;
                case "subject" -> subject = value;
                case "cover" -> cover = value;
                case "numbering" -> numbering = parseBoolean(value, line);
                case "numbering_template" -> numberingTemplate = value;
                case "autoclean" -> autoclean = parseBoolean(value, line);
                case "nb_char" -> nbChar = parseChar(value, line);
                case "verbose" -> verbose = parseBoolean(value, line);
                case "temp_dir" -> tempDir = value;
                case "tex_command" -> texCommand = value;
                case "tex_template" -> texTemplate = value;
                case "epub_version" -> epubVersion = switch (value) {
                    case "2" -> 2;
                    case "3" -> 3;
                    default -> throw new ConfigException("epub_version must either be 2 or 3", line);
                };
                case "epub_css" -> epubCss = value;
                case "epub_template" -> epubTemplate = value;
                case "html_css" -> htmlCss = value;
                case "html_template" -> htmlTemplate = value;
                default -> {
                    OutputFormat format = outputFormatFor(key);
                    if (format == null) {
                        throw new ConfigException("unrecognized option", line);
                    }
                    if (value.isEmpty()) {
                        throw new ConfigException("output path must not be empty", line);
                    }
                    outputs.put(format, resolve(value));
                }
            }
        }

        BookConfig build() {
            BookMetadata metadata = new BookMetadata(lang, author, title, description, subject, cover);
            BookOptions options = new BookOptions(numbering, numberingTemplate, nbChar, autoclean, verbose,
                epubVersion, epubCss, epubTemplate, htmlCss, htmlTemplate, texTemplate, texCommand, tempDir);
            return new BookConfig(metadata, options, outputs, chapters, baseDirectory);
        }

        private Path resolve(String file) {
            return baseDirectory.resolve(file).normalize();
        }

        private static OutputFormat outputFormatFor(String key) {
            for (OutputFormat format : OutputFormat.values()) {
                if (format.getOptionKey().equals(key)) {
                    return format;
                }
            }
            return null;
        }

        private static String filename(String rest, String line) throws ConfigException {
            String[] words = rest.trim().split("\\s+");
            if (words.length == 0 || words[0].isEmpty()) {
                throw new ConfigException("no chapter name specified", line);
            }
            if (words.length > 1) {
                throw new ConfigException("chapter filenames must not contain whitespace", line);
            }
            return words[0];
        }

        private static int indexOfAny(String s, String chars) {
            for (int i = 0; i < s.length(); i++) {
                if (chars.indexOf(s.charAt(i)) >= 0) {
                    return i;
                }
            }
            return -1;
        }

        private static boolean parseBoolean(String value, String line) throws ConfigException {
            return switch (value.toLowerCase(Locale.ROOT)) {
                case "true" -> true;
                case "false" -> false;
                default -> throw new ConfigException("could not parse bool", line);
            };
        }

        private static char parseChar(String value, String line) throws ConfigException {
            String[] parts = value.trim().split("'", -1);
            if (parts.length != 3 || parts[1].length() != 1) {
                throw new ConfigException("could not parse char", line);
            }
            return parts[1].charAt(0);
        }
    }
}
