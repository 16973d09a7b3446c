package com.bookforge.core.config;

import com.bookforge.core.book.ChapterNumber;
import com.bookforge.core.error.ConfigException;
import com.bookforge.core.error.ResourceNotFoundException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link BookConfigLoader}.
 */
class BookConfigLoaderTest {

    @TempDir
    Path tempDir;

    private static final String LINE_CONFIG = """
        # A novel
        author: Jane Doe
        title: My Novel
        lang: fr
        numbering-template: Chapitre {{number}} : {{title}}
        nb_char: '~'
        epub_version: 3
        output_epub: build/novel.epub
        output_html: novel.html

        ! dedication.md
        - preface.md
        + chapter_01.md
        5. chapter_05.md
        + chapter_06.md
        """;

    @Test
    void parse_withAllDirectiveKinds_buildsConfig() throws ConfigException {
        // When
        BookConfig config = BookConfigLoader.parse(LINE_CONFIG, tempDir);

        // Then
        assertThat(config.metadata().author()).isEqualTo("Jane Doe");
        assertThat(config.metadata().title()).isEqualTo("My Novel");
        assertThat(config.metadata().lang()).isEqualTo("fr");
        assertThat(config.options().numberingTemplate()).isEqualTo("Chapitre {{number}} : {{title}}");
        assertThat(config.options().nbChar()).isEqualTo('~');
        assertThat(config.options().epubVersion()).isEqualTo(3);

        assertThat(config.chapters()).extracting(ChapterEntry::number).containsExactly(
            ChapterNumber.hidden(),
            ChapterNumber.unnumbered(),
            ChapterNumber.automatic(),
            ChapterNumber.specified(5),
            ChapterNumber.automatic());
        assertThat(config.chapters().get(0).file()).isEqualTo(tempDir.resolve("dedication.md").toAbsolutePath());

        assertThat(config.outputs())
            .containsOnlyKeys(OutputFormat.EPUB, OutputFormat.HTML)
            .containsEntry(OutputFormat.EPUB, tempDir.resolve("build/novel.epub").toAbsolutePath());
    }

    @Test
    void parse_withNoOptions_appliesDefaults() throws ConfigException {
        BookConfig config = BookConfigLoader.parse("+ a.md\n", tempDir);

        assertThat(config.metadata().author()).isEqualTo("Anonymous");
        assertThat(config.metadata().title()).isEqualTo("Untitled");
        assertThat(config.metadata().lang()).isEqualTo("en");
        assertThat(config.options().numbering()).isTrue();
        assertThat(config.options().autoclean()).isTrue();
        assertThat(config.options().epubVersion()).isEqualTo(2);
        assertThat(config.options().texCommand()).isEqualTo("pdflatex");
        assertThat(config.hasOutputs()).isFalse();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "1. a.md  | 1",
        "2: b.md  | 2",
        "3+ c.md  | 3",
        "10.d.md  | 10"
    })
    void parse_withNumberedChapterSeparators_acceptsEach(String line, int expected) throws ConfigException {
        BookConfig config = BookConfigLoader.parse(line, tempDir);

        assertThat(config.chapters()).singleElement()
            .extracting(ChapterEntry::number)
            .isEqualTo(ChapterNumber.specified(expected));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "colour: blue              | unrecognized option",
        "numbering: yes            | could not parse bool",
        "nb_char: ~                | could not parse char",
        "epub_version: 4           | epub_version must either be 2 or 3",
        "just some words           | option setting must be of the form option: value",
        "+                         | no chapter name specified",
        "+ two words.md            | chapter filenames must not contain whitespace",
        "1x. a.md                  | error parsing integer",
        "output_pdf:               | output path must not be empty"
    })
    void parse_withInvalidLine_reportsMessageAndLine(String line, String message) {
        assertThatThrownBy(() -> BookConfigLoader.parse("title: ok\n" + line + "\n", tempDir))
            .isInstanceOf(ConfigException.class)
            .hasMessageStartingWith(message)
            .satisfies(e -> assertThat(((ConfigException) e).getLine()).isEqualTo(line.trim()));
    }

    @Test
    void parseYaml_isEquivalentToLineSyntax() throws ConfigException {
        String yaml = """
            author: Jane Doe
            title: My Novel
            lang: fr
            numbering_template: "Chapitre {{number}} : {{title}}"
            nb_char: "'~'"
            epub-version: 3
            output_epub: build/novel.epub
            output_html: novel.html
            chapters:
              - "! dedication.md"
              - "- preface.md"
              - "+ chapter_01.md"
              - "5. chapter_05.md"
              - "+ chapter_06.md"
            """;

        BookConfig fromYaml = BookConfigLoader.parseYaml(yaml, tempDir);
        BookConfig fromLines = BookConfigLoader.parse(LINE_CONFIG, tempDir);

        assertThat(fromYaml).isEqualTo(fromLines);
    }

    @Test
    void parseYaml_withBooleanAndNumberScalars_acceptsThem() throws ConfigException {
        BookConfig config = BookConfigLoader.parseYaml("numbering: false\nautoclean: false\nepub_version: 2\n", tempDir);

        assertThat(config.options().numbering()).isFalse();
        assertThat(config.options().autoclean()).isFalse();
    }

    @Test
    void parseYaml_withNonListChapters_throwsConfigException() {
        assertThatThrownBy(() -> BookConfigLoader.parseYaml("chapters: intro.md\n", tempDir))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("chapters must be a list");
    }

    @Test
    void parseYaml_withNestedOption_throwsConfigException() {
        assertThatThrownBy(() -> BookConfigLoader.parseYaml("title:\n  nested: value\n", tempDir))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("option value must be a scalar");
    }

    @Test
    void parseYaml_withMalformedDocument_throwsConfigException() {
        assertThatThrownBy(() -> BookConfigLoader.parseYaml("title: [unclosed\n", tempDir))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("could not parse YAML configuration");
    }

    @Test
    void parseYaml_withPlainFileInChapters_throwsConfigException() {
        assertThatThrownBy(() -> BookConfigLoader.parseYaml("chapters:\n  - intro.md\n", tempDir))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("invalid chapter directive");
    }

    @Test
    void load_withMissingFile_throwsResourceNotFound() {
        assertThatThrownBy(() -> BookConfigLoader.load(tempDir.resolve("missing.book")))
            .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void load_resolvesPathsAgainstConfigDirectory() throws Exception {
        Path bookDir = Files.createDirectories(tempDir.resolve("novel"));
        Path configFile = bookDir.resolve("novel.book");
        Files.writeString(configFile, "output_html: out/novel.html\n+ ch1.md\n");

        BookConfig config = BookConfigLoader.load(configFile);

        assertThat(config.baseDirectory()).isEqualTo(bookDir.toAbsolutePath().normalize());
        assertThat(config.chapters().get(0).file()).isEqualTo(bookDir.resolve("ch1.md").toAbsolutePath().normalize());
        assertThat(config.outputs().get(OutputFormat.HTML))
            .isEqualTo(bookDir.resolve("out/novel.html").toAbsolutePath().normalize());
    }

    @Test
    void load_withYamlExtension_usesYamlSyntax() throws Exception {
        Path configFile = tempDir.resolve("book.yaml");
        Files.writeString(configFile, "title: Yaml Book\nchapters:\n  - \"+ ch1.md\"\n");

        BookConfig config = BookConfigLoader.load(configFile);

        assertThat(config.metadata().title()).isEqualTo("Yaml Book");
        assertThat(config.chapters()).hasSize(1);
    }
}
