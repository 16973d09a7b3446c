package com.bookforge.cli;

import com.bookforge.BookForgeCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests of the bookforge commands, run in-process through picocli.
 */
@DisplayName("BookForge CLI")
class BookForgeCLITest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private int run(String... args) {
        return BookForgeCLI.commandLine().execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private Path writeBook(String config) throws Exception {
        Files.writeString(tempDir.resolve("intro.md"), "# Introduction\n\nHello, world.\n");
        Files.writeString(tempDir.resolve("storm.md"), "# The Storm\n\nRain[^1].\n\n[^1]: Heavy rain.\n");
        Path book = tempDir.resolve("novel.book");
        Files.writeString(book, config);
        return book;
    }

    @Test
    @DisplayName("render writes every configured format and exits 0")
    void render_writesConfiguredFormats() throws Exception {
        Path book = writeBook("""
            title: Novel
            output_html: out/novel.html
            output_epub: out/novel.epub
            - intro.md
            + storm.md
            """);

        int exitCode = run("-q", "render", book.toString());

        assertThat(exitCode).isZero();
        assertThat(tempDir.resolve("out/novel.epub")).exists();
        assertThat(tempDir.resolve("out/novel.html")).content(StandardCharsets.UTF_8)
            .contains("<h1>Introduction</h1>", "<h1>1. The Storm</h1>", "<p>Hello, world.</p>");
        assertThat(stdout()).contains("✓ Render complete");
    }

    @Test
    @DisplayName("render --format restricts output to the selected format")
    void render_withFormatOption_rendersOnlyThatFormat() throws Exception {
        Path book = writeBook("output_html: novel.html\noutput_odt: novel.odt\n+ intro.md\n");

        int exitCode = run("-q", "render", "-f", "odt", book.toString());

        assertThat(exitCode).isZero();
        assertThat(tempDir.resolve("novel.odt")).exists();
        assertThat(tempDir.resolve("novel.html")).doesNotExist();
    }

    @Test
    @DisplayName("render rejects a format without a configured output")
    void render_withUnconfiguredFormat_fails() throws Exception {
        Path book = writeBook("output_html: novel.html\n+ intro.md\n");

        assertThat(run("-q", "render", "-f", "epub", book.toString())).isEqualTo(1);
        assertThat(stderr()).contains("No output path configured for epub");
    }

    @Test
    @DisplayName("render with no outputs warns and exits 0")
    void render_withoutOutputs_warnsAndSucceeds() throws Exception {
        Path book = writeBook("title: Novel\n+ intro.md\n");

        assertThat(run("-q", "render", book.toString())).isZero();
        assertThat(stderr()).contains("No output format configured");
    }

    @Test
    @DisplayName("render reports a failed format and exits 1 while others are written")
    void render_withFailingFormat_exitsWithError() throws Exception {
        Path book = writeBook("cover: missing.png\noutput_epub: novel.epub\noutput_html: novel.html\n+ intro.md\n");

        int exitCode = run("-q", "render", book.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(tempDir.resolve("novel.html")).exists();
        assertThat(tempDir.resolve("novel.epub")).doesNotExist();
        assertThat(stderr()).contains("✗ epub:", "missing.png");
    }

    @Test
    @DisplayName("render reports configuration errors with the offending line")
    void render_withInvalidConfig_fails() throws Exception {
        Path book = writeBook("numbering: maybe\n+ intro.md\n");

        assertThat(run("-q", "render", book.toString())).isEqualTo(1);
        assertThat(stderr()).contains("could not parse bool: numbering: maybe");
    }

    @Test
    @DisplayName("render reports a missing chapter file")
    void render_withMissingChapter_fails() throws Exception {
        Path book = writeBook("output_html: novel.html\n+ nowhere.md\n");

        assertThat(run("-q", "render", book.toString())).isEqualTo(1);
        assertThat(stderr()).contains("nowhere.md");
    }

    @Test
    @DisplayName("check lists chapters with their resolved headers")
    void check_listsChapters() throws Exception {
        Files.writeString(tempDir.resolve("dedication.md"), "For you.\n");
        Path book = writeBook("- intro.md\n! dedication.md\n3. storm.md\n");

        int exitCode = run("-q", "check", book.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains(
            "1. intro.md -> Introduction",
            "2. dedication.md -> (hidden)",
            "3. storm.md -> 3. The Storm");
    }

    @Test
    @DisplayName("init writes a configuration that check accepts")
    void init_createsLoadableConfiguration() throws Exception {
        writeBook("");
        Path config = tempDir.resolve("fresh.book");

        assertThat(run("-q", "init", config.toString(), "intro.md", "storm.md")).isZero();
        assertThat(config).content().contains("output_epub: fresh.epub", "+ intro.md", "+ storm.md");
        assertThat(run("-q", "check", config.toString())).isZero();
    }

    @Test
    @DisplayName("init refuses to overwrite an existing file")
    void init_withExistingFile_fails() throws Exception {
        Path book = writeBook("+ intro.md\n");

        assertThat(run("-q", "init", book.toString(), "intro.md")).isEqualTo(1);
        assertThat(book).content(StandardCharsets.UTF_8).isEqualTo("+ intro.md\n");
    }

    @Test
    @DisplayName("init content lists chapters as numbered")
    void initContent_listsChapters() {
        String content = InitCommand.content(Path.of("my.book"), List.of("a.md", "b.md"));

        assertThat(content).contains("output_html: my.html", "+ a.md\n+ b.md\n");
    }

    @Test
    @DisplayName("list shows renderers, options and templates")
    void list_showsEverything() {
        assertThat(run("-q", "list")).isZero();

        assertThat(stdout()).contains("Available Renderers:", "(ID: epub)", "(ID: odt)",
            "Configuration Options:", "output_pdf", "Built-in Templates:", "latex/template.tex");
    }

    @Test
    @DisplayName("list rejects an unknown type")
    void list_withUnknownType_fails() {
        assertThat(run("-q", "list", "widgets")).isEqualTo(1);
    }

    @Test
    @DisplayName("template prints a built-in template")
    void template_printsBuiltin() {
        assertThat(run("-q", "template", "html/template.html")).isZero();

        assertThat(stdout()).contains("{{content}}");
    }

    @Test
    @DisplayName("template rejects an unknown name")
    void template_withUnknownName_fails() {
        assertThat(run("-q", "template", "nope.txt")).isEqualTo(1);
        assertThat(stderr()).contains("Unknown template: nope.txt", "html/stylesheet.css");
    }
}
