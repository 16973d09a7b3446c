package com.bookforge.core.renderer.impl;

import com.bookforge.core.book.Book;
import com.bookforge.core.book.BookMetadata;
import com.bookforge.core.book.BookOptions;
import com.bookforge.core.book.ChapterNumber;
import com.bookforge.core.error.RenderException;
import com.bookforge.core.renderer.BinaryArtifact;
import com.bookforge.core.renderer.RenderContext;
import com.bookforge.core.renderer.RendererTestBase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Functional tests for {@link PdfRenderer}, driving small shell scripts in place of a TeX engine.
 */
@DisabledOnOs(OS.WINDOWS)
class PdfRendererTest extends RendererTestBase {

    private final PdfRenderer renderer = new PdfRenderer();

    private Book bookWithCommand(String texCommand) {
        BookOptions options = new BookOptions(true, null, ' ', true, false, 2,
            null, null, null, null, null, texCommand, "work");
        return book(BookMetadata.defaults(), options, List.of(chapter(
            ChapterNumber.automatic(), "# One\n\nText.\n")));
    }

    @Test
    void render_withSucceedingCommand_returnsProducedPdf() throws Exception {
        // Given
        Path script = writeFile("fake-tex.sh", "cp \"$1\" \"${1%.tex}.pdf\"\n");

        // When
        BinaryArtifact artifact = (BinaryArtifact) renderer.render(RenderContext.of(bookWithCommand("sh " + script)));

        // Then
        assertThat(artifact.mediaType()).isEqualTo("application/pdf");
        assertThat(new String(artifact.bytes(), StandardCharsets.UTF_8)).contains("\\chapter*{1. One}");
    }

    @Test
    void render_removesWorkingDirectoryAfterwards() throws Exception {
        Path script = writeFile("fake-tex.sh", "cp \"$1\" \"${1%.tex}.pdf\"\n");

        renderer.render(RenderContext.of(bookWithCommand("sh " + script)));

        try (Stream<Path> leftovers = Files.list(tempDir.resolve("work"))) {
            assertThat(leftovers).isEmpty();
        }
    }

    @Test
    void render_withFailingCommand_reportsStatusAndOutput() throws Exception {
        Path script = writeFile("broken-tex.sh", "echo '! Undefined control sequence.'\nexit 3\n");

        assertThatThrownBy(() -> renderer.render(RenderContext.of(bookWithCommand("sh " + script))))
            .isInstanceOf(RenderException.class)
            .hasMessageStartingWith("[pdf]")
            .hasMessageContaining("exited with status 3")
            .hasMessageContaining("Undefined control sequence");
    }

    @Test
    void render_withCommandProducingNothing_fails() {
        assertThatThrownBy(() -> renderer.render(RenderContext.of(bookWithCommand("true"))))
            .isInstanceOf(RenderException.class)
            .hasMessageContaining("did not produce book.pdf");
    }

    @Test
    void render_withMissingCommand_fails() {
        assertThatThrownBy(() -> renderer.render(RenderContext.of(bookWithCommand("no-such-tex-engine-here"))))
            .isInstanceOf(RenderException.class)
            .hasMessageContaining("could not run 'no-such-tex-engine-here book.tex'");
    }

    @Test
    void tail_keepsLastTwentyLines() {
        StringBuilder output = new StringBuilder();
        for (int i = 1; i <= 30; i++) {
            output.append("line ").append(i).append('\n');
        }

        String tail = PdfRenderer.tail(output.toString());

        assertThat(tail).startsWith(":\nline 11\n").endsWith("line 30").doesNotContain("line 10\n");
        assertThat(PdfRenderer.tail("  ")).isEmpty();
    }
}
