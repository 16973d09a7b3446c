package com.bookforge.core.renderer.impl;

import com.bookforge.core.book.Book;
import com.bookforge.core.config.OutputFormat;
import com.bookforge.core.error.RenderException;
import com.bookforge.core.renderer.BinaryArtifact;
import com.bookforge.core.renderer.BookRenderer;
import com.bookforge.core.renderer.RenderContext;
import com.bookforge.core.renderer.RenderedArtifact;
import com.bookforge.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Produces a PDF by running the configured LaTeX command on the LaTeX rendering.
 *
 * <p>The source is written to a fresh directory under {@code temp_dir} and the command
 * runs twice in that directory so the table of contents is filled in. The directory is
 * removed afterwards whatever the outcome.
 */
public class PdfRenderer implements BookRenderer {

    private static final Logger log = LoggerFactory.getLogger(PdfRenderer.class);

    private static final String FORMAT = "pdf";
    private static final String SOURCE_NAME = "book.tex";
    private static final String PDF_NAME = "book.pdf";
    private static final int PASSES = 2;
    private static final int OUTPUT_TAIL_LINES = 20;

    private final LatexRenderer latex = new LatexRenderer();

    @Override
    public String getId() {
        return FORMAT;
    }

    @Override
    public String getDisplayName() {
        return "PDF (via LaTeX)";
    }

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.PDF;
    }

    @Override
    public RenderedArtifact render(RenderContext context) throws RenderException {
        Book book = context.book();
        String source = latex.renderSource(context, FORMAT);

        Path workDir;
        try {
            Path tempRoot = book.resolve(book.options().tempDir());
            Files.createDirectories(tempRoot);
            workDir = Files.createTempDirectory(tempRoot, "bookforge-");
        } catch (IOException e) {
            throw new RenderException(FORMAT, "could not create temporary directory", e);
        }

        try {
            Files.writeString(workDir.resolve(SOURCE_NAME), source, StandardCharsets.UTF_8);
            List<String> command = new ArrayList<>(Arrays.asList(book.options().texCommand().trim().split("\\s+")));
            command.add(SOURCE_NAME);

            for (int pass = 1; pass <= PASSES; pass++) {
                log.debug("Running {} (pass {}/{}) in {}", command, pass, PASSES, workDir);
                run(command, workDir);
            }

            Path pdf = workDir.resolve(PDF_NAME);
            if (!Files.isRegularFile(pdf)) {
                throw new RenderException(FORMAT, "'" + book.options().texCommand() + "' did not produce " + PDF_NAME);
            }
            return new BinaryArtifact("application/pdf", Files.readAllBytes(pdf));
        } catch (IOException e) {
            throw new RenderException(FORMAT, "I/O error while producing PDF: " + e.getMessage(), e);
        } finally {
            try {
                FileUtils.deleteRecursively(workDir);
            } catch (IOException e) {
                log.warn("Could not delete temporary directory {}: {}", workDir, e.getMessage());
            }
        }
    }

    private static void run(List<String> command, Path workDir) throws RenderException {
        Process process;
        try {
            process = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true)
                .start();
        } catch (IOException e) {
            throw new RenderException(FORMAT, "could not run '" + String.join(" ", command) + "': " + e.getMessage(), e);
        }

        String output;
        int status;
        try {
            process.getOutputStream().close();
            try (InputStream in = process.getInputStream()) {
                output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            status = process.waitFor();
        } catch (IOException e) {
            process.destroyForcibly();
            throw new RenderException(FORMAT, "error reading output of '" + command.get(0) + "'", e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new RenderException(FORMAT, "interrupted while running '" + command.get(0) + "'", e);
        }

        if (status != 0) {
            throw new RenderException(FORMAT, "'" + String.join(" ", command) + "' exited with status "
                + status + tail(output));
        }
    }

    static String tail(String output) {
        if (output.isBlank()) {
            return "";
        }
        String[] lines = output.split("\\R");
        int from = Math.max(0, lines.length - OUTPUT_TAIL_LINES);
        return ":\n" + String.join("\n", Arrays.asList(lines).subList(from, lines.length));
    }
}
