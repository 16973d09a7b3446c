package com.bookforge.cli;

import com.bookforge.core.book.Book;
import com.bookforge.core.book.BookLoader;
import com.bookforge.core.config.BookConfig;
import com.bookforge.core.config.BookConfigLoader;
import com.bookforge.core.config.OutputFormat;
import com.bookforge.core.publish.BookPublisher;
import com.bookforge.core.publish.FormatOutcome;
import com.bookforge.core.publish.PublishReport;
import com.bookforge.BookForgeCLI;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to render a book to its configured output formats.
 *
 * <p>Every selected format is attempted even if another one fails; the command exits
 * with status 1 if any format failed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Render every output_* path set in the configuration
 * bookforge render novel.book
 *
 * # Render only HTML and ODT
 * bookforge render novel.book -f html -f odt
 * }</pre>
 */
@Command(
    name = "render",
    description = "Render a book to its configured output formats",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    @Parameters(index = "0", description = "Book configuration file (.book, .yaml or .yml)")
    private Path bookFile;

    @Option(
        names = {"-f", "--format"},
        description = "Render only this format (epub, html, tex, pdf, odt); repeatable"
    )
    private List<String> formats;

    @ParentCommand
    private BookForgeCLI parent;

    @Override
    public Integer call() {
        try {
            log.info("Rendering book: {}", bookFile.toAbsolutePath());
            BookConfig config = BookConfigLoader.load(bookFile);
            if (config.options().verbose() && (parent == null || !parent.isQuiet())) {
                ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.bookforge")).setLevel(Level.DEBUG);
            }

            Optional<Map<OutputFormat, Path>> selected = selectOutputs(config);
            if (selected.isEmpty()) {
                return 1;
            }
            Map<OutputFormat, Path> outputs = selected.get();
            if (outputs.isEmpty()) {
                System.err.println("⚠ No output format configured (set output_epub, output_html, ...), nothing rendered");
                log.warn("No output format configured in {}", bookFile);
                return 0;
            }

            Book book = new BookLoader().load(config);
            System.out.println("✓ Parsed " + book.chapters().size() + " chapters");

            PublishReport report = new BookPublisher().publish(book, outputs);
            for (FormatOutcome outcome : report.outcomes()) {
                if (outcome.isSuccess()) {
                    System.out.printf("✓ %s: %s (%d bytes)%n", outcome.format().getId(), outcome.output(), outcome.bytes());
                } else {
                    System.err.printf("✗ %s: %s%n", outcome.format().getId(), outcome.message());
                }
            }

            if (!report.isSuccess()) {
                System.err.println("✗ Render failed for " + report.failures().size() + " of "
                    + report.outcomes().size() + " formats");
                return 1;
            }
            System.out.println("✓ Render complete");
            return 0;

        } catch (Exception e) {
            log.error("Render failed", e);
            System.err.println("✗ Render failed: " + e.getMessage());
            return 1;
        }
    }

    private Optional<Map<OutputFormat, Path>> selectOutputs(BookConfig config) {
        if (formats == null || formats.isEmpty()) {
            return Optional.of(config.outputs());
        }
        Map<OutputFormat, Path> outputs = new EnumMap<>(OutputFormat.class);
        for (String id : formats) {
            Optional<OutputFormat> format = OutputFormat.fromId(id);
            if (format.isEmpty()) {
                System.err.println("✗ Unknown format: " + id + ". Use: epub, html, tex, pdf or odt");
                return Optional.empty();
            }
            Path output = config.outputs().get(format.get());
            if (output == null) {
                System.err.println("✗ No output path configured for " + id + " (set " + format.get().getOptionKey() + ")");
                return Optional.empty();
            }
            outputs.put(format.get(), output);
        }
        return Optional.of(outputs);
    }
}
