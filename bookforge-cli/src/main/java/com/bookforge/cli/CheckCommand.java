package com.bookforge.cli;

import com.bookforge.core.book.Book;
import com.bookforge.core.book.BookLoader;
import com.bookforge.core.config.BookConfig;
import com.bookforge.core.config.BookConfigLoader;
import com.bookforge.core.config.OutputFormat;
import com.bookforge.core.error.RenderException;
import com.bookforge.core.renderer.RenderContext;
import com.bookforge.core.renderer.ResolvedChapter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to check a book without rendering it.
 *
 * <p>Loads the configuration, parses every chapter and prints how each chapter
 * header will be displayed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * bookforge check novel.book
 * }</pre>
 */
@Command(
    name = "check",
    description = "Parse a book and show its chapters with resolved numbering",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Parameters(index = "0", description = "Book configuration file")
    private Path bookFile;

    @Override
    public Integer call() {
        try {
            BookConfig config = BookConfigLoader.load(bookFile);
            System.out.println("✓ Configuration is valid: " + bookFile);
            System.out.printf("  Title: %s%n", config.metadata().title());
            System.out.printf("  Author: %s%n", config.metadata().author());
            System.out.printf("  Language: %s%n", config.metadata().lang());
            for (Map.Entry<OutputFormat, Path> output : config.outputs().entrySet()) {
                System.out.printf("  Output %s: %s%n", output.getKey().getId(), output.getValue());
            }
            System.out.println();

            Book book = new BookLoader().load(config);
            RenderContext context = RenderContext.of(book);
            System.out.println("Chapters:");
            for (ResolvedChapter chapter : context.chapters()) {
                System.out.printf("  %3d. %s -> %s%n", chapter.ordinal(), fileName(chapter), describe(context, chapter));
            }
            System.out.println();
            System.out.println("✓ Parsed " + book.chapters().size() + " chapters");
            return 0;

        } catch (Exception e) {
            log.error("Check failed", e);
            System.err.println("✗ Check failed: " + e.getMessage());
            return 1;
        }
    }

    private static String fileName(ResolvedChapter chapter) {
        Path source = chapter.chapter().source();
        return source == null ? "(in memory)" : String.valueOf(source.getFileName());
    }

    private static String describe(RenderContext context, ResolvedChapter chapter) throws RenderException {
        if (!chapter.display().showTitle()) {
            return "(hidden)";
        }
        if (chapter.title().isEmpty()) {
            return "(no title)";
        }
        return context.headerText(chapter, "check");
    }
}
