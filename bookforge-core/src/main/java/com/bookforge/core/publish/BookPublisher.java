package com.bookforge.core.publish;

import com.bookforge.core.book.Book;
import com.bookforge.core.config.OutputFormat;
import com.bookforge.core.renderer.BookRenderer;
import com.bookforge.core.renderer.RenderContext;
import com.bookforge.core.renderer.RenderedArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Renders a book to every requested format and writes the artifacts.
 *
 * <p>Each format is an independent task on a fixed thread pool; tasks share only the
 * immutable {@link Book} and {@link RenderContext}. Every format is attempted: a failure
 * in one is recorded in the report and does not stop the others. Artifacts already
 * written are kept when another format fails.
 */
public class BookPublisher {

    private static final Logger log = LoggerFactory.getLogger(BookPublisher.class);

    private final Map<OutputFormat, BookRenderer> renderers;
    private final ArtifactWriter writer;

    /**
     * Creates a publisher using the renderers registered through {@link ServiceLoader}.
     */
    public BookPublisher() {
        this(discoverRenderers(), new ArtifactWriter());
    }

    public BookPublisher(List<BookRenderer> renderers, ArtifactWriter writer) {
        this.renderers = new EnumMap<>(OutputFormat.class);
        for (BookRenderer renderer : renderers) {
            this.renderers.putIfAbsent(renderer.getFormat(), renderer);
        }
        this.writer = writer;
    }

    /**
     * Discovers renderers via ServiceLoader.
     *
     * @return list of discovered renderers
     */
    public static List<BookRenderer> discoverRenderers() {
        log.debug("Discovering renderers via ServiceLoader");
        List<BookRenderer> discovered = new ArrayList<>();
        ServiceLoader.load(BookRenderer.class).forEach(discovered::add);
        log.debug("Discovered {} renderers", discovered.size());
        return discovered;
    }

    public Optional<BookRenderer> rendererFor(OutputFormat format) {
        return Optional.ofNullable(renderers.get(format));
    }

    /**
     * Publishes a book.
     *
     * @param book parsed book
     * @param outputs output path per format
     * @return outcome of every format, in {@link OutputFormat} order
     */
    public PublishReport publish(Book book, Map<OutputFormat, Path> outputs) {
        if (outputs.isEmpty()) {
            log.warn("No output format configured, nothing to render");
            return new PublishReport(List.of());
        }

        RenderContext context = RenderContext.of(book);
        Map<OutputFormat, Path> ordered = new EnumMap<>(outputs);
        ExecutorService executor = Executors.newFixedThreadPool(ordered.size());
        try {
            Map<OutputFormat, Future<FormatOutcome>> futures = new LinkedHashMap<>();
            for (Map.Entry<OutputFormat, Path> entry : ordered.entrySet()) {
                futures.put(entry.getKey(), executor.submit(() -> publishOne(context, entry.getKey(), entry.getValue())));
            }

            List<FormatOutcome> outcomes = new ArrayList<>();
            for (Map.Entry<OutputFormat, Future<FormatOutcome>> entry : futures.entrySet()) {
                outcomes.add(await(entry.getValue(), entry.getKey(), ordered.get(entry.getKey())));
            }
            PublishReport report = new PublishReport(outcomes);
            log.info("Published {} of {} formats", report.successes().size(), outcomes.size());
            return report;
        } finally {
            executor.shutdownNow();
        }
    }

    private FormatOutcome publishOne(RenderContext context, OutputFormat format, Path output) {
        BookRenderer renderer = renderers.get(format);
        if (renderer == null) {
            return FormatOutcome.failure(format, output,
                new IllegalStateException("No renderer available for format " + format.getId()));
        }
        try {
            log.info("Rendering {} to {}", renderer.getDisplayName(), output);
            RenderedArtifact artifact = renderer.render(context);
            long size = writer.write(artifact, output);
            return FormatOutcome.success(format, output, size);
        } catch (Exception e) {
            log.error("Rendering {} failed: {}", format.getId(), e.getMessage());
            log.debug("Rendering {} failure details", format.getId(), e);
            return FormatOutcome.failure(format, output, e);
        }
    }

    private static FormatOutcome await(Future<FormatOutcome> future, OutputFormat format, Path output) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FormatOutcome.failure(format, output, e);
        } catch (ExecutionException e) {
            return FormatOutcome.failure(format, output, e.getCause());
        }
    }
}
