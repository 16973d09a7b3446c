package com.bookforge.cli;

import com.bookforge.core.config.BookConfigLoader;
import com.bookforge.core.publish.BookPublisher;
import com.bookforge.core.renderer.BookRenderer;
import com.bookforge.core.template.Templates;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list available renderers, configuration options or built-in templates.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List everything
 * bookforge list
 *
 * # List renderers only
 * bookforge list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available renderers, configuration options or templates",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        arity = "0..1",
        defaultValue = "all",
        description = "Type to list: renderers, options, templates or all"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "renderers", "renderer" -> listRenderers();
            case "options", "option" -> listOptions();
            case "templates", "template" -> listTemplates();
            case "all" -> {
                listRenderers();
                listOptions();
                yield listTemplates();
            }
            default -> {
                log.error("Unknown type: {}. Use: renderers, options, templates or all", type);
                yield 1;
            }
        };
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        List<BookRenderer> renderers = BookPublisher.discoverRenderers();
        for (BookRenderer renderer : renderers) {
            System.out.printf("  • %s (ID: %s)%n", renderer.getDisplayName(), renderer.getId());
            System.out.printf("    Option: %s%n", renderer.getFormat().getOptionKey());
            System.out.println();
        }

        if (renderers.isEmpty()) {
            System.out.println("  No renderers found.");
            System.out.println();
        }
        return 0;
    }

    private int listOptions() {
        System.out.println("Configuration Options:");
        System.out.println();
        for (String option : BookConfigLoader.OPTIONS) {
            System.out.printf("  • %s%n", option);
        }
        System.out.println();
        return 0;
    }

    private int listTemplates() {
        System.out.println("Built-in Templates:");
        System.out.println();
        for (String name : Templates.BUILTIN_NAMES) {
            System.out.printf("  • %s%n", name);
        }
        System.out.println();
        return 0;
    }
}
