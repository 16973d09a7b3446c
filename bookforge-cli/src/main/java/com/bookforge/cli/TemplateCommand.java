package com.bookforge.cli;

import com.bookforge.core.template.Templates;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Command to print a built-in template, as a starting point for an override.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * bookforge template html/stylesheet.css > my.css
 * }</pre>
 */
@Command(
    name = "template",
    description = "Print a built-in template",
    mixinStandardHelpOptions = true
)
public class TemplateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TemplateCommand.class);

    @Parameters(index = "0", description = "Template name, e.g. html/template.html")
    private String name;

    @Override
    public Integer call() {
        if (!Templates.BUILTIN_NAMES.contains(name)) {
            log.error("Unknown template: {}", name);
            System.err.println("✗ Unknown template: " + name);
            System.err.println("  Available templates:");
            Templates.BUILTIN_NAMES.forEach(n -> System.err.println("    - " + n));
            return 1;
        }
        System.out.print(Templates.builtin(name));
        return 0;
    }
}
