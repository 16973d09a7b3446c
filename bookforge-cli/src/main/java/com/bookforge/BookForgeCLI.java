package com.bookforge;

import com.bookforge.cli.CheckCommand;
import com.bookforge.cli.InitCommand;
import com.bookforge.cli.ListCommand;
import com.bookforge.cli.RenderCommand;
import com.bookforge.cli.TemplateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for BookForge.
 *
 * <p>BookForge converts a manuscript made of Markdown chapters and a book configuration
 * file into EPUB, HTML, LaTeX, PDF and ODT.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Render every configured output format</li>
 *   <li>{@code check} - Parse the book and show chapter numbering</li>
 *   <li>{@code init} - Create a new book configuration file</li>
 *   <li>{@code list} - List available renderers and configuration options</li>
 *   <li>{@code template} - Print a built-in template</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Create a configuration listing two chapters
 * bookforge init novel.book intro.md chapter_01.md
 *
 * # Render all configured formats
 * bookforge render novel.book
 *
 * # Render only EPUB, with debug logging
 * bookforge -v render novel.book -f epub
 * }</pre>
 */
@Command(
    name = "bookforge",
    mixinStandardHelpOptions = true,
    version = "BookForge 1.0.0-SNAPSHOT",
    description = "Renders Markdown manuscripts to EPUB, HTML, LaTeX, PDF and ODT",
    subcommands = {
        RenderCommand.class,
        CheckCommand.class,
        InitCommand.class,
        ListCommand.class,
        TemplateCommand.class
    }
)
public class BookForgeCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BookForgeCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("BookForge - Markdown to EPUB, HTML, LaTeX, PDF and ODT");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'bookforge --help' to see available commands");
        System.out.println("Use 'bookforge <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        BookForgeCLI cli = new BookForgeCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
