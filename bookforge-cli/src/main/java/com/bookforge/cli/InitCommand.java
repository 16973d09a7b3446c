package com.bookforge.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to create a new book configuration file.
 *
 * <p>Refuses to overwrite an existing file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * bookforge init novel.book preface.md chapter_01.md chapter_02.md
 * }</pre>
 */
@Command(
    name = "init",
    description = "Create a book configuration file listing the given chapters",
    mixinStandardHelpOptions = true
)
public class InitCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InitCommand.class);

    @Parameters(index = "0", description = "Configuration file to create")
    private Path bookFile;

    @Parameters(index = "1..*", arity = "1..*", description = "Chapter files, in reading order")
    private List<String> chapters;

    @Override
    public Integer call() {
        if (Files.exists(bookFile)) {
            System.err.println("✗ " + bookFile + " already exists, not overwriting it");
            return 1;
        }
        for (String chapter : chapters) {
            if (chapter.isBlank() || chapter.chars().anyMatch(Character::isWhitespace)) {
                System.err.println("✗ Chapter file names must not contain whitespace: '" + chapter + "'");
                return 1;
            }
        }

        try {
            Path parent = bookFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(bookFile, content(bookFile, chapters), StandardCharsets.UTF_8);
            log.info("Created configuration file: {}", bookFile.toAbsolutePath());
            System.out.println("✓ Created " + bookFile + " with " + chapters.size() + " chapters");
            return 0;
        } catch (IOException e) {
            log.error("Failed to create configuration file", e);
            System.err.println("✗ Failed to create " + bookFile + ": " + e.getMessage());
            return 1;
        }
    }

    static String content(Path bookFile, List<String> chapters) {
        String fileName = bookFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;

        StringBuilder sb = new StringBuilder();
        sb.append("# BookForge configuration file\n")
            .append("# Options: option: value\n")
            .append("# Chapters: + file (numbered), - file (unnumbered), ! file (hidden), N. file (number N)\n")
            .append('\n')
            .append("author: Anonymous\n")
            .append("title: Untitled\n")
            .append("lang: en\n")
            .append('\n')
            .append("output_epub: ").append(stem).append(".epub\n")
            .append("output_html: ").append(stem).append(".html\n")
            .append('\n');
        for (String chapter : chapters) {
            sb.append("+ ").append(chapter).append('\n');
        }
        return sb.toString();
    }
}
