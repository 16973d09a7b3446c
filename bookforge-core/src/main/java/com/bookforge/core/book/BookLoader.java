package com.bookforge.core.book;

import com.bookforge.core.cleaner.Cleaner;
import com.bookforge.core.config.BookConfig;
import com.bookforge.core.config.ChapterEntry;
import com.bookforge.core.error.ParseException;
import com.bookforge.core.error.ResourceNotFoundException;
import com.bookforge.core.parser.MarkdownParser;
import com.bookforge.core.token.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a loaded configuration into a {@link Book} by parsing every chapter file.
 *
 * <p>Chapters are parsed sequentially, in declaration order, with the cleaner selected
 * once from the book language. The first missing or unreadable chapter aborts loading.
 */
public class BookLoader {

    private static final Logger log = LoggerFactory.getLogger(BookLoader.class);

    /**
     * Parses all chapters of a configuration.
     *
     * @param config loaded configuration
     * @return immutable book
     * @throws ResourceNotFoundException if a chapter file does not exist
     * @throws ParseException if a chapter file cannot be decoded
     */
    public Book load(BookConfig config) throws ResourceNotFoundException, ParseException {
        Cleaner cleaner = Cleaner.forLanguage(
            config.metadata().lang(), config.options().autoclean(), config.options().nbChar());
        MarkdownParser parser = new MarkdownParser(cleaner);
        log.debug("Using {} for language '{}'", cleaner.getClass().getSimpleName(), config.metadata().lang());

        List<Chapter> chapters = new ArrayList<>();
        for (ChapterEntry entry : config.chapters()) {
            log.debug("Parsing chapter {} ({})", entry.file(), entry.number());
            List<Token> content = parser.parseFile(entry.file());
            chapters.add(new Chapter(entry.number(), content, entry.file()));
        }

        log.info("Parsed {} chapters", chapters.size());
        return new Book(config.metadata(), config.options(), config.baseDirectory(), chapters);
    }
}
