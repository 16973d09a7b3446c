package com.bookforge.core.numbering;

import com.bookforge.core.book.ChapterNumber;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the display state of every chapter from its numbering policy and position.
 *
 * <p>A running counter starts at 0. {@code DEFAULT} increments it, {@code SPECIFIED(n)}
 * resets it to {@code n} so that following chapters continue from there.
 * {@code UNNUMBERED} and {@code HIDDEN} leave it unchanged.
 *
 * <pre>{@code
 * resolve([DEFAULT, DEFAULT, SPECIFIED(5), DEFAULT, UNNUMBERED, HIDDEN], true)
 *   -> numbers [1, 2, 5, 6, -, -], titles shown [y, y, y, y, y, n]
 * }</pre>
 */
public final class NumberingResolver {

    private NumberingResolver() {
        // Utility class
    }

    /**
     * Resolves the display state of each chapter.
     *
     * @param numbers numbering policies in chapter order
     * @param numbering false to treat every non-hidden chapter as unnumbered
     * @return one display state per chapter, same order
     */
    public static List<ChapterDisplay> resolve(List<ChapterNumber> numbers, boolean numbering) {
        List<ChapterDisplay> result = new ArrayList<>(numbers.size());
        int counter = 0;
        for (ChapterNumber number : numbers) {
            ChapterDisplay display = switch (number.kind()) {
                case HIDDEN -> ChapterDisplay.hidden();
                case UNNUMBERED -> ChapterDisplay.unnumbered();
                case DEFAULT -> {
                    counter++;
                    yield ChapterDisplay.numbered(counter);
                }
                case SPECIFIED -> {
                    counter = number.value();
                    yield ChapterDisplay.numbered(counter);
                }
            };
            if (!numbering && display.showTitle()) {
                display = ChapterDisplay.unnumbered();
            }
            result.add(display);
        }
        return List.copyOf(result);
    }
}
