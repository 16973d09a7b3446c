package com.bookforge.core.cleaner;

import java.util.Locale;

/**
 * Typographic normalization applied to every text run as the parser emits it.
 *
 * <p>Implementations never fail, never touch letters and are idempotent:
 * {@code clean(clean(t, f), f).equals(clean(t, f))} for every run {@code t}.
 *
 * <p>The variant is chosen once per book from its language tag, see
 * {@link #forLanguage(String, boolean, char)}.
 */
public interface Cleaner {

    /**
     * Cleans one text run.
     *
     * @param text the run as produced by the parser
     * @param firstRunInLine whether the run starts a block or follows a line break
     * @return the cleaned run
     */
    String clean(String text, boolean firstRunInLine);

    /**
     * Selects the cleaner for a book.
     *
     * <p>With {@code autoclean} off, text is left untouched. Otherwise French
     * languages ({@code fr}, {@code fr-CA}, ...) get French typography and every other
     * language gets whitespace normalization only.
     *
     * @param lang book language tag
     * @param autoclean whether cleaning is enabled
     * @param nbChar character to insert where a non-breaking space belongs
     * @return the selected cleaner
     */
    static Cleaner forLanguage(String lang, boolean autoclean, char nbChar) {
        if (!autoclean) {
            return NoOpCleaner.INSTANCE;
        }
        if (lang != null && lang.toLowerCase(Locale.ROOT).startsWith("fr")) {
            return new FrenchCleaner(nbChar);
        }
        return DefaultCleaner.INSTANCE;
    }
}
