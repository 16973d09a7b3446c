package com.bookforge.core.book;

import java.util.Objects;

/**
 * Numbering policy attached to a chapter when it is added to a book.
 *
 * <ul>
 *   <li>{@link Kind#HIDDEN} - the chapter title is not displayed at all</li>
 *   <li>{@link Kind#UNNUMBERED} - the title is displayed without a number</li>
 *   <li>{@link Kind#DEFAULT} - the chapter takes the next number</li>
 *   <li>{@link Kind#SPECIFIED} - the chapter takes {@link #value()} and numbering continues from it</li>
 * </ul>
 *
 * @param kind numbering policy
 * @param value explicit number, meaningful only for {@link Kind#SPECIFIED}
 */
public record ChapterNumber(Kind kind, int value) {

    /**
     * Numbering policy kinds.
     */
    public enum Kind {
        HIDDEN,
        UNNUMBERED,
        DEFAULT,
        SPECIFIED
    }

    private static final ChapterNumber HIDDEN = new ChapterNumber(Kind.HIDDEN, 0);
    private static final ChapterNumber UNNUMBERED = new ChapterNumber(Kind.UNNUMBERED, 0);
    private static final ChapterNumber DEFAULT = new ChapterNumber(Kind.DEFAULT, 0);

    public ChapterNumber {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind != Kind.SPECIFIED) {
            value = 0;
        }
    }

    public static ChapterNumber hidden() {
        return HIDDEN;
    }

    public static ChapterNumber unnumbered() {
        return UNNUMBERED;
    }

    public static ChapterNumber automatic() {
        return DEFAULT;
    }

    public static ChapterNumber specified(int value) {
        return new ChapterNumber(Kind.SPECIFIED, value);
    }

    @Override
    public String toString() {
        return kind == Kind.SPECIFIED ? "SPECIFIED(" + value + ")" : kind.name();
    }
}
