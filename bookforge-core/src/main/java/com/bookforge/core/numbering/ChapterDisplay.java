package com.bookforge.core.numbering;

import java.util.OptionalInt;

/**
 * How one chapter is displayed: its number, if any, and whether its title is shown.
 *
 * @param number display number, empty for unnumbered and hidden chapters
 * @param showTitle false only for hidden chapters
 */
public record ChapterDisplay(OptionalInt number, boolean showTitle) {

    private static final ChapterDisplay HIDDEN = new ChapterDisplay(OptionalInt.empty(), false);
    private static final ChapterDisplay UNNUMBERED = new ChapterDisplay(OptionalInt.empty(), true);

    public ChapterDisplay {
        number = number == null ? OptionalInt.empty() : number;
    }

    public static ChapterDisplay hidden() {
        return HIDDEN;
    }

    public static ChapterDisplay unnumbered() {
        return UNNUMBERED;
    }

    public static ChapterDisplay numbered(int number) {
        return new ChapterDisplay(OptionalInt.of(number), true);
    }
}
