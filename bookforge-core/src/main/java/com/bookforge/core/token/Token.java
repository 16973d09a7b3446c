package com.bookforge.core.token;

/**
 * One node of the format-neutral document tree produced for a chapter.
 *
 * <p>Tokens are immutable records. Containers own their children exclusively, so a
 * chapter is a strict tree with no shared nodes. Equality is structural: two trees
 * are equal when their variants and children are equal recursively.
 *
 * <p>Block variants: {@link Paragraph}, {@link Header}, {@link BulletList},
 * {@link OrderedList}, {@link ListItem}, {@link BlockQuote}, {@link CodeBlock},
 * {@link Rule}, {@link FootnoteDefinition}.
 *
 * <p>Inline variants: {@link Text}, {@link Emphasis}, {@link Strong},
 * {@link CodeSpan}, {@link Link}, {@link Image}, {@link SoftBreak},
 * {@link HardBreak}, {@link FootnoteReference}.
 *
 * @see TokenVisitor
 */
public interface Token {

    /**
     * Dispatches to the visitor method matching this variant.
     *
     * @param visitor visitor to call
     * @param <R> visitor result type
     * @return the visitor's result
     */
    <R> R accept(TokenVisitor<R> visitor);
}
