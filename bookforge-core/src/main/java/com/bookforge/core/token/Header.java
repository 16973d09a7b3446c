package com.bookforge.core.token;

import java.util.List;

/**
 * A heading. Level 1 headings double as chapter titles.
 *
 * @param level heading level, 1 to 6
 * @param children inline content of the heading
 */
public record Header(int level, List<Token> children) implements Token {

    public Header {
        if (level < 1 || level > 6) {
            throw new IllegalArgumentException("Header level must be between 1 and 6: " + level);
        }
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static Header of(int level, Token... children) {
        return new Header(level, List.of(children));
    }

    @Override
    public <R> R accept(TokenVisitor<R> visitor) {
        return visitor.visitHeader(this);
    }
}
