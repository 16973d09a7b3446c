package com.bookforge.core.token;

import java.util.List;

/**
 * Emphasized inline content.
 *
 * @param children child tokens in source order
 */
public record Emphasis(List<Token> children) implements Token {

    public Emphasis {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static Emphasis of(Token... children) {
        return new Emphasis(List.of(children));
    }

    @Override
    public <R> R accept(TokenVisitor<R> visitor) {
        return visitor.visitEmphasis(this);
    }
}
