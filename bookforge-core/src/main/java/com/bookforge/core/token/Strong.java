package com.bookforge.core.token;

import java.util.List;

/**
 * Strongly emphasized inline content.
 *
 * @param children child tokens in source order
 */
public record Strong(List<Token> children) implements Token {

    public Strong {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static Strong of(Token... children) {
        return new Strong(List.of(children));
    }

    @Override
    public <R> R accept(TokenVisitor<R> visitor) {
        return visitor.visitStrong(this);
    }
}
