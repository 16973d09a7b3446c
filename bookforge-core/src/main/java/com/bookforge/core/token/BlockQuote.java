package com.bookforge.core.token;

import java.util.List;

/**
 * A block quote containing block tokens.
 *
 * @param children child tokens in source order
 */
public record BlockQuote(List<Token> children) implements Token {

    public BlockQuote {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static BlockQuote of(Token... children) {
        return new BlockQuote(List.of(children));
    }

    @Override
    public <R> R accept(TokenVisitor<R> visitor) {
        return visitor.visitBlockQuote(this);
    }
}
