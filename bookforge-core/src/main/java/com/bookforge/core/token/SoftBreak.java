package com.bookforge.core.token;

/**
 * A source line break inside a paragraph, rendered as a space.
 */
public record SoftBreak() implements Token {

    @Override
    public <R> R accept(TokenVisitor<R> visitor) {
        return visitor.visitSoftBreak(this);
    }
}
