package com.bookforge.core.token;

/**
 * A horizontal rule (thematic break).
 */
public record Rule() implements Token {

    @Override
    public <R> R accept(TokenVisitor<R> visitor) {
        return visitor.visitRule(this);
    }
}
