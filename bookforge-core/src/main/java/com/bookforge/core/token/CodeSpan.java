package com.bookforge.core.token;

import java.util.Objects;

/**
 * Inline code. Content is verbatim and never cleaned.
 *
 * @param code the code text
 */
public record CodeSpan(String code) implements Token {

    public CodeSpan {
        Objects.requireNonNull(code, "code must not be null");
    }

    @Override
    public <R> R accept(TokenVisitor<R> visitor) {
        return visitor.visitCodeSpan(this);
    }
}
