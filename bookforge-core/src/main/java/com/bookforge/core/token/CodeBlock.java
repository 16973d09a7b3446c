package com.bookforge.core.token;

import java.util.Objects;

/**
 * A fenced or indented code block. Content is verbatim and never cleaned.
 *
 * @param language info string of a fenced block, empty when absent
 * @param code the code, lines separated by {@code \n}
 */
public record CodeBlock(String language, String code) implements Token {

    public CodeBlock {
        language = language == null ? "" : language;
        Objects.requireNonNull(code, "code must not be null");
    }

    @Override
    public <R> R accept(TokenVisitor<R> visitor) {
        return visitor.visitCodeBlock(this);
    }
}
