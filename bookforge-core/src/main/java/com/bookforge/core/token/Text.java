package com.bookforge.core.token;

import java.util.Objects;

/**
 * A run of plain text. The only token the cleaner is applied to.
 *
 * @param text the characters of the run, already cleaned
 */
public record Text(String text) implements Token {

    public Text {
        Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public <R> R accept(TokenVisitor<R> visitor) {
        return visitor.visitText(this);
    }
}
