package com.bookforge.core.token;

import java.util.List;
import java.util.Objects;

/**
 * The body of a footnote.
 *
 * @param label footnote label
 * @param children block content of the note
 */
public record FootnoteDefinition(String label, List<Token> children) implements Token {

    public FootnoteDefinition {
        Objects.requireNonNull(label, "label must not be null");
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public <R> R accept(TokenVisitor<R> visitor) {
        return visitor.visitFootnoteDefinition(this);
    }
}
