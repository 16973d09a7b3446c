package com.bookforge.core.token;

import java.util.Objects;

/**
 * A reference to a footnote defined elsewhere in the same chapter.
 *
 * @param label footnote label as written in the source
 */
public record FootnoteReference(String label) implements Token {

    public FootnoteReference {
        Objects.requireNonNull(label, "label must not be null");
    }

    @Override
    public <R> R accept(TokenVisitor<R> visitor) {
        return visitor.visitFootnoteReference(this);
    }
}
