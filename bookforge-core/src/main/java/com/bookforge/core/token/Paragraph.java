package com.bookforge.core.token;

import java.util.List;

/**
 * A paragraph of inline content.
 *
 * @param children child tokens in source order
 */
public record Paragraph(List<Token> children) implements Token {

    public Paragraph {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static Paragraph of(Token... children) {
        return new Paragraph(List.of(children));
    }

    @Override
    public <R> R accept(TokenVisitor<R> visitor) {
        return visitor.visitParagraph(this);
    }
}
