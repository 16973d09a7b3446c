package com.bookforge.core.token;

import java.util.List;

/**
 * One item of a bullet or ordered list; children are block tokens.
 *
 * @param children child tokens in source order
 */
public record ListItem(List<Token> children) implements Token {

    public ListItem {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static ListItem of(Token... children) {
        return new ListItem(List.of(children));
    }

    @Override
    public <R> R accept(TokenVisitor<R> visitor) {
        return visitor.visitListItem(this);
    }
}
