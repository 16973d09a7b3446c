package com.bookforge.core.token;

import java.util.List;

/**
 * A numbered list; children are {@link ListItem}s.
 *
 * @param start number of the first item
 * @param children list items in source order
 */
public record OrderedList(int start, List<Token> children) implements Token {

    public OrderedList {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static OrderedList of(int start, Token... children) {
        return new OrderedList(start, List.of(children));
    }

    @Override
    public <R> R accept(TokenVisitor<R> visitor) {
        return visitor.visitOrderedList(this);
    }
}
