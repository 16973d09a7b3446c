package com.bookforge.core.token;

import java.util.List;

/**
 * An unordered list; children are {@link ListItem}s.
 *
 * @param children child tokens in source order
 */
public record BulletList(List<Token> children) implements Token {

    public BulletList {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static BulletList of(Token... children) {
        return new BulletList(List.of(children));
    }

    @Override
    public <R> R accept(TokenVisitor<R> visitor) {
        return visitor.visitBulletList(this);
    }
}
