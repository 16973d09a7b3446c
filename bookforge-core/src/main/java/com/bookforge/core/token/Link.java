package com.bookforge.core.token;

import java.util.List;
import java.util.Objects;

/**
 * A hyperlink.
 *
 * @param url link target
 * @param title optional title, empty when absent
 * @param children link label
 */
public record Link(String url, String title, List<Token> children) implements Token {

    public Link {
        Objects.requireNonNull(url, "url must not be null");
        title = title == null ? "" : title;
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public <R> R accept(TokenVisitor<R> visitor) {
        return visitor.visitLink(this);
    }
}
