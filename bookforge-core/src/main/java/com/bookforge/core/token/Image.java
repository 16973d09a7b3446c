package com.bookforge.core.token;

import java.util.List;
import java.util.Objects;

/**
 * An image reference.
 *
 * @param url image source, relative to the book directory or absolute
 * @param title optional title, empty when absent
 * @param children alternative text
 */
public record Image(String url, String title, List<Token> children) implements Token {

    public Image {
        Objects.requireNonNull(url, "url must not be null");
        title = title == null ? "" : title;
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Returns whether the source points to a remote resource rather than a local file.
     *
     * @return true for http, https and data sources
     */
    public boolean isRemote() {
        String lower = url.toLowerCase();
        return lower.startsWith("http://") || lower.startsWith("https://") || lower.startsWith("data:");
    }

    @Override
    public <R> R accept(TokenVisitor<R> visitor) {
        return visitor.visitImage(this);
    }
}
