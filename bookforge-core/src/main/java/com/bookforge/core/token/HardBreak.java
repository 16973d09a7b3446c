package com.bookforge.core.token;

/**
 * An explicit line break (trailing backslash or two trailing spaces).
 */
public record HardBreak() implements Token {

    @Override
    public <R> R accept(TokenVisitor<R> visitor) {
        return visitor.visitHardBreak(this);
    }
}
