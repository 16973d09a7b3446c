package com.bookforge.core.cleaner;

/**
 * Collapses runs of spaces and tabs into a single space.
 */
public class DefaultCleaner implements Cleaner {

    public static final DefaultCleaner INSTANCE = new DefaultCleaner();

    protected DefaultCleaner() {
    }

    @Override
    public String clean(String text, boolean firstRunInLine) {
        return collapseWhitespace(text);
    }

    /**
     * Replaces every run of spaces and tabs with one space.
     *
     * @param text input text
     * @return text with collapsed whitespace, the same instance if nothing changed
     */
    static String collapseWhitespace(String text) {
        StringBuilder sb = null;
        boolean previousWasSpace = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean space = c == ' ' || c == '\t';
            if (space && (previousWasSpace || c == '\t') && sb == null) {
                sb = new StringBuilder(text.length());
                sb.append(text, 0, i);
            }
            if (sb != null && !(space && previousWasSpace)) {
                sb.append(space ? ' ' : c);
            }
            previousWasSpace = space;
        }
        return sb == null ? text : sb.toString();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
