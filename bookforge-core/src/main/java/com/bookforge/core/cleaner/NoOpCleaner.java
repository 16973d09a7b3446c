package com.bookforge.core.cleaner;

/**
 * Leaves text untouched. Used when autoclean is disabled.
 */
public final class NoOpCleaner implements Cleaner {

    public static final NoOpCleaner INSTANCE = new NoOpCleaner();

    private NoOpCleaner() {
    }

    @Override
    public String clean(String text, boolean firstRunInLine) {
        return text;
    }

    @Override
    public String toString() {
        return "NoOpCleaner";
    }
}
