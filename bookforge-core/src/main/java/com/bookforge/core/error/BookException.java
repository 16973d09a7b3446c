package com.bookforge.core.error;

/**
 * Base class of every failure raised while loading, parsing or rendering a book.
 *
 * <p>Subclasses identify the failing stage. The message always names the file,
 * chapter or output format involved so callers can report it without extra context.
 *
 * @see ResourceNotFoundException
 * @see ParseException
 * @see RenderException
 * @see ConfigException
 */
public abstract class BookException extends Exception {

    protected BookException(String message) {
        super(message);
    }

    protected BookException(String message, Throwable cause) {
        super(message, cause);
    }
}
