package com.bookforge.core.publish;

import com.bookforge.core.config.OutputFormat;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of publishing one format.
 *
 * @param format output format
 * @param output target path
 * @param bytes size of the written file, 0 on failure
 * @param error failure cause, null on success
 */
public record FormatOutcome(OutputFormat format, Path output, long bytes, Throwable error) {

    public FormatOutcome {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(output, "output must not be null");
    }

    public static FormatOutcome success(OutputFormat format, Path output, long bytes) {
        return new FormatOutcome(format, output, bytes, null);
    }

    public static FormatOutcome failure(OutputFormat format, Path output, Throwable error) {
        return new FormatOutcome(format, output, 0, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<Throwable> errorValue() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns a one-line description of the failure.
     *
     * @return failure message, empty on success
     */
    public String message() {
        if (error == null) {
            return "";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
