package io.github.searchpath.exception;

import java.nio.file.Path;
import java.util.OptionalInt;
import org.jetbrains.annotations.Nullable;

/**
 * Raised by the strict pattern-file loader when a file named through {@code includeFrom} or
 * {@code excludeFrom} is missing, unreadable, a directory, or not valid UTF-8.
 *
 * <p>Ancestor pattern files never raise this; they are read leniently.
 */
public final class PatternFileException extends PatternException {
    private final Path path;
    private final String reason;

    @Nullable
    private final Integer lineNumber;

    public PatternFileException(Path path, String reason) {
        this(path, reason, null, null);
    }

    public PatternFileException(Path path, String reason, @Nullable Integer lineNumber) {
        this(path, reason, lineNumber, null);
    }

    public PatternFileException(
            Path path, String reason, @Nullable Integer lineNumber, @Nullable Throwable cause) {
        super(format(path, reason, lineNumber), cause);
        this.path = path;
        this.reason = reason;
        this.lineNumber = lineNumber;
    }

    private static String format(Path path, String reason, @Nullable Integer lineNumber) {
        if (lineNumber != null) {
            return "Error in pattern file " + path + ":" + lineNumber + ": " + reason;
        }
        return "Error in pattern file " + path + ": " + reason;
    }

    public Path getPath() {
        return path;
    }

    public String getReason() {
        return reason;
    }

    /** 1-based line number of the offending line, when known. */
    public OptionalInt getLineNumber() {
        return lineNumber == null ? OptionalInt.empty() : OptionalInt.of(lineNumber);
    }
}
