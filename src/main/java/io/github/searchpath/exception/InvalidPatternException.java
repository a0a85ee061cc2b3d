package io.github.searchpath.exception;

import java.util.OptionalInt;
import org.jetbrains.annotations.Nullable;

/**
 * Raised when a pattern cannot be compiled: an empty pattern, an unclosed bracket in a glob,
 * or a regular expression the regex engine rejects.
 */
public final class InvalidPatternException extends PatternException {
    private final String pattern;
    private final String reason;

    @Nullable
    private final Integer position;

    public InvalidPatternException(String pattern, String reason) {
        this(pattern, reason, null, null);
    }

    public InvalidPatternException(String pattern, String reason, @Nullable Integer position) {
        this(pattern, reason, position, null);
    }

    public InvalidPatternException(
            String pattern, String reason, @Nullable Integer position, @Nullable Throwable cause) {
        super(format(pattern, reason, position), cause);
        this.pattern = pattern;
        this.reason = reason;
        this.position = position;
    }

    private static String format(String pattern, String reason, @Nullable Integer position) {
        if (position != null) {
            return "Invalid pattern '" + pattern + "' at position " + position + ": " + reason;
        }
        return "Invalid pattern '" + pattern + "': " + reason;
    }

    /** The pattern text that failed to compile. */
    public String getPattern() {
        return pattern;
    }

    /** Short description of the problem, without the pattern or position. */
    public String getReason() {
        return reason;
    }

    /** Character offset of the problem within the pattern, when known. */
    public OptionalInt getPosition() {
        return position == null ? OptionalInt.empty() : OptionalInt.of(position);
    }
}
