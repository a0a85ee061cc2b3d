package io.github.searchpath.exception;

/** Base class for problems with a pattern or a pattern file. */
public class PatternException extends SearchPathException {
    public PatternException(String message) {
        super(message);
    }

    public PatternException(String message, Throwable cause) {
        super(message, cause);
    }
}
