package io.github.searchpath.exception;

/**
 * Base class for every failure raised by the searchpath library.
 */
public class SearchPathException extends RuntimeException {
    public SearchPathException(String message) {
        super(message);
    }

    public SearchPathException(String message, Throwable cause) {
        super(message, cause);
    }
}
