package io.github.searchpath.exception;

/** Raised when a search path or a query is built from invalid input. */
public final class ConfigurationException extends SearchPathException {
    public ConfigurationException(String message) {
        super(message);
    }
}
