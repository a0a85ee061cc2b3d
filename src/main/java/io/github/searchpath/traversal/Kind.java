package io.github.searchpath.traversal;

import io.github.searchpath.exception.ConfigurationException;
import java.util.Locale;

/** What a traversal yields. */
public enum Kind {
    FILES,
    DIRS,
    BOTH;

    public boolean includesFiles() {
        return this != DIRS;
    }

    public boolean includesDirs() {
        return this != FILES;
    }

    /**
     * Parses the lower-case selector used in queries: {@code files}, {@code dirs} or {@code both}.
     *
     * @throws ConfigurationException for any other value
     */
    public static Kind fromString(String value) {
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "files" -> FILES;
            case "dirs" -> DIRS;
            case "both" -> BOTH;
            default -> throw new ConfigurationException(
                    "Invalid kind '" + value + "': expected one of files, dirs, both");
        };
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
