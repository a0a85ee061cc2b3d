package io.github.searchpath.util;

import com.google.common.base.Joiner;
import java.nio.file.Path;

public final class PathUtil {
    private static final Joiner SLASH = Joiner.on('/');

    private PathUtil() {}

    /**
     * Joins the name elements of a relative path with forward slashes. Separators are never rewritten
     * inside a name, so on Unix a file literally named {@code a\b} stays {@code a\b}.
     */
    public static String toUnixPath(Path path) {
        return SLASH.join(path);
    }
}
