package io.github.searchpath.matcher;

import java.util.List;

/**
 * Decides whether a relative path passes a pair of include/exclude pattern lists.
 *
 * <p>A path matches when {@code include} is empty or at least one include pattern matches it, and
 * no exclude pattern matches it. Paths are relative to the search root and always use forward
 * slashes. Patterns are matched against the whole path, never a substring.
 *
 * <p>Implementations may cache compiled patterns; such caches are owned by the instance and are
 * not safe for concurrent use. Give each thread its own matcher.
 */
public interface PatternMatcher {

    /** Whether {@code !pattern} re-includes a path matched by an earlier pattern. */
    boolean supportsNegation();

    /** Whether {@code pattern/} only matches directories. */
    boolean supportsDirOnly();

    /**
     * @param path relative path, forward-slash separated
     * @param isDir whether the path names a directory
     * @param include patterns the path must match (empty matches everything)
     * @param exclude patterns that reject the path
     * @throws io.github.searchpath.exception.InvalidPatternException if a pattern cannot be compiled
     */
    boolean matches(String path, boolean isDir, List<String> include, List<String> exclude);

    default boolean matches(String path, List<String> include, List<String> exclude) {
        return matches(path, false, include, exclude);
    }
}
