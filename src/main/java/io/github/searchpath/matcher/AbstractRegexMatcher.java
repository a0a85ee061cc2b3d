package io.github.searchpath.matcher;

import io.github.searchpath.exception.InvalidPatternException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Matcher whose patterns compile to one {@link Pattern} each. Compiled patterns are cached by
 * their source string for the lifetime of the instance.
 *
 * <p>Neither negation nor directory-only patterns are supported; {@code isDir} is ignored.
 */
public abstract class AbstractRegexMatcher implements PatternMatcher {
    private final Map<String, Pattern> cache = new HashMap<>();

    @Override
    public final boolean supportsNegation() {
        return false;
    }

    @Override
    public final boolean supportsDirOnly() {
        return false;
    }

    @Override
    public final boolean matches(String path, boolean isDir, List<String> include, List<String> exclude) {
        if (!include.isEmpty() && include.stream().noneMatch(p -> matchesPattern(path, p))) {
            return false;
        }
        return exclude.isEmpty() || exclude.stream().noneMatch(p -> matchesPattern(path, p));
    }

    private boolean matchesPattern(String path, String pattern) {
        return compile(pattern).matcher(path).matches();
    }

    /**
     * Returns the compiled form of {@code pattern}, compiling it on first use.
     *
     * @throws InvalidPatternException if the pattern is empty or does not compile
     */
    protected final Pattern compile(String pattern) {
        var cached = cache.get(pattern);
        if (cached != null) {
            return cached;
        }
        if (pattern.isEmpty()) {
            throw new InvalidPatternException(pattern, "empty pattern");
        }
        var compiled = translate(pattern);
        cache.put(pattern, compiled);
        return compiled;
    }

    /** Number of distinct patterns compiled so far. */
    final int cachedPatternCount() {
        return cache.size();
    }

    /** Compiles a non-empty pattern. */
    protected abstract Pattern translate(String pattern);
}
