package io.github.searchpath.matcher;

import io.github.searchpath.exception.InvalidPatternException;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Glob-style matcher. Patterns are translated to regular expressions over forward-slash paths:
 *
 * <ul>
 *   <li>{@code *} matches any run of characters except {@code /}
 *   <li>{@code **} crosses directories only when it is a whole path component ({@code **}/,
 *       {@code a/**}/{@code b}, trailing {@code /**}); elsewhere, as in {@code a**b}, it acts like
 *       {@code *}
 *   <li>{@code ?} matches one character except {@code /}
 *   <li>{@code [abc]}, {@code [a-z]}, {@code [!abc]}, {@code [^abc]} are character classes; negated
 *       classes never match {@code /}
 * </ul>
 *
 * Everything else matches literally. Negation ({@code !pattern}), directory-only ({@code pattern/})
 * and anchoring ({@code /pattern}) are not supported; use {@link GitignoreMatcher} for those.
 */
public final class GlobMatcher extends AbstractRegexMatcher {
    private static final String LITERAL_SPECIALS = "\\.+^${}()|]";
    private static final String CLASS_SPECIALS = "\\^-][&";

    @Override
    protected Pattern translate(String pattern) {
        var regex = globToRegex(pattern);
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new InvalidPatternException(pattern, e.getDescription(), null, e);
        }
    }

    /**
     * Translates a glob into an equivalent regular expression (to be used as a full match).
     *
     * <p>e.g. "src/**&#47;*.py" -> "src/(?:.*&#47;)?[^/]*\.py"
     */
    static String globToRegex(String pattern) {
        var regex = new StringBuilder(pattern.length() * 2);
        int i = 0;
        int n = pattern.length();
        while (i < n) {
            char c = pattern.charAt(i);
            switch (c) {
                case '*':
                    i = translateStar(pattern, i, regex);
                    break;
                case '?':
                    regex.append("[^/]");
                    i++;
                    break;
                case '[':
                    i = translateBracket(pattern, i, regex);
                    break;
                default:
                    if (LITERAL_SPECIALS.indexOf(c) >= 0) {
                        regex.append('\\');
                    }
                    regex.append(c);
                    i++;
                    break;
            }
        }
        return regex.toString();
    }

    private static int translateStar(String pattern, int i, StringBuilder regex) {
        int n = pattern.length();
        if (i + 1 >= n || pattern.charAt(i + 1) != '*') {
            regex.append("[^/]*");
            return i + 1;
        }

        int next = i + 2;
        boolean atStart = i == 0;
        boolean afterSlash = i > 0 && pattern.charAt(i - 1) == '/';
        boolean atEnd = next >= n;
        boolean beforeSlash = next < n && pattern.charAt(next) == '/';

        if (!((atStart || afterSlash) && (atEnd || beforeSlash))) {
            // not a whole component, e.g. a**b
            regex.append("[^/]*");
            return next;
        }
        if (beforeSlash) {
            // **/ : zero or more whole segments, so a/**/b also matches a/b
            regex.append("(?:.*/)?");
            return next + 1;
        }
        regex.append(".*");
        return next;
    }

    private static int translateBracket(String pattern, int bracketStart, StringBuilder regex) {
        int n = pattern.length();
        int i = bracketStart + 1;
        if (i >= n) {
            throw unclosedBracket(pattern, bracketStart);
        }

        var cls = new StringBuilder("[");
        if (pattern.charAt(i) == '!' || pattern.charAt(i) == '^') {
            cls.append("^/");
            i++;
        }

        boolean first = true;
        while (i < n && (first || pattern.charAt(i) != ']')) {
            first = false;
            char c = pattern.charAt(i++);
            if (c == '\\' && i < n) {
                c = pattern.charAt(i++);
            }

            // a-b is a range only when it is well ordered; otherwise all three are literal
            if (i + 1 < n && pattern.charAt(i) == '-' && pattern.charAt(i + 1) != ']') {
                int end = i + 1;
                char hi = pattern.charAt(end);
                if (hi == '\\' && end + 1 < n) {
                    hi = pattern.charAt(++end);
                }
                if (c <= hi) {
                    appendClassChar(cls, c);
                    cls.append('-');
                    appendClassChar(cls, hi);
                    i = end + 1;
                    continue;
                }
            }
            appendClassChar(cls, c);
        }

        if (i >= n) {
            throw unclosedBracket(pattern, bracketStart);
        }
        regex.append(cls).append(']');
        return i + 1;
    }

    private static void appendClassChar(StringBuilder cls, char c) {
        if (CLASS_SPECIALS.indexOf(c) >= 0) {
            cls.append('\\');
        }
        cls.append(c);
    }

    private static InvalidPatternException unclosedBracket(String pattern, int position) {
        return new InvalidPatternException(pattern, "unclosed bracket", position);
    }
}
