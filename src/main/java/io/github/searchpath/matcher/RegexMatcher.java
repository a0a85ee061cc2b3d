package io.github.searchpath.matcher;

import io.github.searchpath.exception.InvalidPatternException;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** Matcher whose patterns are Java regular expressions, matched against the whole relative path. */
public final class RegexMatcher extends AbstractRegexMatcher {

    @Override
    protected Pattern translate(String pattern) {
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            Integer position = e.getIndex() >= 0 ? e.getIndex() : null;
            throw new InvalidPatternException(pattern, e.getDescription(), position, e);
        }
    }
}
