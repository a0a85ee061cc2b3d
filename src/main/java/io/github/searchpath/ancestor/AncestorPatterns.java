package io.github.searchpath.ancestor;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Include and exclude patterns gathered from the pattern files of a file's ancestor directories.
 * Both lists run from the entry root down to the file's parent, so patterns from deeper
 * directories come last.
 */
public record AncestorPatterns(List<String> include, List<String> exclude) {
    public static final AncestorPatterns EMPTY = new AncestorPatterns(List.of(), List.of());

    public AncestorPatterns {
        include = List.copyOf(include);
        exclude = List.copyOf(exclude);
    }

    public boolean isEmpty() {
        return include.isEmpty() && exclude.isEmpty();
    }

    /**
     * Ancestor patterns first, then the inline ones, so that the more specific inline patterns win
     * for matchers that support negation.
     */
    public static List<String> merge(List<String> ancestor, List<String> inline) {
        if (ancestor.isEmpty()) {
            return inline;
        }
        if (inline.isEmpty()) {
            return ancestor;
        }
        return ImmutableList.<String>builder().addAll(ancestor).addAll(inline).build();
    }
}
