package io.github.searchpath;

import io.github.searchpath.matcher.GlobMatcher;
import io.github.searchpath.matcher.PatternMatcher;
import io.github.searchpath.traversal.Kind;
import io.github.searchpath.traversal.Traversal;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Parameters of a lookup. Immutable; build one with {@link #builder()} or {@link #of(String)}.
 *
 * <p>Defaults: pattern {@code **} (everything), kind {@link Kind#FILES}, no include or exclude
 * patterns, a fresh {@link GlobMatcher} per lookup, symlinks followed, results deduplicated.
 *
 * <p>A query that carries its own {@link PatternMatcher} shares that matcher's pattern cache
 * between every lookup it is used for.
 */
public final class SearchQuery {
    private static final SearchQuery ALL = builder().build();

    private final String pattern;
    private final Kind kind;
    private final List<String> include;
    private final List<Path> includeFrom;

    @Nullable
    private final String includeFromAncestors;

    private final List<String> exclude;
    private final List<Path> excludeFrom;

    @Nullable
    private final String excludeFromAncestors;

    @Nullable
    private final PatternMatcher matcher;

    private final boolean followSymlinks;
    private final boolean dedupe;

    private SearchQuery(Builder b) {
        this.pattern = b.pattern;
        this.kind = b.kind;
        this.include = b.include;
        this.includeFrom = b.includeFrom;
        this.includeFromAncestors = b.includeFromAncestors;
        this.exclude = b.exclude;
        this.excludeFrom = b.excludeFrom;
        this.excludeFromAncestors = b.excludeFromAncestors;
        this.matcher = b.matcher;
        this.followSymlinks = b.followSymlinks;
        this.dedupe = b.dedupe;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Query with the given top-level pattern and every other setting at its default. */
    public static SearchQuery of(String pattern) {
        return Traversal.MATCH_ALL.equals(pattern) ? ALL : builder().pattern(pattern).build();
    }

    /** Query matching every file. */
    public static SearchQuery all() {
        return ALL;
    }

    public Builder toBuilder() {
        var b = new Builder();
        b.pattern = pattern;
        b.kind = kind;
        b.include = include;
        b.includeFrom = includeFrom;
        b.includeFromAncestors = includeFromAncestors;
        b.exclude = exclude;
        b.excludeFrom = excludeFrom;
        b.excludeFromAncestors = excludeFromAncestors;
        b.matcher = matcher;
        b.followSymlinks = followSymlinks;
        b.dedupe = dedupe;
        return b;
    }

    public String pattern() {
        return pattern;
    }

    public Kind kind() {
        return kind;
    }

    public List<String> include() {
        return include;
    }

    public List<Path> includeFrom() {
        return includeFrom;
    }

    @Nullable
    public String includeFromAncestors() {
        return includeFromAncestors;
    }

    public List<String> exclude() {
        return exclude;
    }

    public List<Path> excludeFrom() {
        return excludeFrom;
    }

    @Nullable
    public String excludeFromAncestors() {
        return excludeFromAncestors;
    }

    @Nullable
    public PatternMatcher matcher() {
        return matcher;
    }

    public boolean followSymlinks() {
        return followSymlinks;
    }

    public boolean dedupe() {
        return dedupe;
    }

    /** Whether candidates are filtered with patterns from their ancestor directories. */
    public boolean usesAncestorPatterns() {
        return includeFromAncestors != null || excludeFromAncestors != null;
    }

    @Override
    public String toString() {
        return "SearchQuery{pattern='" + pattern + "', kind=" + kind
                + (include.isEmpty() ? "" : ", include=" + include)
                + (includeFrom.isEmpty() ? "" : ", includeFrom=" + includeFrom)
                + (includeFromAncestors == null ? "" : ", includeFromAncestors=" + includeFromAncestors)
                + (exclude.isEmpty() ? "" : ", exclude=" + exclude)
                + (excludeFrom.isEmpty() ? "" : ", excludeFrom=" + excludeFrom)
                + (excludeFromAncestors == null ? "" : ", excludeFromAncestors=" + excludeFromAncestors)
                + (matcher == null ? "" : ", matcher=" + matcher.getClass().getSimpleName())
                + ", followSymlinks=" + followSymlinks + ", dedupe=" + dedupe + "}";
    }

    public static final class Builder {
        private String pattern = Traversal.MATCH_ALL;
        private Kind kind = Kind.FILES;
        private List<String> include = List.of();
        private List<Path> includeFrom = List.of();

        @Nullable
        private String includeFromAncestors;

        private List<String> exclude = List.of();
        private List<Path> excludeFrom = List.of();

        @Nullable
        private String excludeFromAncestors;

        @Nullable
        private PatternMatcher matcher;

        private boolean followSymlinks = true;
        private boolean dedupe = true;

        private Builder() {}

        /** Top-level pattern every result must match (or one of the include patterns). */
        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder kind(Kind kind) {
            this.kind = kind;
            return this;
        }

        /** Parses {@code files}, {@code dirs} or {@code both}. */
        public Builder kind(String kind) {
            this.kind = Kind.fromString(kind);
            return this;
        }

        public Builder include(String... patterns) {
            return include(Arrays.asList(patterns));
        }

        public Builder include(List<String> patterns) {
            this.include = List.copyOf(patterns);
            return this;
        }

        /** Pattern files whose lines are added to the include patterns. Read strictly. */
        public Builder includeFrom(Path... files) {
            return includeFrom(Arrays.asList(files));
        }

        public Builder includeFrom(List<Path> files) {
            this.includeFrom = List.copyOf(files);
            return this;
        }

        /** Name of the pattern file to gather include patterns from in each candidate's ancestors. */
        public Builder includeFromAncestors(@Nullable String filename) {
            this.includeFromAncestors = filename;
            return this;
        }

        public Builder exclude(String... patterns) {
            return exclude(Arrays.asList(patterns));
        }

        public Builder exclude(List<String> patterns) {
            this.exclude = List.copyOf(patterns);
            return this;
        }

        /** Pattern files whose lines are added to the exclude patterns. Read strictly. */
        public Builder excludeFrom(Path... files) {
            return excludeFrom(Arrays.asList(files));
        }

        public Builder excludeFrom(List<Path> files) {
            this.excludeFrom = List.copyOf(files);
            return this;
        }

        /** Name of the pattern file to gather exclude patterns from in each candidate's ancestors. */
        public Builder excludeFromAncestors(@Nullable String filename) {
            this.excludeFromAncestors = filename;
            return this;
        }

        public Builder matcher(@Nullable PatternMatcher matcher) {
            this.matcher = matcher;
            return this;
        }

        public Builder followSymlinks(boolean followSymlinks) {
            this.followSymlinks = followSymlinks;
            return this;
        }

        /** Whether {@code all}/{@code matches} keep only the first result per relative path. */
        public Builder dedupe(boolean dedupe) {
            this.dedupe = dedupe;
            return this;
        }

        public SearchQuery build() {
            return new SearchQuery(this);
        }
    }
}
