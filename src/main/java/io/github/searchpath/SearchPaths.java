package io.github.searchpath;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/** One-shot lookups over entries that are not worth keeping in a {@link SearchPath}. */
public final class SearchPaths {
    private SearchPaths() {}

    public static Optional<Path> first(SearchQuery query, SearchPath.Entry... entries) {
        return SearchPath.of(entries).first(query);
    }

    public static Optional<Path> first(String pattern, SearchPath.Entry... entries) {
        return first(SearchQuery.of(pattern), entries);
    }

    public static Optional<Path> first(String pattern, Path... dirs) {
        return SearchPath.ofDirs(dirs).first(pattern);
    }

    public static Optional<Match> match(SearchQuery query, SearchPath.Entry... entries) {
        return SearchPath.of(entries).match(query);
    }

    public static Optional<Match> match(String pattern, SearchPath.Entry... entries) {
        return match(SearchQuery.of(pattern), entries);
    }

    public static Optional<Match> match(String pattern, Path... dirs) {
        return SearchPath.ofDirs(dirs).match(pattern);
    }

    public static List<Path> all(SearchQuery query, SearchPath.Entry... entries) {
        return SearchPath.of(entries).all(query);
    }

    public static List<Path> all(String pattern, SearchPath.Entry... entries) {
        return all(SearchQuery.of(pattern), entries);
    }

    public static List<Path> all(String pattern, Path... dirs) {
        return SearchPath.ofDirs(dirs).all(pattern);
    }

    public static List<Match> matches(SearchQuery query, SearchPath.Entry... entries) {
        return SearchPath.of(entries).matches(query);
    }

    public static List<Match> matches(String pattern, SearchPath.Entry... entries) {
        return matches(SearchQuery.of(pattern), entries);
    }

    public static List<Match> matches(String pattern, Path... dirs) {
        return SearchPath.ofDirs(dirs).matches(pattern);
    }
}
