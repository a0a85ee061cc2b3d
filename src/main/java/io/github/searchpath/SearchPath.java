package io.github.searchpath;

import com.google.common.collect.ImmutableList;
import io.github.searchpath.ancestor.AncestorPatternCollector;
import io.github.searchpath.ancestor.AncestorPatterns;
import io.github.searchpath.exception.ConfigurationException;
import io.github.searchpath.matcher.GlobMatcher;
import io.github.searchpath.matcher.PatternMatcher;
import io.github.searchpath.traversal.PatternFiles;
import io.github.searchpath.traversal.Traversal;
import io.github.searchpath.util.PathUtil;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * An ordered list of directories to search, each labelled with a scope name.
 *
 * <pre>{@code
 * var sp = SearchPath.of(
 *         SearchPath.Entry.scoped("project", projectDir.resolve(".myapp")),
 *         SearchPath.Entry.scoped("user", ConfigDirs.userConfigDir().resolve("myapp")));
 * Optional<Path> config = sp.first("config.toml");
 * }</pre>
 *
 * <p>Order is priority: lookups visit entries in order, {@link #first} returns the result from the
 * earliest entry that has one, and deduplicating lookups keep the earliest result per relative
 * path. Entries whose root does not exist are searched as empty.
 *
 * <p>Instances are immutable.
 */
public final class SearchPath implements Iterable<Path> {
    private static final Logger logger = LogManager.getLogger(SearchPath.class);

    private static final SearchPath EMPTY = new SearchPath(List.of());

    private final List<Entry> entries;

    private SearchPath(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    /**
     * One directory of a search path.
     *
     * <p>Create with {@link #scoped} or {@link #bare}. Bare entries get the scope {@code dir0},
     * {@code dir1}, ... from their position among the bare entries of the list they are passed in.
     * Entries without a root are dropped when the search path is built. In {@link #entries()} every
     * entry has a scope and a root.
     */
    public record Entry(@Nullable String scope, @Nullable Path root) {

        public Entry {
            if (scope != null && scope.isBlank()) {
                throw new ConfigurationException("Scope name must not be blank (root: " + root + ")");
            }
        }

        public static Entry scoped(String scope, @Nullable Path root) {
            if (scope == null) {
                throw new ConfigurationException("Scope name must not be blank (root: " + root + ")");
            }
            return new Entry(scope, root);
        }

        public static Entry bare(@Nullable Path root) {
            return new Entry(null, root);
        }

        public boolean isBare() {
            return scope == null;
        }
    }

    public static SearchPath of(Entry... entries) {
        return of(Arrays.asList(entries));
    }

    public static SearchPath of(List<Entry> entries) {
        var resolved = new ArrayList<Entry>(entries.size());
        int bareIndex = 0;
        for (var entry : entries) {
            if (entry == null) {
                continue;
            }
            String scope = entry.scope();
            if (scope == null) {
                if (entry.root() == null) {
                    continue;
                }
                scope = "dir" + bareIndex++;
            }
            var root = entry.root();
            if (root == null || root.toString().isEmpty()) {
                continue;
            }
            resolved.add(new Entry(scope, root));
        }
        return resolved.isEmpty() ? EMPTY : new SearchPath(resolved);
    }

    /** Search path of bare directories, named {@code dir0}, {@code dir1}, ... */
    public static SearchPath ofDirs(@Nullable Path... roots) {
        return of(Arrays.stream(roots).map(Entry::bare).toList());
    }

    public static SearchPath empty() {
        return EMPTY;
    }

    // ---------------------------------------------------------------------------------------------
    // Composition
    // ---------------------------------------------------------------------------------------------

    public List<Entry> entries() {
        return entries;
    }

    public List<Path> dirs() {
        return entries.stream().map(Entry::root).toList();
    }

    public List<String> scopes() {
        return entries.stream().map(Entry::scope).toList();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Iterates over the roots in priority order. */
    @Override
    public Iterator<Path> iterator() {
        return dirs().iterator();
    }

    /** This search path's entries followed by {@code other}'s. Scope names are kept as they are. */
    public SearchPath concat(SearchPath other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return new SearchPath(ImmutableList.<Entry>builder().addAll(entries).addAll(other.entries).build());
    }

    /** Appends the given path components to every root, e.g. {@code withSuffix(".config", "myapp")}. */
    public SearchPath withSuffix(String... parts) {
        return new SearchPath(entries.stream()
                .map(e -> {
                    var root = e.root();
                    for (var part : parts) {
                        root = root.resolve(part);
                    }
                    return new Entry(e.scope(), root);
                })
                .toList());
    }

    /** Keeps the entries whose root satisfies {@code predicate}. */
    public SearchPath filter(Predicate<Path> predicate) {
        return new SearchPath(
                entries.stream().filter(e -> predicate.test(e.root())).toList());
    }

    /** Keeps the entries whose root exists. */
    public SearchPath existing() {
        return filter(Files::exists);
    }

    // ---------------------------------------------------------------------------------------------
    // Lookups
    // ---------------------------------------------------------------------------------------------

    /** First file matching {@code pattern}, searching entries in order. */
    public Optional<Path> first(String pattern) {
        return first(SearchQuery.of(pattern));
    }

    public Optional<Path> first(SearchQuery query) {
        return match(query).map(Match::path);
    }

    /** Like {@link #first(String)}, with the scope and root it was found under. */
    public Optional<Match> match(String pattern) {
        return match(SearchQuery.of(pattern));
    }

    public Optional<Match> match(SearchQuery query) {
        var found = stream(query).findFirst();
        logger.debug("{} in [{}]: {}", query, this, found.map(Match::path).orElse(null));
        return found;
    }

    /** Every file matching {@code pattern}, in entry order. */
    public List<Path> all(String pattern) {
        return all(SearchQuery.of(pattern));
    }

    public List<Path> all(SearchQuery query) {
        return matches(query).stream().map(Match::path).toList();
    }

    /** Like {@link #all(String)}, with the scope and root of each result. */
    public List<Match> matches(String pattern) {
        return matches(SearchQuery.of(pattern));
    }

    /**
     * Every match in entry order. When {@link SearchQuery#dedupe()} is set, only the first match for
     * each relative path is kept, so a file in a higher-priority entry hides the same file below.
     */
    public List<Match> matches(SearchQuery query) {
        List<Match> result;
        try (var found = stream(query)) {
            if (query.dedupe()) {
                var byKey = new LinkedHashMap<String, Match>();
                found.forEach(m -> byKey.putIfAbsent(m.relativeKey(), m));
                result = List.copyOf(byKey.values());
            } else {
                result = found.collect(Collectors.toUnmodifiableList());
            }
        }
        logger.debug("{} in [{}]: {} matches", query, this, result.size());
        return result;
    }

    /**
     * Lazily walks the entries in order, without deduplication. Pattern files named by the query are
     * read before this method returns; directories are read as the stream is consumed.
     *
     * @throws io.github.searchpath.exception.PatternFileException if a pattern file cannot be read
     */
    public Stream<Match> stream(SearchQuery query) {
        var lookup = new Lookup(query);
        return entries.stream().flatMap(lookup::search);
    }

    /** State of one lookup call; the ancestor pattern cache lives exactly as long as the call. */
    private static final class Lookup {
        private final SearchQuery query;
        private final PatternMatcher matcher;
        private final List<String> include;
        private final List<String> exclude;

        @Nullable
        private final AncestorPatternCollector ancestors;

        Lookup(SearchQuery query) {
            this.query = query;
            this.include = AncestorPatterns.merge(query.include(), PatternFiles.loadAll(query.includeFrom()));
            this.exclude = AncestorPatterns.merge(query.exclude(), PatternFiles.loadAll(query.excludeFrom()));
            var queryMatcher = query.matcher();
            this.matcher = queryMatcher != null ? queryMatcher : new GlobMatcher();
            this.ancestors = query.usesAncestorPatterns() ? new AncestorPatternCollector() : null;
        }

        Stream<Match> search(Entry entry) {
            var root = entry.root();
            var scope = entry.scope();
            assert root != null && scope != null;

            // with ancestor patterns the include patterns are applied per candidate, after the walk
            var traversal = Traversal.builder(root)
                    .pattern(query.pattern())
                    .kind(query.kind())
                    .include(ancestors == null ? include : List.of())
                    .exclude(exclude)
                    .matcher(matcher)
                    .followSymlinks(query.followSymlinks())
                    .build();

            var candidates = traversal.stream();
            if (ancestors != null) {
                var walkRoot = traversal.root();
                candidates = candidates.filter(path -> passesAncestorPatterns(ancestors, path, walkRoot));
            }
            return candidates.map(path -> new Match(path, scope, root));
        }

        private boolean passesAncestorPatterns(AncestorPatternCollector collector, Path path, Path walkRoot) {
            var collected = collector.collect(
                    path, walkRoot, query.includeFromAncestors(), query.excludeFromAncestors());
            var rel = PathUtil.toUnixPath(walkRoot.relativize(path));
            return matcher.matches(
                    rel,
                    Files.isDirectory(path),
                    AncestorPatterns.merge(collected.include(), include),
                    AncestorPatterns.merge(collected.exclude(), exclude));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof SearchPath other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    /** {@code scope: path, ...}, or {@code (empty)}. */
    @Override
    public String toString() {
        if (entries.isEmpty()) {
            return "(empty)";
        }
        return entries.stream().map(e -> e.scope() + ": " + e.root()).collect(Collectors.joining(", "));
    }
}
