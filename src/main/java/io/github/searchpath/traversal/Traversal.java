package io.github.searchpath.traversal;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Streams;
import io.github.searchpath.matcher.GlobMatcher;
import io.github.searchpath.matcher.PatternMatcher;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Lazy walk of a single directory tree.
 *
 * <p>Each candidate is matched on its path relative to the root (forward slashes). Directories
 * rejected by the exclude patterns are pruned: neither they nor anything below them is visited.
 * The top-level pattern, unless it is the match-all {@code **}, is OR-ed with the include patterns.
 *
 * <p>Order is depth-first. Within a directory, entries are sorted by name and directories are
 * yielded before files; subdirectories are then descended in name order.
 *
 * <p>Problems with the file system never surface as exceptions: a missing root yields nothing,
 * unreadable directories and broken symlinks are skipped.
 */
public final class Traversal implements Iterable<Path> {
    private static final Logger logger = LogManager.getLogger(Traversal.class);

    public static final String MATCH_ALL = "**";

    private static final Comparator<Path> BY_NAME =
            Comparator.comparing(p -> p.getFileName().toString());

    private final Path root;
    private final String pattern;
    private final Kind kind;
    private final List<String> include;
    private final List<String> exclude;
    private final PatternMatcher matcher;
    private final boolean followSymlinks;

    private Traversal(Builder builder) {
        this.root = builder.root.toAbsolutePath().normalize();
        this.pattern = builder.pattern;
        this.kind = builder.kind;
        this.include = builder.include;
        this.exclude = builder.exclude;
        this.matcher = builder.matcher != null ? builder.matcher : new GlobMatcher();
        this.followSymlinks = builder.followSymlinks;
    }

    public static Builder builder(Path root) {
        return new Builder(root);
    }

    /** Absolute, normalized root of this walk. */
    public Path root() {
        return root;
    }

    /** Starts a new walk. */
    @Override
    public Iterator<Path> iterator() {
        return new Walker(effectiveInclude());
    }

    /** Starts a new walk; each call re-reads the tree. */
    public Stream<Path> stream() {
        return Streams.stream(iterator());
    }

    public List<Path> toList() {
        return ImmutableList.copyOf(iterator());
    }

    List<String> effectiveInclude() {
        if (MATCH_ALL.equals(pattern)) {
            return include;
        }
        return ImmutableList.<String>builder().add(pattern).addAll(include).build();
    }

    private record Frame(Path dir, String rel, @Nullable Frame parent) {}

    private final class Walker extends AbstractIterator<Path> {
        private final List<String> effectiveInclude;
        private final Deque<Frame> pendingDirs = new ArrayDeque<>();
        private final Deque<Path> ready = new ArrayDeque<>();

        Walker(List<String> effectiveInclude) {
            this.effectiveInclude = effectiveInclude;
            if (Files.isDirectory(root)) {
                pendingDirs.push(new Frame(root, "", null));
            } else {
                logger.debug("Search root {} is missing or not a directory", root);
            }
        }

        @Override
        protected Path computeNext() {
            while (ready.isEmpty()) {
                if (pendingDirs.isEmpty()) {
                    return endOfData();
                }
                visit(pendingDirs.pop());
            }
            return ready.poll();
        }

        private void visit(Frame frame) {
            List<Path> children;
            try (var listing = Files.list(frame.dir())) {
                children = listing.sorted(BY_NAME).toList();
            } catch (IOException | UncheckedIOException e) {
                logger.debug("Skipping unreadable directory {}: {}", frame.dir(), e.getMessage());
                return;
            }

            var dirs = new ArrayList<Path>();
            var files = new ArrayList<Path>();
            var descend = new ArrayList<Frame>();
            for (var child : children) {
                var name = child.getFileName().toString();
                var rel = frame.rel().isEmpty() ? name : frame.rel() + "/" + name;
                boolean isLink = Files.isSymbolicLink(child);
                if (isLink && !Files.exists(child)) {
                    logger.trace("Skipping broken symlink {}", child);
                    continue;
                }

                if (!Files.isDirectory(child)) {
                    if (kind.includesFiles() && matcher.matches(rel, false, effectiveInclude, exclude)) {
                        files.add(child);
                    }
                    continue;
                }

                if (!exclude.isEmpty() && !matcher.matches(rel, true, List.of(), exclude)) {
                    logger.trace("Pruned {}", rel);
                    continue;
                }
                if (kind.includesDirs() && matcher.matches(rel, true, effectiveInclude, exclude)) {
                    dirs.add(child);
                }
                if (!isLink || (followSymlinks && !revisits(frame, child))) {
                    descend.add(new Frame(child, rel, frame));
                }
            }

            ready.addAll(dirs);
            ready.addAll(files);
            for (int i = descend.size() - 1; i >= 0; i--) {
                pendingDirs.push(descend.get(i));
            }
        }

        /** Whether a symlinked directory points back at a directory already on the current walk path. */
        private boolean revisits(Frame parent, Path link) {
            try {
                var target = link.toRealPath();
                for (var f = parent; f != null; f = f.parent()) {
                    if (f.dir().toRealPath().equals(target)) {
                        logger.trace("Not following symlink cycle {} -> {}", link, target);
                        return true;
                    }
                }
                return false;
            } catch (IOException e) {
                logger.debug("Cannot resolve symlink {}: {}", link, e.getMessage());
                return true;
            }
        }
    }

    public static final class Builder {
        private final Path root;
        private String pattern = MATCH_ALL;
        private Kind kind = Kind.FILES;
        private List<String> include = List.of();
        private List<String> exclude = List.of();

        @Nullable
        private PatternMatcher matcher;

        private boolean followSymlinks = true;

        private Builder(Path root) {
            this.root = root;
        }

        /** Top-level pattern; defaults to {@code **}, which adds no constraint. */
        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder kind(Kind kind) {
            this.kind = kind;
            return this;
        }

        public Builder include(List<String> include) {
            this.include = List.copyOf(include);
            return this;
        }

        public Builder exclude(List<String> exclude) {
            this.exclude = List.copyOf(exclude);
            return this;
        }

        /** Matcher to evaluate patterns with; a fresh {@link GlobMatcher} when not set. */
        public Builder matcher(@Nullable PatternMatcher matcher) {
            this.matcher = matcher;
            return this;
        }

        public Builder followSymlinks(boolean followSymlinks) {
            this.followSymlinks = followSymlinks;
            return this;
        }

        public Traversal build() {
            return new Traversal(this);
        }
    }
}
