package io.github.searchpath.ancestor;

import io.github.searchpath.traversal.PatternFiles;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Gathers patterns from per-directory pattern files (an {@code .ignore}-style file) between an
 * entry root and a file.
 *
 * <p>The entry root is a hard boundary: nothing above it is ever read. Reading is lenient: a
 * missing, unreadable or badly encoded pattern file counts as empty.
 *
 * <p>Loaded files are cached by path for the life of the collector, so one collector should span
 * a single search; create a new one to see changes on disk. Not thread safe.
 */
public final class AncestorPatternCollector {
    private static final Logger logger = LogManager.getLogger(AncestorPatternCollector.class);

    private final Map<Path, List<String>> cache;

    public AncestorPatternCollector() {
        this(new HashMap<>());
    }

    /** Uses the given map as the pattern-file cache; the caller owns its lifetime. */
    public AncestorPatternCollector(Map<Path, List<String>> cache) {
        this.cache = cache;
    }

    /**
     * Collects patterns for {@code file} from every directory from {@code entryRoot} down to the
     * file's parent, both included.
     *
     * @param includeFilename name of the include pattern file to look for, or null
     * @param excludeFilename name of the exclude pattern file to look for, or null
     * @return the patterns in root-to-leaf order; empty when both names are null or when
     *     {@code file} is not under {@code entryRoot}
     */
    public AncestorPatterns collect(
            Path file, Path entryRoot, @Nullable String includeFilename, @Nullable String excludeFilename) {
        if (includeFilename == null && excludeFilename == null) {
            return AncestorPatterns.EMPTY;
        }

        var include = new ArrayList<String>();
        var exclude = new ArrayList<String>();
        for (var dir : ancestorDirs(file, entryRoot)) {
            if (includeFilename != null) {
                include.addAll(load(dir.resolve(includeFilename)));
            }
            if (excludeFilename != null) {
                exclude.addAll(load(dir.resolve(excludeFilename)));
            }
        }
        return new AncestorPatterns(include, exclude);
    }

    /** Directories from {@code entryRoot} to the parent of {@code file}; empty if file is outside the root. */
    static List<Path> ancestorDirs(Path file, Path entryRoot) {
        var root = entryRoot.toAbsolutePath().normalize();
        var parent = file.toAbsolutePath().normalize().getParent();
        if (parent == null || !parent.startsWith(root)) {
            return List.of();
        }

        var dirs = new ArrayList<Path>();
        var current = root;
        dirs.add(current);
        for (var part : root.relativize(parent)) {
            if (part.toString().isEmpty()) {
                continue;
            }
            current = current.resolve(part);
            dirs.add(current);
        }
        return dirs;
    }

    private List<String> load(Path patternFile) {
        var cached = cache.get(patternFile);
        if (cached != null) {
            return cached;
        }
        var patterns = readLenient(patternFile);
        cache.put(patternFile, patterns);
        return patterns;
    }

    private static List<String> readLenient(Path patternFile) {
        if (!Files.isRegularFile(patternFile)) {
            return List.of();
        }
        try {
            var content = StandardCharsets.UTF_8
                    .newDecoder()
                    .decode(ByteBuffer.wrap(Files.readAllBytes(patternFile)))
                    .toString();
            return PatternFiles.parseLines(content);
        } catch (CharacterCodingException e) {
            logger.debug("Ignoring pattern file {} with invalid encoding", patternFile);
            return List.of();
        } catch (IOException e) {
            logger.debug("Ignoring unreadable pattern file {}: {}", patternFile, e.getMessage());
            return List.of();
        }
    }

    /** Number of pattern files read or found missing so far. */
    int cachedFileCount() {
        return cache.size();
    }
}
