package io.github.searchpath;

import io.github.searchpath.util.PathUtil;
import java.nio.file.Path;

/**
 * A path found by a lookup, with where it was found.
 *
 * @param path absolute path of the file or directory
 * @param scope scope name of the entry it was found under
 * @param source root of that entry, as it was given to the search path
 */
public record Match(Path path, String scope, Path source) {

    /** Path relative to {@link #source()}. */
    public Path relative() {
        return source.toAbsolutePath().normalize().relativize(path);
    }

    /** Forward-slash form of {@link #relative()}; two matches with equal keys name the same file. */
    public String relativeKey() {
        return PathUtil.toUnixPath(relative());
    }
}
