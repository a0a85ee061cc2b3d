package io.github.searchpath.matcher;

import io.github.searchpath.exception.InvalidPatternException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.ignore.FastIgnoreRule;
import org.eclipse.jgit.ignore.IgnoreNode;
import org.eclipse.jgit.ignore.IgnoreNode.MatchResult;

/**
 * Matcher with full gitignore semantics, backed by JGit's {@link IgnoreNode}.
 *
 * <p>Supports negation ({@code !pattern}), directory-only patterns ({@code build/}) and anchoring
 * ({@code /pattern}). Within one pattern list the last matching rule wins. As in git, a path whose
 * parent directory is matched cannot be re-included by a later negation.
 *
 * <p>Include and exclude lists are evaluated independently: a path passes the include list when it
 * ends up "ignored" by it, and is rejected by the exclude list on the same condition.
 */
public final class GitignoreMatcher implements PatternMatcher {
    private static final Logger logger = LogManager.getLogger(GitignoreMatcher.class);

    // Keyed by the ordered pattern list; order matters for negation
    private final Map<List<String>, IgnoreNode> nodeCache = new HashMap<>();

    @Override
    public boolean supportsNegation() {
        return true;
    }

    @Override
    public boolean supportsDirOnly() {
        return true;
    }

    @Override
    public boolean matches(String path, boolean isDir, List<String> include, List<String> exclude) {
        if (!include.isEmpty() && !isMatched(node(include), path, isDir)) {
            return false;
        }
        return exclude.isEmpty() || !isMatched(node(exclude), path, isDir);
    }

    private IgnoreNode node(List<String> patterns) {
        var cached = nodeCache.get(patterns);
        if (cached != null) {
            return cached;
        }
        var rules = new ArrayList<FastIgnoreRule>(patterns.size());
        for (var pattern : patterns) {
            if (pattern.isEmpty()) {
                throw new InvalidPatternException(pattern, "empty pattern");
            }
            // JGit logs and disables rules it cannot parse rather than throwing
            rules.add(new FastIgnoreRule(pattern));
        }
        var node = new IgnoreNode(rules);
        nodeCache.put(List.copyOf(patterns), node);
        logger.trace("Compiled {} gitignore rules", rules.size());
        return node;
    }

    private static boolean isMatched(IgnoreNode node, String path, boolean isDir) {
        // "It is not possible to re-include a file if a parent directory is excluded"
        int slash = path.indexOf('/');
        while (slash > 0) {
            if (node.isIgnored(path.substring(0, slash), true) == MatchResult.IGNORED) {
                return true;
            }
            slash = path.indexOf('/', slash + 1);
        }
        return node.isIgnored(path, isDir) == MatchResult.IGNORED;
    }

    /** Number of distinct pattern lists compiled so far. */
    int cachedRuleSetCount() {
        return nodeCache.size();
    }
}
