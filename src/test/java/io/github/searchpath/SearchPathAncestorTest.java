package io.github.searchpath;

import static org.junit.jupiter.api.Assertions.*;

import io.github.searchpath.SearchPath.Entry;
import io.github.searchpath.matcher.GitignoreMatcher;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

/** Lookups that filter candidates with pattern files found in their ancestor directories. */
class SearchPathAncestorTest {

    private static final String IGNORE = ".searchignore";
    private static final String INCLUDE = ".searchinclude";

    @TempDir
    Path temp;

    private Path touch(String rel) throws IOException {
        var file = temp.resolve(rel);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "");
        return file;
    }

    private void patterns(String rel, String content) throws IOException {
        var file = temp.resolve(rel);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static SearchQuery.Builder excluding(String pattern) {
        return SearchQuery.builder().pattern(pattern).excludeFromAncestors(IGNORE);
    }

    private SearchPath dir() {
        return SearchPath.of(Entry.scoped("dir", temp));
    }

    @Test
    void excludeFileAtEntryRootFilters() throws IOException {
        var main = touch("main.py");
        touch("test_main.py");
        patterns(IGNORE, "test_*\n");

        assertEquals(List.of(main), dir().all(excluding("*.py").build()));
    }

    @Test
    void includeFileRestrictsResults() throws IOException {
        var main = touch("main.py");
        var readme = touch("readme.txt");
        touch("config.json");
        patterns(INCLUDE, "*.py\n*.txt\n");

        var found = dir().all(SearchQuery.builder().includeFromAncestors(INCLUDE).build());

        assertEquals(List.of(main, readme), found);
    }

    @Test
    void patternFileInSubdirectoryOnlyAffectsThatSubtree() throws IOException {
        var root = touch("root.py");
        var testRoot = touch("test_root.py");
        var main = touch("src/main.py");
        touch("src/test_main.py");
        patterns("src/" + IGNORE, "**/test_*\n");

        var found = dir().all(excluding("**/*.py").build());

        assertEquals(List.of(root, testRoot, main), found);
    }

    @Test
    void missingEmptyOrCommentOnlyFilesHaveNoEffect() throws IOException {
        var main = touch("main.py");
        var testMain = touch("test_main.py");
        assertEquals(List.of(main, testMain), dir().all(excluding("*.py").build()));

        patterns(IGNORE, "   \n\t\n# only a comment\n");
        assertEquals(List.of(main, testMain), dir().all(excluding("*.py").build()));
    }

    @Test
    void childPatternsAppendToParentPatterns() throws IOException {
        patterns(IGNORE, "test_*\n");
        patterns("src/" + IGNORE, "**/*_helper.py\n");
        var main = touch("main.py");
        touch("test_main.py");
        var testUtils = touch("src/test_utils.py");
        var utils = touch("src/utils.py");
        touch("src/file_helper.py");

        var found = dir().all(excluding("**/*.py").build());

        // root patterns are relative to the entry root, so test_* does not reach into src/
        assertEquals(List.of(main, testUtils, utils), found);
    }

    @Test
    void deepNestingCollectsEveryAncestor() throws IOException {
        patterns(IGNORE, "**/*.log\n");
        patterns("a/" + IGNORE, "**/*.tmp\n");
        patterns("a/b/" + IGNORE, "**/*.bak\n");
        var py = touch("a/b/c/file.py");
        touch("a/b/c/file.log");
        touch("a/b/c/file.tmp");
        touch("a/b/c/file.bak");

        var found = dir().all(excluding("**/file.*").build());

        assertEquals(List.of(py), found);
    }

    @Test
    void entryRootIsTheBoundary() throws IOException {
        patterns(IGNORE, "*.py\n");
        var main = touch("project/main.py");
        var sp = SearchPath.of(Entry.scoped("project", temp.resolve("project")));

        assertEquals(List.of(main), sp.all(excluding("*.py").build()));
    }

    @Test
    void entriesHaveIndependentBoundaries() throws IOException {
        patterns("entry1/" + IGNORE, "*.txt\n");
        patterns("entry2/" + IGNORE, "*.py\n");
        var py1 = touch("entry1/file.py");
        touch("entry1/file.txt");
        touch("entry2/file.py");
        var txt2 = touch("entry2/file.txt");
        var sp = SearchPath.of(
                Entry.scoped("e1", temp.resolve("entry1")), Entry.scoped("e2", temp.resolve("entry2")));

        var found = sp.all(excluding("file.*").dedupe(false).build());

        assertEquals(List.of(py1, txt2), found);
    }

    @Test
    void ancestorPatternsCombineWithInlineAndFilePatterns() throws IOException {
        patterns(IGNORE, "*.log\n");
        patterns("exclude.txt", "*.tmp\n");
        var main = touch("main.py");
        touch("test_main.py");
        touch("debug.log");
        touch("cache.tmp");

        var query = excluding("*.*")
                .exclude("test_*", "*.txt", ".*")
                .excludeFrom(temp.resolve("exclude.txt"))
                .build();

        assertEquals(List.of(main), dir().all(query));
    }

    @Test
    void inlineIncludeIsAddedToAncestorInclude() throws IOException {
        patterns(INCLUDE, "*.py\n");
        var main = touch("main.py");
        var readme = touch("readme.txt");
        touch("notes.md");

        var query = SearchQuery.builder().include("*.txt").includeFromAncestors(INCLUDE).build();

        assertEquals(List.of(main, readme), dir().all(query));
    }

    @Test
    void includeAndExcludeFromAncestorsTogether() throws IOException {
        patterns(INCLUDE, "*.py\n*.txt\n");
        patterns(IGNORE, "test_*\n");
        var main = touch("main.py");
        var readme = touch("readme.txt");
        touch("test_main.py");
        touch("config.json");

        var query = SearchQuery.builder()
                .includeFromAncestors(INCLUDE)
                .excludeFromAncestors(IGNORE)
                .build();

        assertEquals(List.of(main, readme), dir().all(query));
    }

    @Test
    void firstAndMatchSkipFilteredCandidates() throws IOException {
        patterns(IGNORE, "a_*\n");
        touch("a_first.py");
        var second = touch("b_second.py");

        assertEquals(Optional.of(second), dir().first(excluding("*.py").build()));
        var match = dir().match(excluding("*.py").build()).orElseThrow();
        assertEquals(second, match.path());
        assertEquals("dir", match.scope());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void backslashInFileNameIsMatchedLiterally() throws IOException {
        patterns(IGNORE, "x/*.txt\n");
        touch("x/y.txt");
        var backslashed = touch("x\\y.txt");

        assertEquals(List.of(backslashed), dir().all(excluding("**/*.txt").build()));
    }

    @Test
    void gitignoreNegationInChildDirectory() throws IOException {
        patterns(".gitignore", "*.py\n");
        patterns("src/.gitignore", "!main.py\n");
        touch("root.py");
        var main = touch("src/main.py");
        touch("src/test.py");

        var query = SearchQuery.builder()
                .pattern("**/*.py")
                .excludeFromAncestors(".gitignore")
                .matcher(new GitignoreMatcher())
                .build();

        assertEquals(List.of(main), dir().all(query));
    }

    @Test
    void gitignoreDirectoryOnlyPattern() throws IOException {
        patterns(".gitignore", "__pycache__/\n");
        var main = touch("main.py");
        touch("__pycache__/main.cpython-310.pyc");

        var query = SearchQuery.builder()
                .excludeFromAncestors(".gitignore")
                .matcher(new GitignoreMatcher())
                .build();

        var found = dir().all(query);
        assertTrue(found.contains(main));
        assertTrue(found.stream().noneMatch(p -> p.toString().endsWith(".pyc")), found.toString());
    }
}
