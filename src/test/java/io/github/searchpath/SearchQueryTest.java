package io.github.searchpath;

import static org.junit.jupiter.api.Assertions.*;

import io.github.searchpath.exception.ConfigurationException;
import io.github.searchpath.matcher.RegexMatcher;
import io.github.searchpath.traversal.Kind;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class SearchQueryTest {

    @Test
    void defaults() {
        var q = SearchQuery.all();
        assertEquals("**", q.pattern());
        assertEquals(Kind.FILES, q.kind());
        assertEquals(List.of(), q.include());
        assertEquals(List.of(), q.exclude());
        assertEquals(List.of(), q.includeFrom());
        assertEquals(List.of(), q.excludeFrom());
        assertNull(q.includeFromAncestors());
        assertNull(q.excludeFromAncestors());
        assertNull(q.matcher());
        assertTrue(q.followSymlinks());
        assertTrue(q.dedupe());
        assertFalse(q.usesAncestorPatterns());
    }

    @Test
    void ofSetsOnlyThePattern() {
        var q = SearchQuery.of("*.toml");
        assertEquals("*.toml", q.pattern());
        assertEquals(Kind.FILES, q.kind());
        assertSame(SearchQuery.all(), SearchQuery.of("**"));
    }

    @Test
    void builderCopiesLists() {
        var include = new java.util.ArrayList<>(List.of("*.py"));
        var q = SearchQuery.builder().include(include).build();
        include.add("*.txt");
        assertEquals(List.of("*.py"), q.include());
    }

    @Test
    void kindFromString() {
        assertEquals(Kind.BOTH, SearchQuery.builder().kind("both").build().kind());
        assertThrows(ConfigurationException.class, () -> SearchQuery.builder().kind("links"));
    }

    @Test
    void eitherAncestorFilenameEnablesAncestorMode() {
        assertTrue(SearchQuery.builder().includeFromAncestors(".inc").build().usesAncestorPatterns());
        assertTrue(SearchQuery.builder().excludeFromAncestors(".ign").build().usesAncestorPatterns());
    }

    @Test
    void toBuilderKeepsEverySetting() {
        var matcher = new RegexMatcher();
        var original = SearchQuery.builder()
                .pattern("x")
                .kind(Kind.DIRS)
                .include("a")
                .includeFrom(Path.of("inc.txt"))
                .includeFromAncestors(".inc")
                .exclude("b")
                .excludeFrom(Path.of("exc.txt"))
                .excludeFromAncestors(".ign")
                .matcher(matcher)
                .followSymlinks(false)
                .dedupe(false)
                .build();

        var copy = original.toBuilder().build();

        assertEquals("x", copy.pattern());
        assertEquals(Kind.DIRS, copy.kind());
        assertEquals(List.of("a"), copy.include());
        assertEquals(List.of(Path.of("inc.txt")), copy.includeFrom());
        assertEquals(".inc", copy.includeFromAncestors());
        assertEquals(List.of("b"), copy.exclude());
        assertEquals(List.of(Path.of("exc.txt")), copy.excludeFrom());
        assertEquals(".ign", copy.excludeFromAncestors());
        assertSame(matcher, copy.matcher());
        assertFalse(copy.followSymlinks());
        assertFalse(copy.dedupe());
        assertEquals(original.toString(), copy.toString());
    }
}
