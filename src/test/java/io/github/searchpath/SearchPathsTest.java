package io.github.searchpath;

import static org.junit.jupiter.api.Assertions.*;

import io.github.searchpath.SearchPath.Entry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SearchPathsTest {

    @TempDir
    Path temp;

    Path dirA;
    Path dirB;

    @BeforeEach
    void setUp() throws IOException {
        dirA = Files.createDirectories(temp.resolve("a"));
        dirB = Files.createDirectories(temp.resolve("b"));
        Files.writeString(dirB.resolve("config.toml"), "b");
        Files.writeString(dirB.resolve("other.toml"), "b");
    }

    @Test
    void firstSkipsEntriesWithoutTheFile() {
        var found = SearchPaths.first("config.toml", Entry.scoped("a", dirA), Entry.scoped("b", dirB));
        assertEquals(Optional.of(dirB.resolve("config.toml")), found);
    }

    @Test
    void firstOverBareDirectories() {
        assertEquals(Optional.of(dirB.resolve("config.toml")), SearchPaths.first("config.toml", dirA, dirB));
    }

    @Test
    void matchNamesBareDirectories() {
        var match = SearchPaths.match("config.toml", dirA, dirB).orElseThrow();
        assertEquals("dir1", match.scope());
        assertEquals(dirB, match.source());
    }

    @Test
    void allDedupesAcrossEntries() throws IOException {
        Files.writeString(dirA.resolve("config.toml"), "a");
        var found = SearchPaths.all("config.toml", Entry.scoped("first", dirA), Entry.scoped("second", dirB));
        assertEquals(List.of(dirA.resolve("config.toml")), found);

        var query = SearchQuery.builder().pattern("config.toml").dedupe(false).build();
        var everything = SearchPaths.all(query, Entry.scoped("first", dirA), Entry.scoped("second", dirB));
        assertEquals(List.of(dirA.resolve("config.toml"), dirB.resolve("config.toml")), everything);
    }

    @Test
    void matchesWithQuery() {
        var query = SearchQuery.builder().pattern("*.toml").exclude("other.*").build();
        var found = SearchPaths.matches(query, Entry.scoped("b", dirB));
        assertEquals(1, found.size());
        assertEquals("config.toml", found.get(0).relativeKey());
    }

    @Test
    void matchesOverBareDirectories() {
        assertEquals(2, SearchPaths.matches("*.toml", dirA, dirB).size());
    }

    @Test
    void nothingFound() {
        assertTrue(SearchPaths.first("missing", dirA, dirB).isEmpty());
        assertTrue(SearchPaths.match(SearchQuery.of("missing"), Entry.scoped("a", dirA)).isEmpty());
        assertTrue(SearchPaths.all("missing", dirA).isEmpty());
    }
}
