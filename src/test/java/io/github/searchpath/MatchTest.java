package io.github.searchpath;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class MatchTest {

    @Test
    void relativeToSource() {
        var source = Path.of("/home/user/.config/myapp");
        var match = new Match(source.resolve("config.toml"), "user", source);
        assertEquals(Path.of("config.toml"), match.relative());
    }

    @Test
    void nestedRelativeKeyUsesForwardSlashes() {
        var source = Path.of("/etc/myapp");
        var match = new Match(source.resolve("conf.d").resolve("10-base.toml"), "system", source);
        assertEquals(Path.of("conf.d", "10-base.toml"), match.relative());
        assertEquals("conf.d/10-base.toml", match.relativeKey());
    }

    @Test
    void relativeSourceIsResolvedAgainstWorkingDirectory() {
        var source = Path.of("configs", "..", "configs");
        var path = Path.of("configs", "app.toml").toAbsolutePath();
        assertEquals("app.toml", new Match(path, "dir0", source).relativeKey());
    }

    @Test
    void valueSemantics() {
        var a = new Match(Path.of("/r/x"), "s", Path.of("/r"));
        var b = new Match(Path.of("/r/x"), "s", Path.of("/r"));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new Match(Path.of("/r/x"), "other", Path.of("/r")));
    }
}
