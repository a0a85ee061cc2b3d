package io.github.searchpath.util;

import com.google.common.base.Splitter;
import io.github.searchpath.SearchPath;
import java.io.File;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Platform-appropriate configuration directories, for building the usual layered lookup of
 * project, user and system configuration. Optional: nothing else in the library depends on it, and
 * a {@link SearchPath} can be built from any directories.
 *
 * <p>User configuration:
 * - Windows: %APPDATA% (fallback: ~/AppData/Roaming)
 * - macOS: ~/Library/Application Support
 * - Linux and others: $XDG_CONFIG_HOME (fallback: ~/.config)
 *
 * <p>System configuration:
 * - Windows: %PROGRAMDATA% (fallback: C:\ProgramData)
 * - macOS: /Library/Application Support
 * - Linux and others: every entry of $XDG_CONFIG_DIRS (fallback: /etc/xdg)
 *
 * <p>The {@value #CONFIG_HOME_PROPERTY} system property replaces the user configuration base.
 */
public final class ConfigDirs {
    private static final Logger logger = LogManager.getLogger(ConfigDirs.class);

    public static final String CONFIG_HOME_PROPERTY = "searchpath.config.home";

    private static final Path DEFAULT_XDG_CONFIG_DIR = Path.of("/etc/xdg");

    private ConfigDirs() {}

    private enum Platform {
        WINDOWS,
        MAC,
        OTHER;

        static Platform of(String osName) {
            var os = osName.toLowerCase(Locale.ROOT);
            if (os.contains("win")) {
                return WINDOWS;
            }
            return os.contains("mac") ? MAC : OTHER;
        }
    }

    /** Base directory for per-user configuration. */
    public static Path userConfigDir() {
        return Resolver.current().userConfigDir();
    }

    /** Base directories for machine-wide configuration, most important first. */
    public static List<Path> systemConfigDirs() {
        return Resolver.current().systemConfigDirs();
    }

    /**
     * Builds a search path of {@code project}, then {@code user}, then {@code system} for an
     * application. The project entry is skipped when {@code projectDir} is null. Several system
     * directories produce several entries, all scoped {@code system}.
     */
    public static SearchPath searchPath(String appName, @Nullable Path projectDir) {
        return Resolver.current().searchPath(appName, projectDir);
    }

    /** Resolves directories from explicit inputs so that every platform can be tested anywhere. */
    record Resolver(String osName, Map<String, String> env, Path userHome, Optional<String> configHomeOverride) {

        static Resolver current() {
            return new Resolver(
                    System.getProperty("os.name", ""),
                    System.getenv(),
                    Path.of(System.getProperty("user.home")),
                    Optional.ofNullable(System.getProperty(CONFIG_HOME_PROPERTY)));
        }

        private Platform platform() {
            return Platform.of(osName);
        }

        private Optional<Path> envPath(String name) {
            return Optional.ofNullable(env.get(name)).filter(s -> !s.isBlank()).map(Path::of);
        }

        /** The configured override, unless it is blank or not a usable path. */
        private Optional<Path> overridePath() {
            var value = configHomeOverride.filter(s -> !s.isBlank());
            if (value.isEmpty()) {
                return Optional.empty();
            }
            try {
                return Optional.of(Path.of(value.get()));
            } catch (InvalidPathException e) {
                logger.warn("Ignoring {}='{}': {}", CONFIG_HOME_PROPERTY, value.get(), e.getMessage());
                return Optional.empty();
            }
        }

        Path userConfigDir() {
            var override = overridePath();
            if (override.isPresent()) {
                return override.get();
            }
            return switch (platform()) {
                case WINDOWS -> envPath("APPDATA").orElse(userHome.resolve("AppData").resolve("Roaming"));
                case MAC -> userHome.resolve("Library").resolve("Application Support");
                case OTHER -> envPath("XDG_CONFIG_HOME").orElse(userHome.resolve(".config"));
            };
        }

        List<Path> systemConfigDirs() {
            switch (platform()) {
                case WINDOWS:
                    return List.of(envPath("PROGRAMDATA").orElse(Path.of("C:\\ProgramData")));
                case MAC:
                    return List.of(Path.of("/Library/Application Support"));
                default:
                    break;
            }
            var dirs = new ArrayList<Path>();
            var xdgDirs = Optional.ofNullable(env.get("XDG_CONFIG_DIRS")).orElse("");
            for (var dir : Splitter.on(File.pathSeparatorChar).omitEmptyStrings().trimResults().split(xdgDirs)) {
                dirs.add(Path.of(dir));
            }
            return dirs.isEmpty() ? List.of(DEFAULT_XDG_CONFIG_DIR) : List.copyOf(dirs);
        }

        SearchPath searchPath(String appName, @Nullable Path projectDir) {
            var entries = new ArrayList<SearchPath.Entry>();
            entries.add(SearchPath.Entry.scoped("project", projectDir));
            entries.add(SearchPath.Entry.scoped("user", userConfigDir().resolve(appName)));
            for (var dir : systemConfigDirs()) {
                entries.add(SearchPath.Entry.scoped("system", dir.resolve(appName)));
            }
            return SearchPath.of(entries);
        }
    }
}
