package io.github.searchpath.traversal;

import com.google.common.base.Splitter;
import io.github.searchpath.exception.PatternFileException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Pattern file reading.
 *
 * <p>A pattern file is UTF-8 text with one pattern per line. Lines end at {@code \n}, {@code \r\n},
 * a lone {@code \r} or any other Unicode line boundary. Each line is stripped of surrounding
 * whitespace; blank lines and lines starting with {@code #} are skipped.
 *
 * <p>{@link #load(Path)} is strict and raises {@link PatternFileException} for any problem with the
 * file. Ancestor pattern files are read leniently elsewhere, sharing {@link #parseLines(String)}.
 */
public final class PatternFiles {
    private static final Logger logger = LogManager.getLogger(PatternFiles.class);

    // \r\n, then every single-character line boundary
    private static final Splitter LINES =
            Splitter.onPattern("\\r\\n|[\\n\\r\\u000B\\u000C\\u001C-\\u001E\\u0085\\u2028\\u2029]");

    private PatternFiles() {}

    /**
     * Reads the patterns of one file.
     *
     * @throws PatternFileException if the file is missing, a directory, unreadable or not UTF-8
     */
    public static List<String> load(Path file) {
        if (Files.isDirectory(file)) {
            throw new PatternFileException(file, "is a directory");
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new PatternFileException(file, "file not found", null, e);
        } catch (AccessDeniedException e) {
            throw new PatternFileException(file, "permission denied", null, e);
        } catch (IOException e) {
            throw new PatternFileException(file, "cannot read file: " + e.getMessage(), null, e);
        }
        var patterns = parseLines(decode(file, bytes));
        logger.debug("Loaded {} patterns from {}", patterns.size(), file);
        return patterns;
    }

    /** Reads several files strictly and concatenates their patterns in order. */
    public static List<String> loadAll(List<Path> files) {
        if (files.isEmpty()) {
            return List.of();
        }
        var patterns = new ArrayList<String>();
        for (var file : files) {
            patterns.addAll(load(file));
        }
        return List.copyOf(patterns);
    }

    /** Splits pattern file content into patterns, dropping blank and comment lines. */
    public static List<String> parseLines(String content) {
        var patterns = new ArrayList<String>();
        for (var line : LINES.split(content)) {
            var stripped = line.strip();
            if (stripped.isEmpty() || stripped.startsWith("#")) {
                continue;
            }
            patterns.add(stripped);
        }
        return List.copyOf(patterns);
    }

    private static String decode(Path file, byte[] bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8
                .newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        var in = ByteBuffer.wrap(bytes);
        var out = CharBuffer.allocate((int) (bytes.length * (double) decoder.maxCharsPerByte()) + 1);
        CoderResult result = decoder.decode(in, out, true);
        if (result.isError()) {
            throw invalidEncoding(file, bytes, in.position(), result);
        }
        result = decoder.flush(out);
        if (result.isError()) {
            throw invalidEncoding(file, bytes, in.position(), result);
        }
        out.flip();
        return out.toString();
    }

    private static PatternFileException invalidEncoding(Path file, byte[] bytes, int offset, CoderResult result) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (bytes[i] == '\n') {
                line++;
            }
        }
        var reason = "invalid encoding: not valid UTF-8 (" + result + " at byte " + offset + ")";
        return new PatternFileException(file, reason, line);
    }
}
