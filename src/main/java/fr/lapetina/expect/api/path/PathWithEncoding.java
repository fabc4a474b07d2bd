package fr.lapetina.expect.api.path;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A path to compare textual content against, with the charsets used to read the subject
 * ({@code sourceCharset}) and this path ({@code targetCharset}).
 */
public record PathWithEncoding(Path path, Charset sourceCharset, Charset targetCharset) {

    public PathWithEncoding {
        Objects.requireNonNull(path, "Path is required");
        Objects.requireNonNull(sourceCharset, "Source charset is required");
        Objects.requireNonNull(targetCharset, "Target charset is required");
    }

    /**
     * Reads both files as UTF-8.
     */
    public static PathWithEncoding withEncoding(Path path) {
        return new PathWithEncoding(path, StandardCharsets.UTF_8, StandardCharsets.UTF_8);
    }

    /**
     * Reads the subject with {@code sourceCharset} and the given path as UTF-8.
     */
    public static PathWithEncoding withEncoding(Path path, Charset sourceCharset) {
        return new PathWithEncoding(path, sourceCharset, StandardCharsets.UTF_8);
    }

    public static PathWithEncoding withEncoding(Path path, Charset sourceCharset, Charset targetCharset) {
        return new PathWithEncoding(path, sourceCharset, targetCharset);
    }
}
