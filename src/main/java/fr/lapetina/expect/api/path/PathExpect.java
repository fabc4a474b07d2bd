package fr.lapetina.expect.api.path;

import fr.lapetina.expect.api.AbstractExpect;
import fr.lapetina.expect.api.ObjectExpect;
import fr.lapetina.expect.domain.assertion.Assertion;
import fr.lapetina.expect.domain.assertion.Text;
import fr.lapetina.expect.domain.creating.AssertionContainer;
import fr.lapetina.expect.domain.path.PathChecks;

import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Expectation about a {@link Path}.
 *
 * <p>Checks touching the file system resolve symbolic links of the subject unless stated
 * otherwise. They are not atomic with respect to concurrent file system operations; the result,
 * in particular its explanations, may be wrong if such operations take place.
 */
public final class PathExpect extends AbstractExpect<PathExpect, Path> {

    public PathExpect(AssertionContainer<Path> container) {
        super(container);
    }

    @Override
    protected PathExpect newInstance(AssertionContainer<Path> container) {
        return new PathExpect(container);
    }

    /**
     * Expects that the subject starts with the {@code expected} path, as {@link Path#startsWith(Path)}.
     */
    public PathExpect toStartWith(Path expected) {
        Objects.requireNonNull(expected, "Expected path is required");
        return check("to start with", expected, subject -> PathChecks.startsWith(subject, expected));
    }

    /**
     * Expects that the subject does not start with the {@code expected} path.
     */
    public PathExpect notToStartWith(Path expected) {
        Objects.requireNonNull(expected, "Expected path is required");
        return check("not to start with", expected, subject -> PathChecks.startsNotWith(subject, expected));
    }

    /**
     * Expects that the subject ends with the {@code expected} path, as {@link Path#endsWith(Path)}.
     */
    public PathExpect toEndWith(Path expected) {
        Objects.requireNonNull(expected, "Expected path is required");
        return check("to end with", expected, subject -> PathChecks.endsWith(subject, expected));
    }

    /**
     * Expects that the subject does not end with the {@code expected} path.
     */
    public PathExpect notToEndWith(Path expected) {
        Objects.requireNonNull(expected, "Expected path is required");
        return check("not to end with", expected, subject -> PathChecks.endsNotWith(subject, expected));
    }

    /**
     * Expects that the subject is a directory having the given entries.
     *
     * <p>Symbolic links are resolved for the subject but not for the entries: a symbolic link
     * at an entry fulfills the expectation for that entry without being followed.
     */
    public PathExpect toHave(DirectoryEntries directoryEntries) {
        Objects.requireNonNull(directoryEntries, "Directory entries are required");
        return check("to be", new Text("a directory"),
                subject -> PathChecks.hasDirectoryEntries(subject, directoryEntries.toList()));
    }

    /**
     * Expects that the subject has the same textual content as {@code targetPath}, both read as UTF-8.
     */
    public PathExpect toHaveTheSameTextualContentAs(Path targetPath) {
        return toHaveTheSameTextualContentAs(PathWithEncoding.withEncoding(targetPath));
    }

    /**
     * Expects that the subject has the same textual content as the given path, each read with
     * the charset given for it.
     */
    public PathExpect toHaveTheSameTextualContentAs(PathWithEncoding pathWithEncoding) {
        Objects.requireNonNull(pathWithEncoding, "Path with encoding is required");
        return check("to have the same textual content as", pathWithEncoding.path(),
                subject -> PathChecks.hasSameTextualContentAs(subject, pathWithEncoding.path(),
                        pathWithEncoding.sourceCharset(), pathWithEncoding.targetCharset()));
    }

    public PathExpect toHaveTheSameBinaryContentAs(Path targetPath) {
        Objects.requireNonNull(targetPath, "Target path is required");
        return check("to have the same binary content as", targetPath,
                subject -> PathChecks.hasSameBinaryContentAs(subject, targetPath));
    }

    /**
     * Expects that there is a file system entry at the subject and that the current thread
     * has the given access to it.
     */
    public PathExpect toBe(FileAccess access) {
        return access(access, true);
    }

    /**
     * Expects that there is a file system entry at the subject and that the current thread
     * does not have the given access to it.
     */
    public PathExpect notToBe(FileAccess access) {
        return access(access, false);
    }

    public PathExpect toExist() {
        return check("to", new Text("exist"), PathChecks::exists);
    }

    /**
     * Expects that there is no file system entry at the subject. Symbolic links are not followed,
     * so a broken link makes this fail.
     */
    public PathExpect notToExist() {
        return check("not to", new Text("exist"), PathChecks::existsNot);
    }

    public PathExpect toBeARegularFile() {
        return check("to be", new Text("a file"), PathChecks::isRegularFile);
    }

    public PathExpect toBeADirectory() {
        return check("to be", new Text("a directory"), PathChecks::isDirectory);
    }

    /**
     * Creates an expectation for the name of the last element of the subject.
     */
    public ObjectExpect<String> fileName() {
        return feature("file name", PathExpect::fileNameOf);
    }

    public PathExpect fileName(Consumer<? super ObjectExpect<String>> assertionCreator) {
        return feature("file name", PathExpect::fileNameOf, assertionCreator);
    }

    /**
     * Creates an expectation for the extension of the file name, without the dot; empty if there is none.
     */
    public ObjectExpect<String> extension() {
        return feature("extension", subject -> {
            String fileName = fileNameOf(subject);
            int dot = fileName.lastIndexOf('.');
            return dot > 0 ? fileName.substring(dot + 1) : "";
        });
    }

    /**
     * Creates an expectation for the parent of the subject.
     */
    public PathExpect parent() {
        return new PathExpect(container.extractFeature("parent", subject -> {
            Path parent = subject.getParent();
            if (parent == null) {
                throw new IllegalStateException(subject + " has no parent");
            }
            return parent;
        }));
    }

    private PathExpect access(FileAccess access, boolean expected) {
        Objects.requireNonNull(access, "Access is required");
        return check(expected ? "to be" : "not to be", new Text(access.getText()),
                subject -> PathChecks.hasAccess(subject, access.getText(), access.getCheck(), expected));
    }

    private PathExpect check(String description, Object expected, Function<Path, Assertion> factory) {
        container.appendFor(description, expected, factory);
        return self();
    }

    private static String fileNameOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            throw new IllegalStateException(path + " has no file name");
        }
        return fileName.toString();
    }
}
