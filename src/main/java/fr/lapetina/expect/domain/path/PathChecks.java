package fr.lapetina.expect.domain.path;

import fr.lapetina.expect.domain.assertion.Assertion;
import fr.lapetina.expect.domain.assertion.AssertionGroup;
import fr.lapetina.expect.domain.assertion.DescriptiveAssertion;
import fr.lapetina.expect.domain.assertion.Text;
import fr.lapetina.expect.infrastructure.verification.Verifier;
import org.assertj.core.api.AbstractPathAssert;

import java.nio.charset.Charset;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * File system checks behind the path expectations, evaluated by AssertJ's path assertions.
 *
 * <p>Every check returns an evaluated assertion; AssertJ's failure message becomes its
 * explanation. None of the checks is atomic with respect to concurrent file system operations,
 * so explanations may be wrong if the file system changes meanwhile.
 */
public final class PathChecks {

    private PathChecks() {
        // Utility class
    }

    public static Assertion startsWith(Path subject, Path expected) {
        return Verifier.verify("to start with", expected, () -> assertThat(subject).startsWithRaw(expected));
    }

    public static Assertion startsNotWith(Path subject, Path expected) {
        return Verifier.verifyNot("not to start with", expected,
                () -> assertThat(subject).startsWithRaw(expected), List.of());
    }

    public static Assertion endsWith(Path subject, Path expected) {
        return Verifier.verify("to end with", expected, () -> assertThat(subject).endsWithRaw(expected));
    }

    public static Assertion endsNotWith(Path subject, Path expected) {
        return Verifier.verifyNot("not to end with", expected,
                () -> assertThat(subject).endsWithRaw(expected), List.of());
    }

    /**
     * An entry exists at the subject; symbolic links are followed.
     */
    public static Assertion exists(Path subject) {
        return Verifier.verify("to", new Text("exist"), () -> assertThat(subject).exists());
    }

    /**
     * No entry exists at the subject, not even a broken symbolic link.
     */
    public static Assertion existsNot(Path subject) {
        return Verifier.verify("not to", new Text("exist"), () -> assertThat(subject).doesNotExist());
    }

    /**
     * An entry exists at the subject and the current thread has, or lacks, the given access to it.
     * Symbolic links are followed.
     *
     * @param access name of the access, e.g. {@code readable}
     * @param check the AssertJ check of the access, e.g. {@link AbstractPathAssert#isReadable()}
     * @param expected whether the access is expected to be granted
     */
    public static Assertion hasAccess(
            Path subject,
            String access,
            Consumer<AbstractPathAssert<?>> check,
            boolean expected
    ) {
        if (expected) {
            return Verifier.verify("to be", new Text(access), () -> check.accept(assertThat(subject)));
        }
        Assertion existing = Verifier.verify("not to be", new Text(access), () -> assertThat(subject).exists());
        if (!existing.holds()) {
            return existing;
        }
        return Verifier.verifyNot("not to be", new Text(access), () -> check.accept(assertThat(subject)),
                List.of(subject + " is " + access));
    }

    public static Assertion isRegularFile(Path subject) {
        return Verifier.verify("to be", new Text("a file"), () -> assertThat(subject).isRegularFile());
    }

    public static Assertion isDirectory(Path subject) {
        return Verifier.verify("to be", new Text("a directory"), () -> assertThat(subject).isDirectory());
    }

    /**
     * The subject is a directory (symbolic links followed) and each entry resolved against it exists
     * (symbolic links of the entries not followed). One assertion per entry.
     *
     * <p>An entry must be a relative path; an absolute or malformed entry fails its assertion.
     */
    public static Assertion hasDirectoryEntries(Path subject, List<String> entries) {
        Assertion directory = isDirectory(subject);
        if (!directory.holds()) {
            return directory;
        }
        List<Assertion> assertions = new ArrayList<>();
        for (String entry : entries) {
            assertions.add(hasDirectoryEntry(subject, entry));
        }
        return AssertionGroup.summary(assertions);
    }

    private static Assertion hasDirectoryEntry(Path subject, String entry) {
        String description = "to have the directory entry";
        Path entryPath;
        try {
            entryPath = subject.getFileSystem().getPath(entry);
        } catch (InvalidPathException e) {
            return DescriptiveAssertion.of(description, entry, false, List.of("not a valid path: " + e.getMessage()));
        }
        if (entryPath.isAbsolute()) {
            return DescriptiveAssertion.of(description, entry, false,
                    List.of("an absolute path is not an entry of " + subject));
        }
        Path resolved = subject.resolve(entryPath);
        return Verifier.verify(description, entry, () -> assertThat(resolved).existsNoFollowLinks());
    }

    /**
     * The subject has the same text as the target, each read with its own charset.
     */
    public static Assertion hasSameTextualContentAs(Path subject, Path target, Charset sourceCharset, Charset targetCharset) {
        return Verifier.verify("to have the same textual content as", target,
                () -> assertThat(subject).usingCharset(sourceCharset).hasSameTextualContentAs(target, targetCharset));
    }

    public static Assertion hasSameBinaryContentAs(Path subject, Path target) {
        return Verifier.verify("to have the same binary content as", target,
                () -> assertThat(subject).hasSameBinaryContentAs(target));
    }
}
