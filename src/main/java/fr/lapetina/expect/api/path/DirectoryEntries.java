package fr.lapetina.expect.api.path;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Entries a directory is expected to have, relative to the directory.
 *
 * <pre>{@code
 * expect(dir).toHave(directoryEntries("a.txt", "sub/b.txt"));
 * }</pre>
 */
public final class DirectoryEntries {

    private final List<String> entries;

    private DirectoryEntries(List<String> entries) {
        this.entries = List.copyOf(entries);
    }

    public static DirectoryEntries directoryEntries(String entry, String... otherEntries) {
        List<String> entries = new ArrayList<>();
        entries.add(Objects.requireNonNull(entry, "Entry is required"));
        for (String other : otherEntries) {
            entries.add(Objects.requireNonNull(other, "Entry is required"));
        }
        return new DirectoryEntries(entries);
    }

    public List<String> toList() {
        return entries;
    }

    @Override
    public String toString() {
        return "DirectoryEntries" + Arrays.toString(entries.toArray());
    }
}
