/**
 * Expectations about {@link java.nio.file.Path}s.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * expect(report)
 *     .toStartWith(buildDir)
 *     .notToBe(EXECUTABLE)
 *     .toHaveTheSameTextualContentAs(withEncoding(expected, ISO_8859_1, UTF_8));
 *
 * expect(buildDir).toHave(directoryEntries("classes", "report.txt"));
 * }</pre>
 */
package fr.lapetina.expect.api.path;
