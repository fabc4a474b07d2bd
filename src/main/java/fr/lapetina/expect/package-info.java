/**
 * Expect - fluent, English-phrased expectations for JVM tests.
 *
 * <p>Expectations read like sentences and report failures as an indented explanation of what
 * was expected and what was found.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.expect.Expectations} - The verbs {@code expect}, {@code expectObject}
 *       and {@code expectThrown}</li>
 *   <li>{@link fr.lapetina.expect.ExpectationSettings} - Active configuration and reporter</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * import static fr.lapetina.expect.Expectations.*;
 * import static fr.lapetina.expect.api.path.FileAccess.*;
 *
 * expect(LocalDateTime.of(2024, 3, 15, 10, 15)).year().toEqual(2024);
 *
 * expect(release, date -> {
 *     date.month().toEqual(3);
 *     date.dayOfWeek().toEqual(DayOfWeek.FRIDAY);
 * });
 *
 * expect(Paths.get("build/report.txt")).toEndWith(Paths.get("report.txt")).notToBe(EXECUTABLE);
 *
 * expectThrown(() -> Integer.parseInt("x")).toThrow(NumberFormatException.class).messageToContain("x");
 * }</pre>
 *
 * <h2>Failure Report</h2>
 * <pre>
 * expected the subject: 2024-03-15T10:15
 * ◆ ▶ year: 2024
 *     ◾ to equal: 2023
 * </pre>
 *
 * @see fr.lapetina.expect.Expectations
 * @see fr.lapetina.expect.api.AbstractExpect
 */
package fr.lapetina.expect;
