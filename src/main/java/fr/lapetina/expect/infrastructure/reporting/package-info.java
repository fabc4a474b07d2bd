/**
 * Reporting of failed expectations.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.expect.infrastructure.reporting.Reporter} - Reporting contract</li>
 *   <li>{@link fr.lapetina.expect.infrastructure.reporting.TextReporter} - Built-in {@code text} reporter</li>
 *   <li>{@link fr.lapetina.expect.infrastructure.reporting.ReporterFactory} - Registry for reporters by name</li>
 *   <li>{@link fr.lapetina.expect.infrastructure.reporting.ExpectationError} - Thrown for a failed expectation</li>
 * </ul>
 *
 * <h2>Custom Reporters</h2>
 * <pre>{@code
 * ReporterFactory.register("one-line", config -> new OneLineReporter());
 * }</pre>
 * and select it with {@code reporter.type: one-line} in {@code expect.yaml}.
 */
package fr.lapetina.expect.infrastructure.reporting;
