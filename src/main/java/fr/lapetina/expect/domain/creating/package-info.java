/**
 * Creation of assertions behind the fluent API.
 *
 * <p>An {@link fr.lapetina.expect.domain.creating.AssertionContainer} pairs a
 * {@link fr.lapetina.expect.domain.creating.Subject} with an
 * {@link fr.lapetina.expect.domain.creating.AssertionSink}. Three sinks exist:
 * <ul>
 *   <li>{@link fr.lapetina.expect.domain.creating.ReportingSink} - reports on append, used by the verbs</li>
 *   <li>{@link fr.lapetina.expect.domain.creating.CollectingSink} - keeps the output of an assertion creator</li>
 *   <li>{@code FeatureSink} - wraps assertions about a feature and forwards them to its parent</li>
 * </ul>
 */
package fr.lapetina.expect.domain.creating;
