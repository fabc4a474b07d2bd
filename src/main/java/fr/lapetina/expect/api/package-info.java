/**
 * Fluent expectation classes.
 *
 * <p>{@link fr.lapetina.expect.api.AbstractExpect} carries what every subject supports
 * (equality, identity, type narrowing, custom features, grouping). Subject-specific classes
 * live in the sub-packages {@code time} and {@code path};
 * {@link fr.lapetina.expect.api.ThrownExpect} covers code expected to throw.
 *
 * <h2>Custom Expectations</h2>
 * <p>{@link fr.lapetina.expect.api.AbstractExpect#logic()} exposes the
 * {@link fr.lapetina.expect.domain.creating.AssertionContainer} to build on:
 * <pre>{@code
 * static ObjectExpect<String> toBeBlank(ObjectExpect<String> expect) {
 *     expect.logic().createAndAppend("to be", new Text("blank"), s -> s != null && s.isBlank());
 *     return expect;
 * }
 * }</pre>
 */
package fr.lapetina.expect.api;
