/**
 * Evaluated assertions as handed to the reporter.
 *
 * <p>{@link fr.lapetina.expect.domain.assertion.DescriptiveAssertion} is the leaf,
 * {@link fr.lapetina.expect.domain.assertion.AssertionGroup} nests feature and summary groups.
 */
package fr.lapetina.expect.domain.assertion;
