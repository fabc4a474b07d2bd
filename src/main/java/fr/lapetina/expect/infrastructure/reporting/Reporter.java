package fr.lapetina.expect.infrastructure.reporting;

import fr.lapetina.expect.domain.assertion.Assertion;

/**
 * Reports an evaluated assertion.
 *
 * Implementations must throw an {@link ExpectationError} if the assertion does not hold and
 * must return normally otherwise. They are shared between threads and must be thread-safe.
 */
public interface Reporter {

    /**
     * Returns the name of this reporter for configuration.
     */
    String getName();

    /**
     * Reports the given assertion made about a subject.
     *
     * @param verb the verb the expectation was started with
     * @param subjectRepresentation the subject as it should be shown
     * @param assertion the evaluated assertion
     * @throws ExpectationError if the assertion does not hold
     */
    void report(AssertionVerb verb, Object subjectRepresentation, Assertion assertion);
}
