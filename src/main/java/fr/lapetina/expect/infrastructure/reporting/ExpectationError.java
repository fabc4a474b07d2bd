package fr.lapetina.expect.infrastructure.reporting;

import fr.lapetina.expect.domain.assertion.Assertion;

/**
 * Thrown when an expectation is not met.
 *
 * Extends {@link AssertionError} so test frameworks report it as a failure rather than an error.
 */
public final class ExpectationError extends AssertionError {

    private final transient Assertion assertion;

    public ExpectationError(String message, Assertion assertion) {
        super(message);
        this.assertion = assertion;
    }

    /**
     * Returns the failing assertion as it was reported.
     */
    public Assertion getAssertion() {
        return assertion;
    }
}
