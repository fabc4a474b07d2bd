package fr.lapetina.expect.domain.creating;

import fr.lapetina.expect.domain.assertion.Assertion;

/**
 * Receives the assertions an expectation creates.
 */
@FunctionalInterface
public interface AssertionSink {

    void append(Assertion assertion);
}
