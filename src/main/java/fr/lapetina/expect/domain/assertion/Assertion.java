package fr.lapetina.expect.domain.assertion;

/**
 * A single check against a subject, already evaluated.
 *
 * Implementations are immutable; the outcome is fixed when the assertion is created.
 */
public interface Assertion {

    /**
     * Returns whether the assertion holds.
     */
    boolean holds();
}
