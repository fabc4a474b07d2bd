/**
 * Bridge to AssertJ, which evaluates the checks behind the expectations.
 *
 * <h2>Contract</h2>
 * <p>A {@link fr.lapetina.expect.infrastructure.verification.Verifier.Verification} is a
 * lambda calling AssertJ. The {@link fr.lapetina.expect.infrastructure.verification.Verifier}
 * runs it and produces a {@link fr.lapetina.expect.domain.assertion.DescriptiveAssertion}; the
 * expectation classes only name the check and decide how it is grouped and reported.
 */
package fr.lapetina.expect.infrastructure.verification;
