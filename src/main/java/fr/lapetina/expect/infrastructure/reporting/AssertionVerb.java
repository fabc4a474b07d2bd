package fr.lapetina.expect.infrastructure.reporting;

/**
 * The verbs an expectation can start with; the reporter picks the text for each from configuration.
 */
public enum AssertionVerb {
    /** {@code expect(subject)} */
    EXPECT,

    /** {@code expectThrown(act)} */
    EXPECT_THROWN
}
