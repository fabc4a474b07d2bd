package fr.lapetina.expect.domain.assertion;

/**
 * Kind of {@link AssertionGroup}, which decides how the group is rendered.
 */
public enum GroupType {
    /** Assertions about a value extracted from the subject, rendered under {@code ▶ name: value} */
    FEATURE,

    /** Assertions about the current subject, rendered at the level of the group itself */
    SUMMARY
}
