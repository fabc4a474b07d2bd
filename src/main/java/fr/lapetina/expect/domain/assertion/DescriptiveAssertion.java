package fr.lapetina.expect.domain.assertion;

import java.util.List;
import java.util.Objects;

/**
 * Assertion rendered as {@code description: expected}, optionally followed by explanations
 * that tell the reader why it failed.
 */
public record DescriptiveAssertion(
        String description,
        Object expected,
        boolean holds,
        List<String> explanations
) implements Assertion {

    public DescriptiveAssertion {
        Objects.requireNonNull(description, "Description is required");
        explanations = explanations != null ? List.copyOf(explanations) : List.of();
    }

    public static DescriptiveAssertion of(String description, Object expected, boolean holds) {
        return new DescriptiveAssertion(description, expected, holds, List.of());
    }

    /**
     * Creates an assertion which only carries explanations when it fails.
     */
    public static DescriptiveAssertion of(String description, Object expected, boolean holds, List<String> explanations) {
        return new DescriptiveAssertion(description, expected, holds, holds ? List.of() : explanations);
    }
}
