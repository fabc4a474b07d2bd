package fr.lapetina.expect.domain.assertion;

import java.util.List;
import java.util.Objects;

/**
 * Groups assertions which are reported together.
 * A group holds if and only if every assertion in it holds.
 */
public record AssertionGroup(
        GroupType type,
        String name,
        Object representation,
        List<Assertion> assertions
) implements Assertion {

    public AssertionGroup {
        Objects.requireNonNull(type, "Group type is required");
        assertions = List.copyOf(assertions);
    }

    public static AssertionGroup feature(String name, Object representation, List<Assertion> assertions) {
        return new AssertionGroup(GroupType.FEATURE, Objects.requireNonNull(name, "Feature name is required"),
                representation, assertions);
    }

    public static AssertionGroup summary(List<Assertion> assertions) {
        return new AssertionGroup(GroupType.SUMMARY, null, null, assertions);
    }

    @Override
    public boolean holds() {
        for (Assertion assertion : assertions) {
            if (!assertion.holds()) {
                return false;
            }
        }
        return true;
    }
}
