package fr.lapetina.expect.domain.creating;

import fr.lapetina.expect.domain.assertion.Assertion;
import fr.lapetina.expect.domain.assertion.DescriptiveAssertion;
import fr.lapetina.expect.domain.assertion.Text;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps appended assertions so an assertion creator's output can be reported as one group.
 * Not thread-safe; a creator runs on the caller's thread.
 */
public final class CollectingSink implements AssertionSink {

    static final String NOTHING_DEFINED_DESCRIPTION = "at least one expectation defined";

    private final List<Assertion> assertions = new ArrayList<>();

    @Override
    public void append(Assertion assertion) {
        assertions.add(assertion);
    }

    public boolean isEmpty() {
        return assertions.isEmpty();
    }

    /**
     * Returns the collected assertions, or a single failing hint if the creator defined none.
     */
    public List<Assertion> getAssertions() {
        if (assertions.isEmpty()) {
            return List.of(DescriptiveAssertion.of(NOTHING_DEFINED_DESCRIPTION, new Text("false"), false,
                    List.of("You forgot to define expectations in the assertion creator")));
        }
        return List.copyOf(assertions);
    }
}
