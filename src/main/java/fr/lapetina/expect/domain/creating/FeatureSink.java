package fr.lapetina.expect.domain.creating;

import fr.lapetina.expect.domain.assertion.Assertion;
import fr.lapetina.expect.domain.assertion.AssertionGroup;

import java.util.List;

/**
 * Wraps each assertion about a feature into a feature group and forwards it to the parent sink.
 */
final class FeatureSink implements AssertionSink {

    private final AssertionSink parent;
    private final String name;
    private final Subject<?> feature;

    FeatureSink(AssertionSink parent, String name, Subject<?> feature) {
        this.parent = parent;
        this.name = name;
        this.feature = feature;
    }

    @Override
    public void append(Assertion assertion) {
        parent.append(AssertionGroup.feature(name, feature.representation(), List.of(assertion)));
    }
}
