package fr.lapetina.expect.api;

import fr.lapetina.expect.domain.creating.AssertionContainer;

import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Expectation about a {@link Comparable} subject, compared by its natural order.
 * A {@code null} subject fails every comparison.
 */
public final class ComparableExpect<T extends Comparable<? super T>> extends AbstractExpect<ComparableExpect<T>, T> {

    public ComparableExpect(AssertionContainer<T> container) {
        super(container);
    }

    @Override
    protected ComparableExpect<T> newInstance(AssertionContainer<T> container) {
        return new ComparableExpect<>(container);
    }

    public ComparableExpect<T> toBeLessThan(T expected) {
        Objects.requireNonNull(expected, "Expected value is required");
        return verify("to be less than", expected, subject -> assertThat(subject).isLessThan(expected));
    }

    public ComparableExpect<T> toBeLessThanOrEqualTo(T expected) {
        Objects.requireNonNull(expected, "Expected value is required");
        return verify("to be less than or equal to", expected, subject -> assertThat(subject).isLessThanOrEqualTo(expected));
    }

    public ComparableExpect<T> toBeGreaterThan(T expected) {
        Objects.requireNonNull(expected, "Expected value is required");
        return verify("to be greater than", expected, subject -> assertThat(subject).isGreaterThan(expected));
    }

    public ComparableExpect<T> toBeGreaterThanOrEqualTo(T expected) {
        Objects.requireNonNull(expected, "Expected value is required");
        return verify("to be greater than or equal to", expected, subject -> assertThat(subject).isGreaterThanOrEqualTo(expected));
    }
}
