package fr.lapetina.expect.api;

import fr.lapetina.expect.domain.creating.AssertionContainer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Expectation about a {@link Throwable}.
 */
public final class ThrowableExpect<E extends Throwable> extends AbstractExpect<ThrowableExpect<E>, E> {

    public ThrowableExpect(AssertionContainer<E> container) {
        super(container);
    }

    @Override
    protected ThrowableExpect<E> newInstance(AssertionContainer<E> container) {
        return new ThrowableExpect<>(container);
    }

    /**
     * Creates an expectation for the message of the throwable.
     */
    public ObjectExpect<String> message() {
        return feature("message", Throwable::getMessage);
    }

    /**
     * Expects that the message of the throwable contains all given values.
     */
    public ThrowableExpect<E> messageToContain(String expected, String... otherExpected) {
        List<String> values = new ArrayList<>();
        values.add(Objects.requireNonNull(expected, "Expected value is required"));
        for (String other : otherExpected) {
            values.add(Objects.requireNonNull(other, "Expected value is required"));
        }
        return feature("message", Throwable::getMessage, message -> {
            for (String value : values) {
                message.logic().verifyAndAppend("to contain", value, actual -> assertThat(actual).contains(value));
            }
        });
    }

    /**
     * Expects that the cause of the throwable is an instance of {@code type} and returns an expectation for it.
     */
    public <C extends Throwable> ThrowableExpect<C> cause(Class<C> type) {
        ObjectExpect<C> cause = feature("cause", Throwable::getCause).toBeAnInstanceOf(type);
        return new ThrowableExpect<>(cause.logic());
    }
}
