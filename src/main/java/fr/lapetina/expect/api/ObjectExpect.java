package fr.lapetina.expect.api;

import fr.lapetina.expect.domain.creating.AssertionContainer;

/**
 * Expectation about a subject of any type.
 */
public final class ObjectExpect<T> extends AbstractExpect<ObjectExpect<T>, T> {

    public ObjectExpect(AssertionContainer<T> container) {
        super(container);
    }

    @Override
    protected ObjectExpect<T> newInstance(AssertionContainer<T> container) {
        return new ObjectExpect<>(container);
    }
}
