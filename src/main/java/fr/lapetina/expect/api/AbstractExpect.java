package fr.lapetina.expect.api;

import fr.lapetina.expect.domain.assertion.Assertion;
import fr.lapetina.expect.domain.assertion.AssertionGroup;
import fr.lapetina.expect.domain.creating.AssertionContainer;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThatObject;

/**
 * Base of all expectations.
 *
 * <p>Every method returning {@code SELF} appends an assertion about the current subject and
 * returns this expectation, so calls chain into a sentence:
 * <pre>{@code
 * expect(answer).notToEqual(41).toEqual(42);
 * }</pre>
 * Methods returning another expectation switch to a feature of the subject.
 *
 * @param <SELF> the concrete expectation type
 * @param <T> type of the subject
 */
public abstract class AbstractExpect<SELF extends AbstractExpect<SELF, T>, T> {

    protected final AssertionContainer<T> container;

    protected AbstractExpect(AssertionContainer<T> container) {
        this.container = Objects.requireNonNull(container, "Container is required");
    }

    /**
     * Creates an expectation of the same type for another container.
     */
    protected abstract SELF newInstance(AssertionContainer<T> container);

    @SuppressWarnings("unchecked")
    protected final SELF self() {
        return (SELF) this;
    }

    /**
     * Returns the logic behind this expectation, for writing custom expectations.
     */
    public AssertionContainer<T> logic() {
        return container;
    }

    /**
     * Expects that the subject equals {@code expected}, as AssertJ's {@code isEqualTo}.
     */
    public SELF toEqual(T expected) {
        return verify("to equal", expected, subject -> assertThatObject(subject).isEqualTo(expected));
    }

    /**
     * Expects that the subject does not equal {@code expected}.
     */
    public SELF notToEqual(T expected) {
        return verify("not to equal", expected, subject -> assertThatObject(subject).isNotEqualTo(expected));
    }

    /**
     * Expects that the subject is the same instance as {@code expected}.
     */
    public SELF toBeTheInstance(T expected) {
        return verify("to be the instance", expected, subject -> assertThatObject(subject).isSameAs(expected));
    }

    public SELF notToBeTheInstance(T expected) {
        return verify("not to be the instance", expected, subject -> assertThatObject(subject).isNotSameAs(expected));
    }

    /**
     * Expects that the subject is an instance of {@code type} and returns an expectation for the
     * narrowed subject. Assertions made on it fail if the subject was not an instance.
     */
    public <S> ObjectExpect<S> toBeAnInstanceOf(Class<S> type) {
        Objects.requireNonNull(type, "Type is required");
        verify("to be an instance of type", type, subject -> assertThatObject(subject).isInstanceOf(type));
        return new ObjectExpect<>(container.narrow(type));
    }

    /**
     * Creates an expectation for the value the extractor returns, reported under {@code name}.
     */
    public <R> ObjectExpect<R> feature(String name, Function<? super T, ? extends R> extractor) {
        return new ObjectExpect<>(container.extractFeature(name, extractor));
    }

    /**
     * Expects that the value the extractor returns holds all assertions the creator defines,
     * and returns this expectation.
     */
    public <R> SELF feature(
            String name,
            Function<? super T, ? extends R> extractor,
            Consumer<? super ObjectExpect<R>> assertionCreator
    ) {
        container.<R, ObjectExpect<R>>collectAndAppendFeature(name, extractor, ObjectExpect::new, assertionCreator);
        return self();
    }

    /**
     * Expects that the subject holds all assertions the creator defines. All failing ones are
     * reported together.
     */
    public SELF and(Consumer<? super SELF> assertionCreator) {
        container.append(AssertionGroup.summary(container.collect(this::newInstance, assertionCreator)));
        return self();
    }

    /**
     * Appends an assertion evaluated by an AssertJ verification of the subject.
     */
    protected SELF verify(String description, Object expected, Consumer<? super T> verification) {
        container.verifyAndAppend(description, expected, verification);
        return self();
    }

    protected SELF append(String description, Object expected, Predicate<? super T> test) {
        container.createAndAppend(description, expected, test);
        return self();
    }

    protected SELF append(Assertion assertion) {
        container.append(assertion);
        return self();
    }

    protected <R extends Comparable<? super R>> ComparableExpect<R> comparableFeature(
            String name,
            Function<? super T, ? extends R> extractor
    ) {
        return new ComparableExpect<>(container.extractFeature(name, extractor));
    }

    protected <R extends Comparable<? super R>> SELF comparableFeature(
            String name,
            Function<? super T, ? extends R> extractor,
            Consumer<? super ComparableExpect<R>> assertionCreator
    ) {
        container.<R, ComparableExpect<R>>collectAndAppendFeature(name, extractor, ComparableExpect::new, assertionCreator);
        return self();
    }
}
