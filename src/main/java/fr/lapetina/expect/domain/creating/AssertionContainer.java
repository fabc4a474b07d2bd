package fr.lapetina.expect.domain.creating;

import fr.lapetina.expect.domain.assertion.Assertion;
import fr.lapetina.expect.domain.assertion.AssertionGroup;
import fr.lapetina.expect.domain.assertion.DescriptiveAssertion;
import fr.lapetina.expect.infrastructure.verification.Verifier;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Logic behind an expectation: knows the subject and where created assertions go.
 *
 * The fluent expectation classes only name things; creating assertions, extracting features
 * and collecting the output of assertion creators happens here.
 *
 * @param <T> type of the subject
 */
public final class AssertionContainer<T> {

    private final Subject<T> subject;
    private final AssertionSink sink;

    public AssertionContainer(Subject<T> subject, AssertionSink sink) {
        this.subject = Objects.requireNonNull(subject, "Subject is required");
        this.sink = Objects.requireNonNull(sink, "Sink is required");
    }

    public Subject<T> getSubject() {
        return subject;
    }

    public void append(Assertion assertion) {
        sink.append(Objects.requireNonNull(assertion, "Assertion is required"));
    }

    /**
     * Creates an assertion from a predicate on the subject; it fails if the subject is absent.
     * A {@code null} subject is passed to the predicate.
     */
    public DescriptiveAssertion createDescriptive(String description, Object expected, Predicate<? super T> test) {
        boolean holds = subject.isDefined() && test.test(subject.get());
        return DescriptiveAssertion.of(description, expected, holds);
    }

    public void createAndAppend(String description, Object expected, Predicate<? super T> test) {
        append(createDescriptive(description, expected, test));
    }

    /**
     * Creates an assertion which holds if the AssertJ verification passes for the subject;
     * it fails if the subject is absent.
     */
    public DescriptiveAssertion createVerified(String description, Object expected, Consumer<? super T> verification) {
        boolean holds = subject.isDefined() && Verifier.passes(() -> verification.accept(subject.get()));
        return DescriptiveAssertion.of(description, expected, holds);
    }

    public void verifyAndAppend(String description, Object expected, Consumer<? super T> verification) {
        append(createVerified(description, expected, verification));
    }

    /**
     * Appends the assertion the factory creates for the subject. The factory is not called
     * if the subject is absent or {@code null}; a failing assertion is appended instead.
     */
    public void appendFor(String description, Object expected, Function<? super T, ? extends Assertion> factory) {
        if (subject.isDefined() && subject.get() != null) {
            append(factory.apply(subject.get()));
        } else {
            String reason = subject.isDefined() ? "the subject was null" : "the subject is not available";
            append(DescriptiveAssertion.of(description, expected, false, List.of(reason)));
        }
    }

    /**
     * Returns a container for the extracted feature whose assertions are reported under the feature name.
     */
    public <R> AssertionContainer<R> extractFeature(String name, Function<? super T, ? extends R> extractor) {
        Subject<R> feature = subject.map(name, extractor);
        return new AssertionContainer<>(feature, new FeatureSink(sink, name, feature));
    }

    /**
     * Runs the creator against the extracted feature and appends all assertions it created as one feature group.
     */
    public <R, E> void collectAndAppendFeature(
            String name,
            Function<? super T, ? extends R> extractor,
            Function<AssertionContainer<R>, E> expectFactory,
            Consumer<? super E> assertionCreator
    ) {
        Subject<R> feature = subject.map(name, extractor);
        List<Assertion> collected = collect(feature, expectFactory, assertionCreator);
        append(AssertionGroup.feature(name, feature.representation(), collected));
    }

    /**
     * Runs the creator against the current subject and returns what it created.
     * A creator which creates nothing yields a single failing hint.
     */
    public <E> List<Assertion> collect(Function<AssertionContainer<T>, E> expectFactory, Consumer<? super E> assertionCreator) {
        return collect(subject, expectFactory, assertionCreator);
    }

    /**
     * Returns a container for the subject narrowed to the given type, reporting to the same sink.
     */
    public <S> AssertionContainer<S> narrow(Class<S> type) {
        return new AssertionContainer<>(subject.narrow(type), sink);
    }

    private static <R, E> List<Assertion> collect(
            Subject<R> subject,
            Function<AssertionContainer<R>, E> expectFactory,
            Consumer<? super E> assertionCreator
    ) {
        Objects.requireNonNull(assertionCreator, "Assertion creator is required");
        CollectingSink collector = new CollectingSink();
        assertionCreator.accept(expectFactory.apply(new AssertionContainer<>(subject, collector)));
        return collector.getAssertions();
    }
}
