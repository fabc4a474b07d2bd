package fr.lapetina.expect;

import fr.lapetina.expect.api.Act;
import fr.lapetina.expect.api.ObjectExpect;
import fr.lapetina.expect.api.ThrownExpect;
import fr.lapetina.expect.api.path.PathExpect;
import fr.lapetina.expect.api.time.LocalDateExpect;
import fr.lapetina.expect.api.time.LocalDateTimeExpect;
import fr.lapetina.expect.api.time.ZonedDateTimeExpect;
import fr.lapetina.expect.domain.creating.AssertionContainer;
import fr.lapetina.expect.domain.creating.ReportingSink;
import fr.lapetina.expect.domain.creating.Subject;
import fr.lapetina.expect.infrastructure.reporting.AssertionVerb;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.function.Consumer;

/**
 * Entry points of the expectation API; meant to be imported statically.
 *
 * <p>{@code expect(subject)} reports each assertion as soon as it is made, so the first failing
 * one throws an {@link fr.lapetina.expect.infrastructure.reporting.ExpectationError}.
 * {@code expect(subject, assertionCreator)} collects everything the creator defines and reports
 * all failing assertions in one error.
 */
public final class Expectations {

    private Expectations() {
        // Utility class
    }

    public static <T> ObjectExpect<T> expect(T subject) {
        return new ObjectExpect<>(root(subject, AssertionVerb.EXPECT));
    }

    /**
     * Generic counterpart of the {@code expect(subject, assertionCreator)} overloads.
     */
    public static <T> ObjectExpect<T> expectObject(T subject, Consumer<? super ObjectExpect<T>> assertionCreator) {
        return expect(subject).and(assertionCreator);
    }

    public static LocalDateTimeExpect expect(LocalDateTime subject) {
        return new LocalDateTimeExpect(root(subject, AssertionVerb.EXPECT));
    }

    public static LocalDateTimeExpect expect(LocalDateTime subject, Consumer<? super LocalDateTimeExpect> assertionCreator) {
        return expect(subject).and(assertionCreator);
    }

    public static ZonedDateTimeExpect expect(ZonedDateTime subject) {
        return new ZonedDateTimeExpect(root(subject, AssertionVerb.EXPECT));
    }

    public static ZonedDateTimeExpect expect(ZonedDateTime subject, Consumer<? super ZonedDateTimeExpect> assertionCreator) {
        return expect(subject).and(assertionCreator);
    }

    public static LocalDateExpect expect(LocalDate subject) {
        return new LocalDateExpect(root(subject, AssertionVerb.EXPECT));
    }

    public static LocalDateExpect expect(LocalDate subject, Consumer<? super LocalDateExpect> assertionCreator) {
        return expect(subject).and(assertionCreator);
    }

    public static PathExpect expect(Path subject) {
        return new PathExpect(root(subject, AssertionVerb.EXPECT));
    }

    public static PathExpect expect(Path subject, Consumer<? super PathExpect> assertionCreator) {
        return expect(subject).and(assertionCreator);
    }

    /**
     * Runs {@code act} and returns an expectation about what it threw.
     */
    public static ThrownExpect expectThrown(Act act) {
        Subject<Throwable> thrown;
        try {
            act.run();
            thrown = Subject.absent(ThrownExpect.NOTHING_THROWN);
        } catch (Throwable t) {
            thrown = Subject.of(t);
        }
        return new ThrownExpect(rootOf(thrown, AssertionVerb.EXPECT_THROWN));
    }

    private static <T> AssertionContainer<T> root(T subject, AssertionVerb verb) {
        return rootOf(Subject.of(subject), verb);
    }

    private static <T> AssertionContainer<T> rootOf(Subject<T> subject, AssertionVerb verb) {
        ReportingSink sink = new ReportingSink(verb, subject, ExpectationSettings.current().getReporter());
        return new AssertionContainer<>(subject, sink);
    }
}
