package fr.lapetina.expect.api;

import fr.lapetina.expect.domain.assertion.DescriptiveAssertion;
import fr.lapetina.expect.domain.assertion.Text;
import fr.lapetina.expect.domain.creating.AssertionContainer;
import fr.lapetina.expect.domain.creating.Subject;
import fr.lapetina.expect.infrastructure.verification.Verifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Expectation about what an {@link Act} threw. The act has already run when this is created;
 * the subject is absent if it returned normally.
 */
public final class ThrownExpect {

    public static final String NOTHING_THROWN = "nothing was thrown";

    private final AssertionContainer<Throwable> container;

    public ThrownExpect(AssertionContainer<Throwable> container) {
        this.container = Objects.requireNonNull(container, "Container is required");
    }

    /**
     * Expects that the act threw an instance of {@code type} and returns an expectation for it.
     */
    public <E extends Throwable> ThrowableExpect<E> toThrow(Class<E> type) {
        Objects.requireNonNull(type, "Type is required");
        Subject<Throwable> subject = container.getSubject();
        boolean holds = subject.isDefined() && Verifier.passes(() -> assertThat(subject.get()).isInstanceOf(type));
        List<String> explanations = subject.isDefined()
                ? describe(subject.get())
                : List.of(NOTHING_THROWN);
        container.append(DescriptiveAssertion.of("to throw", type, holds, explanations));
        return new ThrowableExpect<>(container.narrow(type));
    }

    /**
     * Expects that the act returned normally.
     */
    public void notToThrow() {
        Subject<Throwable> subject = container.getSubject();
        boolean holds = !subject.isDefined();
        List<String> explanations = holds ? List.of() : describe(subject.get());
        container.append(DescriptiveAssertion.of("not to", new Text("throw"), holds, explanations));
    }

    private static List<String> describe(Throwable thrown) {
        List<String> explanations = new ArrayList<>();
        explanations.add("thrown: " + thrown.getClass().getName());
        if (thrown.getMessage() != null) {
            explanations.add("message: \"" + thrown.getMessage() + "\"");
        }
        StackTraceElement[] stackTrace = thrown.getStackTrace();
        if (stackTrace.length > 0) {
            explanations.add("at " + stackTrace[0]);
        }
        return explanations;
    }
}
