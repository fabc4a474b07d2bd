package fr.lapetina.expect.domain.creating;

import fr.lapetina.expect.domain.assertion.Assertion;
import fr.lapetina.expect.infrastructure.reporting.AssertionVerb;
import fr.lapetina.expect.infrastructure.reporting.Reporter;

import java.util.Objects;

/**
 * Root sink of an expectation: hands every appended assertion to the reporter right away,
 * which throws if it does not hold.
 */
public final class ReportingSink implements AssertionSink {

    private final AssertionVerb verb;
    private final Subject<?> subject;
    private final Reporter reporter;

    public ReportingSink(AssertionVerb verb, Subject<?> subject, Reporter reporter) {
        this.verb = Objects.requireNonNull(verb, "Verb is required");
        this.subject = Objects.requireNonNull(subject, "Subject is required");
        this.reporter = Objects.requireNonNull(reporter, "Reporter is required");
    }

    @Override
    public void append(Assertion assertion) {
        reporter.report(verb, subject.representation(), assertion);
    }
}
