package fr.lapetina.expect.infrastructure.reporting;

import fr.lapetina.expect.domain.assertion.Assertion;
import fr.lapetina.expect.domain.assertion.AssertionGroup;
import fr.lapetina.expect.domain.assertion.DescriptiveAssertion;
import fr.lapetina.expect.domain.assertion.GroupType;
import fr.lapetina.expect.infrastructure.config.ExpectationConfig;
import fr.lapetina.expect.infrastructure.config.ExpectationConfig.ReporterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders failing assertions as an indented, bulleted text block.
 *
 * <pre>
 * expected the subject: 2024-03-15T10:15
 * ◆ ▶ year: 2024
 *     ◾ to equal: 2023
 * </pre>
 *
 * Only failing assertions are shown. Summary groups are flattened into their parent level.
 */
public final class TextReporter implements Reporter {

    private static final Logger log = LoggerFactory.getLogger(TextReporter.class);

    public static final String NAME = "text";

    private final ReporterConfig config;
    private final ObjectFormatter formatter;

    public TextReporter(ExpectationConfig config) {
        this.config = config.getReporter();
        this.formatter = new ObjectFormatter(config.getFormatter());
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void report(AssertionVerb verb, Object subjectRepresentation, Assertion assertion) {
        if (assertion.holds()) {
            log.trace("Expectation about {} holds", subjectRepresentation);
            return;
        }
        String message = render(verb, subjectRepresentation, assertion);
        log.debug("Expectation failed:\n{}", message);
        throw new ExpectationError(message, assertion);
    }

    /**
     * Renders the report for a failing assertion without throwing.
     */
    public String render(AssertionVerb verb, Object subjectRepresentation, Assertion assertion) {
        StringBuilder sb = new StringBuilder();
        sb.append(verbText(verb)).append(": ").append(formatter.format(subjectRepresentation));
        appendFailing(sb, assertion, 0);
        return sb.toString();
    }

    private String verbText(AssertionVerb verb) {
        return switch (verb) {
            case EXPECT -> config.getVerb();
            case EXPECT_THROWN -> config.getThrownVerb();
        };
    }

    private void appendFailing(StringBuilder sb, Assertion assertion, int level) {
        if (assertion.holds()) {
            return;
        }
        if (assertion instanceof AssertionGroup) {
            AssertionGroup group = (AssertionGroup) assertion;
            int childLevel = level;
            if (group.type() == GroupType.FEATURE) {
                newLine(sb, level)
                        .append(config.getFeatureArrow()).append(' ')
                        .append(group.name()).append(": ")
                        .append(formatter.format(group.representation()));
                childLevel = level + 1;
            }
            for (Assertion child : group.assertions()) {
                appendFailing(sb, child, childLevel);
            }
        } else if (assertion instanceof DescriptiveAssertion) {
            DescriptiveAssertion descriptive = (DescriptiveAssertion) assertion;
            newLine(sb, level)
                    .append(descriptive.description()).append(": ")
                    .append(formatter.format(descriptive.expected()));
            for (String explanation : descriptive.explanations()) {
                sb.append('\n').append(indent(level + 1))
                        .append(config.getExplanationBullet()).append(' ').append(explanation);
            }
        } else {
            newLine(sb, level).append(assertion);
        }
    }

    private StringBuilder newLine(StringBuilder sb, int level) {
        String bullet = level == 0 ? config.getRootBullet() : config.getNestedBullet();
        return sb.append('\n').append(indent(level)).append(bullet).append(' ');
    }

    private String indent(int level) {
        return " ".repeat(Math.max(0, config.getIndent()) * level);
    }
}
