package fr.lapetina.expect.infrastructure.verification;

import fr.lapetina.expect.domain.assertion.DescriptiveAssertion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Runs verifications written against AssertJ and turns their outcome into assertions.
 *
 * A verification holds if it returns normally and fails if AssertJ throws an {@link AssertionError}.
 * The lines of AssertJ's failure message become the explanations of the failing assertion.
 */
public final class Verifier {

    private static final Logger log = LoggerFactory.getLogger(Verifier.class);

    private Verifier() {
        // Utility class
    }

    /**
     * Returns whether the verification passes, discarding AssertJ's failure message.
     */
    public static boolean passes(Verification verification) {
        Objects.requireNonNull(verification, "Verification is required");
        try {
            verification.run();
            return true;
        } catch (AssertionError e) {
            log.trace("Verification failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Creates an assertion which holds if the verification passes.
     *
     * An exception other than an {@link AssertionError}, e.g. when AssertJ cannot read a file,
     * also makes the assertion fail; its message is the explanation.
     */
    public static DescriptiveAssertion verify(String description, Object expected, Verification verification) {
        Objects.requireNonNull(verification, "Verification is required");
        try {
            verification.run();
            return DescriptiveAssertion.of(description, expected, true);
        } catch (AssertionError e) {
            return DescriptiveAssertion.of(description, expected, false, explain(e));
        } catch (RuntimeException e) {
            log.debug("Could not verify '{}'", description, e);
            return DescriptiveAssertion.of(description, expected, false, List.of("could not verify: " + e.getMessage()));
        }
    }

    /**
     * Creates an assertion which holds if the verification fails, with the given explanations if it passes.
     */
    public static DescriptiveAssertion verifyNot(
            String description,
            Object expected,
            Verification verification,
            List<String> explanations
    ) {
        return DescriptiveAssertion.of(description, expected, !passes(verification), explanations);
    }

    static List<String> explain(AssertionError error) {
        String message = error.getMessage();
        if (message == null) {
            return List.of();
        }
        return message.lines()
                .map(String::stripTrailing)
                .filter(line -> !line.isBlank())
                .collect(Collectors.toList());
    }

    /**
     * A check written with AssertJ, throwing an {@link AssertionError} if it does not hold.
     */
    @FunctionalInterface
    public interface Verification {
        void run();
    }
}
