package fr.lapetina.expect.domain.creating;

import java.util.Objects;
import java.util.function.Function;

/**
 * The value an expectation is about.
 *
 * A subject is either defined (its value may still be {@code null}) or absent, for instance
 * because extracting a feature threw or narrowing to a type failed. Every assertion made on an
 * absent subject fails, and features of an absent subject are absent as well.
 */
public final class Subject<T> {

    private final T value;
    private final String absenceReason;

    private Subject(T value, String absenceReason) {
        this.value = value;
        this.absenceReason = absenceReason;
    }

    public static <T> Subject<T> of(T value) {
        return new Subject<>(value, null);
    }

    public static <T> Subject<T> absent(String reason) {
        return new Subject<>(null, Objects.requireNonNull(reason, "Absence reason is required"));
    }

    public boolean isDefined() {
        return absenceReason == null;
    }

    /**
     * Returns the value.
     *
     * @throws IllegalStateException if the subject is absent
     */
    public T get() {
        if (!isDefined()) {
            throw new IllegalStateException("Subject is not available: " + absenceReason);
        }
        return value;
    }

    public String getAbsenceReason() {
        return absenceReason;
    }

    /**
     * Returns what the reporter shows for this subject.
     */
    public Object representation() {
        return isDefined() ? value : new NotAvailable(absenceReason);
    }

    /**
     * Extracts a feature of this subject. An exception thrown by the extractor turns the feature absent.
     */
    public <R> Subject<R> map(String featureName, Function<? super T, ? extends R> extractor) {
        if (!isDefined()) {
            return absent("is not available because the subject is not available");
        }
        try {
            return of(extractor.apply(value));
        } catch (RuntimeException e) {
            return absent("could not extract " + featureName + ": " + e.getClass().getSimpleName()
                    + (e.getMessage() != null ? ": " + e.getMessage() : ""));
        }
    }

    /**
     * Narrows this subject to the given type; a value which is not an instance turns the result absent.
     */
    public <S> Subject<S> narrow(Class<S> type) {
        if (!isDefined()) {
            return absent(absenceReason);
        }
        if (!type.isInstance(value)) {
            return absent("is not an instance of " + type.getName());
        }
        return of(type.cast(value));
    }

    @Override
    public String toString() {
        return isDefined() ? "Subject[" + value + "]" : "Subject[absent: " + absenceReason + "]";
    }

    /**
     * Representation of an absent subject.
     */
    public record NotAvailable(String reason) {
    }
}
