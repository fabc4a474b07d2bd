package fr.lapetina.expect.api.time;

import fr.lapetina.expect.api.AbstractExpect;
import fr.lapetina.expect.api.ComparableExpect;
import fr.lapetina.expect.domain.creating.AssertionContainer;

import java.time.DayOfWeek;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Comparator;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Date and date-time features and time-line comparisons shared by the temporal expectations.
 *
 * <p>Each feature comes in two forms. {@code year()} switches to an expectation about the year,
 * so further calls are about it. {@code year(creator)} runs the creator against the year, appends
 * what it defined as one group and stays on the date:
 * <pre>{@code
 * expect(date).year(year -> year.toBeGreaterThan(2000)).month(month -> month.toEqual(3));
 * }</pre>
 *
 * @param <SELF> the concrete expectation type
 * @param <T> the temporal type
 */
public abstract class AbstractTemporalExpect<SELF extends AbstractTemporalExpect<SELF, T>, T extends TemporalAccessor>
        extends AbstractExpect<SELF, T> {

    private final Comparator<? super T> timeLineOrder;

    protected AbstractTemporalExpect(AssertionContainer<T> container, Comparator<? super T> timeLineOrder) {
        super(container);
        this.timeLineOrder = timeLineOrder;
    }

    /**
     * Creates an expectation for the year of the subject.
     */
    public ComparableExpect<Integer> year() {
        return comparableFeature("year", subject -> subject.get(ChronoField.YEAR));
    }

    /**
     * Expects that the year of the subject holds all assertions the creator defines.
     */
    public SELF year(Consumer<? super ComparableExpect<Integer>> assertionCreator) {
        return comparableFeature("year", subject -> subject.get(ChronoField.YEAR), assertionCreator);
    }

    /**
     * Creates an expectation for the month of the subject, from 1 (January) to 12 (December).
     */
    public ComparableExpect<Integer> month() {
        return comparableFeature("month", subject -> subject.get(ChronoField.MONTH_OF_YEAR));
    }

    public SELF month(Consumer<? super ComparableExpect<Integer>> assertionCreator) {
        return comparableFeature("month", subject -> subject.get(ChronoField.MONTH_OF_YEAR), assertionCreator);
    }

    /**
     * Creates an expectation for the day of the week of the subject.
     */
    public ComparableExpect<DayOfWeek> dayOfWeek() {
        return comparableFeature("day of week", DayOfWeek::from);
    }

    public SELF dayOfWeek(Consumer<? super ComparableExpect<DayOfWeek>> assertionCreator) {
        return comparableFeature("day of week", DayOfWeek::from, assertionCreator);
    }

    /**
     * Creates an expectation for the day of the month of the subject.
     */
    public ComparableExpect<Integer> day() {
        return comparableFeature("day", subject -> subject.get(ChronoField.DAY_OF_MONTH));
    }

    public SELF day(Consumer<? super ComparableExpect<Integer>> assertionCreator) {
        return comparableFeature("day", subject -> subject.get(ChronoField.DAY_OF_MONTH), assertionCreator);
    }

    public SELF toBeBefore(T expected) {
        return compare("to be before", expected, order -> order < 0);
    }

    public SELF toBeBeforeOrTheSamePointInTimeAs(T expected) {
        return compare("to be before or the same point in time as", expected, order -> order <= 0);
    }

    public SELF toBeAfter(T expected) {
        return compare("to be after", expected, order -> order > 0);
    }

    public SELF toBeAfterOrTheSamePointInTimeAs(T expected) {
        return compare("to be after or the same point in time as", expected, order -> order >= 0);
    }

    /**
     * Expects that the subject is the same point on the time-line as {@code expected}, which is
     * weaker than {@link #toEqual(Object)} for types carrying a zone or offset.
     */
    public SELF toBeTheSamePointInTimeAs(T expected) {
        return compare("to be the same point in time as", expected, order -> order == 0);
    }

    private SELF compare(String description, T expected, OrderTest test) {
        Objects.requireNonNull(expected, "Expected value is required");
        return append(description, expected,
                subject -> subject != null && test.accept(timeLineOrder.compare(subject, expected)));
    }

    @FunctionalInterface
    private interface OrderTest {
        boolean accept(int order);
    }
}
