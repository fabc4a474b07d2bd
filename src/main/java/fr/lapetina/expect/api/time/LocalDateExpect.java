package fr.lapetina.expect.api.time;

import fr.lapetina.expect.domain.creating.AssertionContainer;

import java.time.LocalDate;
import java.time.chrono.ChronoLocalDate;

/**
 * Expectation about a {@link LocalDate}.
 */
public final class LocalDateExpect extends AbstractTemporalExpect<LocalDateExpect, LocalDate> {

    public LocalDateExpect(AssertionContainer<LocalDate> container) {
        super(container, ChronoLocalDate.timeLineOrder());
    }

    @Override
    protected LocalDateExpect newInstance(AssertionContainer<LocalDate> container) {
        return new LocalDateExpect(container);
    }
}
