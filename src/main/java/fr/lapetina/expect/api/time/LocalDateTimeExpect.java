package fr.lapetina.expect.api.time;

import fr.lapetina.expect.domain.creating.AssertionContainer;

import java.time.LocalDateTime;
import java.time.chrono.ChronoLocalDateTime;

/**
 * Expectation about a {@link LocalDateTime}.
 */
public final class LocalDateTimeExpect extends AbstractTemporalExpect<LocalDateTimeExpect, LocalDateTime> {

    public LocalDateTimeExpect(AssertionContainer<LocalDateTime> container) {
        super(container, ChronoLocalDateTime.timeLineOrder());
    }

    @Override
    protected LocalDateTimeExpect newInstance(AssertionContainer<LocalDateTime> container) {
        return new LocalDateTimeExpect(container);
    }
}
