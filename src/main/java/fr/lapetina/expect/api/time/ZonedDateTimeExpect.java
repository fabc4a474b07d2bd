package fr.lapetina.expect.api.time;

import fr.lapetina.expect.domain.creating.AssertionContainer;

import java.time.ZonedDateTime;
import java.time.chrono.ChronoZonedDateTime;

/**
 * Expectation about a {@link ZonedDateTime}.
 *
 * <p>Features are read in the zone of the subject. Comparisons are made on the instant, so
 * {@code 12:00+01:00} is the same point in time as {@code 11:00Z}.
 */
public final class ZonedDateTimeExpect extends AbstractTemporalExpect<ZonedDateTimeExpect, ZonedDateTime> {

    public ZonedDateTimeExpect(AssertionContainer<ZonedDateTime> container) {
        super(container, ChronoZonedDateTime.timeLineOrder());
    }

    @Override
    protected ZonedDateTimeExpect newInstance(AssertionContainer<ZonedDateTime> container) {
        return new ZonedDateTimeExpect(container);
    }
}
