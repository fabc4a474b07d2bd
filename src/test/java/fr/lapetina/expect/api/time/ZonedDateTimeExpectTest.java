package fr.lapetina.expect.api.time;

import fr.lapetina.expect.infrastructure.reporting.ExpectationError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static fr.lapetina.expect.Expectations.expect;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ZonedDateTimeExpectTest {

    private static final ZoneId PARIS = ZoneId.of("Europe/Paris");

    @Test
    @DisplayName("should read features in the zone of the subject")
    void shouldReadFeaturesInSubjectZone() {
        // 2023-12-31T23:30Z
        ZonedDateTime newYearInParis = ZonedDateTime.of(2024, 1, 1, 0, 30, 0, 0, PARIS);

        assertThatCode(() -> expect(newYearInParis, date -> {
            date.year().toEqual(2024);
            date.month().toEqual(1);
            date.day().toEqual(1);
            date.dayOfWeek().toEqual(DayOfWeek.MONDAY);
        })).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should report failing feature creators")
    void shouldReportFailingFeatureCreators() {
        ZonedDateTime subject = ZonedDateTime.of(2024, 3, 15, 10, 15, 0, 0, ZoneOffset.UTC);

        assertThatThrownBy(() -> expect(subject)
                .year(year -> year.toEqual(2024))
                .day(day -> day.toEqual(16)))
                .isInstanceOf(ExpectationError.class)
                .hasMessage("expected the subject: 2024-03-15T10:15Z\n"
                        + "◆ ▶ day: 15\n"
                        + "    ◾ to equal: 16");
    }

    @Test
    @DisplayName("should treat the same instant in different zones as the same point in time")
    void shouldCompareInstants() {
        ZonedDateTime noonInParis = ZonedDateTime.of(2024, 3, 15, 12, 0, 0, 0, PARIS);
        ZonedDateTime elevenUtc = ZonedDateTime.of(2024, 3, 15, 11, 0, 0, 0, ZoneOffset.UTC);

        assertThatCode(() -> expect(noonInParis)
                .toBeTheSamePointInTimeAs(elevenUtc)
                .notToEqual(elevenUtc)
                .toBeAfter(elevenUtc.minusNanos(1))
                .toBeBeforeOrTheSamePointInTimeAs(elevenUtc))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> expect(noonInParis).toBeAfter(elevenUtc))
                .isInstanceOf(ExpectationError.class)
                .hasMessageContaining("◆ to be after: 2024-03-15T11:00Z");
    }
}
