/**
 * Expectations about {@link java.time.LocalDateTime}, {@link java.time.ZonedDateTime} and
 * {@link java.time.LocalDate}.
 */
package fr.lapetina.expect.api.time;
