package io.leadscore.engine.utils;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads the lead date strings delivered by ingestion. Accepts ISO dates ("2024-03-15"),
 * local date-times ("2024-03-15T10:00:00") and instants with an offset ("2024-03-15T10:00:00Z").
 * Instants are moved into the given zone before the calendar day is taken.
 */
public final class LeadDates {

    private LeadDates() {
    }

    public static Optional<LocalDate> dayOf(String leadDate, ZoneId zone) {
        if (leadDate == null || leadDate.isBlank()) return Optional.empty();
        String value = leadDate.trim();
        try {
            if (value.indexOf('T') < 0) {
                return Optional.of(LocalDate.parse(value));
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return Optional.of(zoned.withZoneSameInstant(zone).toLocalDate());
            }
            return Optional.of(((LocalDateTime) parsed).toLocalDate());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * English month name of the lead date, e.g. "January". Empty when the date cannot be read.
     */
    public static Optional<String> monthNameOf(String leadDate, ZoneId zone) {
        return dayOf(leadDate, zone).map(day -> monthName(day.getMonth()));
    }

    public static String monthName(Month month) {
        return month.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }
}
