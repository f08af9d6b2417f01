package com.example.offshore.allocation.service;

import com.example.offshore.allocation.model.OperationalRecord;
import com.example.offshore.allocation.model.VoyageEventDocument;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Event date and unscaled hours of a voyage event. Manifest lines carry neither.
 * <p>
 * Timestamps without a zone are read as UTC. A blank {@code from} means "now"; a timestamp that is present
 * but unreadable leaves {@code error} set and the other fields empty.
 */
record EventHours(Instant eventDate, Double baseHours, String error) {

    static final EventHours NONE = new EventHours(null, null, null);

    private static final List<DateTimeFormatter> LOCAL_DATE_TIMES = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("M/d/yyyy H:mm"),
            DateTimeFormatter.ofPattern("M/d/yyyy H:mm:ss"));

    static EventHours derive(OperationalRecord record, Instant now) {
        if (!(record instanceof VoyageEventDocument event)) {
            return NONE;
        }
        if (isUnreadable(event.getFrom())) {
            return invalid("from", event.getFrom());
        }
        if (isUnreadable(event.getTo())) {
            return invalid("to", event.getTo());
        }
        Instant from = parseTimestamp(event.getFrom());
        Instant to = parseTimestamp(event.getTo());

        double hours = event.getHours() == null ? 0 : event.getHours();
        if (hours == 0 && from != null && to != null) {
            hours = Duration.between(from, to).toMillis() / 3_600_000.0;
        }
        return new EventHours(from != null ? from : now, round(hours), null);
    }

    boolean isValid() {
        return error == null;
    }

    /**
     * Hours attributed to one LC share, rounded to two decimals.
     */
    Double scaled(double percentage) {
        if (baseHours == null) {
            return null;
        }
        return round(baseHours * percentage / 100.0);
    }

    static double round(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * @return the instant, or {@code null} when the value is blank or unreadable
     */
    static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        Instant instant = parseInstant(text);
        if (instant != null) {
            return instant;
        }
        for (DateTimeFormatter formatter : LOCAL_DATE_TIMES) {
            LocalDateTime dateTime = parseLocal(text, formatter);
            if (dateTime != null) {
                return dateTime.toInstant(ZoneOffset.UTC);
            }
        }
        LocalDate date = parseDate(text);
        return date == null ? null : date.atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    private static boolean isUnreadable(String value) {
        return value != null && !value.isBlank() && parseTimestamp(value) == null;
    }

    private static EventHours invalid(String field, String value) {
        return new EventHours(null, null, "Unparseable %s timestamp '%s'".formatted(field, value));
    }

    private static Instant parseInstant(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private static LocalDateTime parseLocal(String text, DateTimeFormatter formatter) {
        try {
            return LocalDateTime.parse(text, formatter);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private static LocalDate parseDate(String text) {
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }
}
