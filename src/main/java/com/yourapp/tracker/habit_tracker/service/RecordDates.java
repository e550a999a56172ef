package com.yourapp.tracker.habit_tracker.service;

import com.yourapp.tracker.habit_tracker.exception.InvalidInputException;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;

/**
 * Parsing of record dates typed by the user. Only {@code YYYY-MM-DD} is accepted.
 */
public final class RecordDates {
    public static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    private RecordDates() {
    }

    public static Optional<LocalDate> tryParse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(raw.trim(), FORMAT));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static LocalDate parse(String raw) {
        return tryParse(raw)
                .orElseThrow(() -> new InvalidInputException("Invalid date format: " + raw));
    }

    public static String format(LocalDate date) {
        return FORMAT.format(date);
    }
}
