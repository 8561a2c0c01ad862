package com.demoBank.swapPremium.normalization.util;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Lenient parsing of spreadsheet cell text into numbers and dates.
 */
@Slf4j
public class SourceValueParser {

    private static final List<Function<String, LocalDate>> DATE_PARSERS = List.of(
            LocalDate::parse,
            value -> OffsetDateTime.parse(value).toLocalDate(),
            value -> LocalDateTime.parse(value).toLocalDate(),
            value -> LocalDate.parse(value, DateTimeFormatter.ofPattern("d/M/yyyy")));

    private SourceValueParser() {}

    /**
     * Parses a number, ignoring currency symbols, thousands separators and a percent sign.
     *
     * @return the value, or empty when the text is blank, unparseable, NaN or infinite
     */
    public static Optional<Double> parseNumber(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String cleaned = text.trim()
                .replace("%", "")
                .replace("£", "")
                .replace(",", "")
                .trim();
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        try {
            double value = Double.parseDouble(cleaned);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return Optional.empty();
            }
            return Optional.of(value);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Parses ISO dates, ISO date-times (with or without offset) and dd/MM/yyyy.
     */
    public static Optional<LocalDate> parseDate(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String value = text.trim();
        for (Function<String, LocalDate> parser : DATE_PARSERS) {
            try {
                return Optional.of(parser.apply(value));
            } catch (DateTimeParseException e) {
                log.trace("Date value '{}' rejected by parser: {}", value, e.getMessage());
            }
        }
        return Optional.empty();
    }

    /**
     * Reads spreadsheet-style boolean flags ("yes", "true", "1", "y").
     */
    public static boolean isAffirmative(String text) {
        if (text == null) {
            return false;
        }
        String value = text.trim().toLowerCase(Locale.ROOT);
        return value.equals("yes") || value.equals("true") || value.equals("y") || value.equals("1");
    }

    public static String trimToEmpty(String text) {
        return text == null ? "" : text.trim();
    }

    public static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
