package com.creditmemo.memo;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Coerces raw memo fields into typed values. Anything that does not parse is
 * reported as missing; nothing here throws for bad data.
 */
public final class MemoFieldParser {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        strict("M/d/uuuu"),
        strict("d-MMM-uuuu"),
        strict("d MMM uuuu"),
        strict("MMM d, uuuu"),
        strict("uuuu/MM/dd"),
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        DateTimeFormatter.ISO_OFFSET_DATE_TIME,
        strict("uuuu-MM-dd HH:mm:ss")
    );

    private MemoFieldParser() {
    }

    /**
     * Parses an amount, ignoring thousands separators.
     */
    public static Optional<BigDecimal> parseAmount(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String text = raw.replace(",", "").trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Parses a calendar date. Date-times, with or without an offset, keep the date as
     * written. Impossible dates such as 2/30/2024 are missing rather than rolled over.
     */
    public static Optional<LocalDate> parseDate(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return Optional.empty();
        }
        String text = raw.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            Optional<LocalDate> parsed = tryParse(text, format);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> tryParse(String text, DateTimeFormatter format) {
        try {
            return Optional.of(format.parse(text, LocalDate::from));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.US).withResolverStyle(ResolverStyle.STRICT);
    }
}
