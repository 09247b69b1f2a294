package com.creditmemo.matrix;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the textual columns of an approval matrix sheet.
 *
 * Amount ranges come in a handful of shapes:
 * - "Up to 10,000"            -> 10000
 * - "10,001 - 50,000"         -> 50000 (hyphen or en dash)
 * - "Above 50,000"            -> open-ended
 * - "25000"                   -> 25000
 * Anything without a usable number is treated as open-ended.
 */
public final class AmountRangeParser {

    private static final String EN_DASH = "–";
    private static final Pattern NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final Pattern DIGITS = Pattern.compile("(\\d+)");
    private static final Pattern NON_NUMERIC = Pattern.compile("[^\\d.]");

    private AmountRangeParser() {
    }

    /**
     * Upper limit of an amount range, or empty for the open-ended tier.
     */
    public static Optional<BigDecimal> parseUpperLimit(String range) {
        if (range == null || range.trim().isEmpty()) {
            return Optional.empty();
        }
        String text = range.trim().replace(",", "");
        String lower = text.toLowerCase(Locale.ROOT);

        if (lower.startsWith("up to")) {
            return numericTail(lower.substring("up to".length()));
        }
        if (text.contains(EN_DASH) || text.contains("-")) {
            String separator = text.contains(EN_DASH) ? EN_DASH : "-";
            return numericTail(text.substring(text.lastIndexOf(separator) + separator.length()));
        }
        if (lower.startsWith("above")) {
            return Optional.empty();
        }

        Matcher matcher = NUMBER.matcher(text);
        String last = null;
        while (matcher.find()) {
            last = matcher.group();
        }
        return last == null ? Optional.empty() : Optional.of(new BigDecimal(last));
    }

    /**
     * First run of digits in a level cell ("Level 2", "L3", "2").
     */
    public static Optional<Integer> parseLevel(String level) {
        if (level == null) {
            return Optional.empty();
        }
        Matcher matcher = DIGITS.matcher(level);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(Integer.parseInt(matcher.group(1)));
    }

    private static Optional<BigDecimal> numericTail(String tail) {
        String digits = NON_NUMERIC.matcher(tail).replaceAll("");
        if (digits.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(digits));
        } catch (NumberFormatException e) {
            // e.g. "1.000.000" after comma stripping
            return Optional.empty();
        }
    }
}
