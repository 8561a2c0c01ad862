package com.demoBank.swapPremium.normalization.util;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Buckets committed terms (tie-in periods) into the two benchmark terms, 24 and 60 months.
 *
 * Numeric input is months. Text input is read with a leading-digit rule: the first digit run
 * is years when the text names years ("2 years", "5yr fixed"), months otherwise ("24 months").
 */
public class TermNormalizer {

    public static final int TWO_YEAR_TERM = 24;
    public static final int FIVE_YEAR_TERM = 60;

    private static final Pattern PLAIN_NUMBER = Pattern.compile("^\\d+(\\.\\d+)?$");
    private static final Pattern FIRST_DIGITS = Pattern.compile("(\\d+)");

    private TermNormalizer() {}

    /**
     * @param months term in months, may be null
     * @return 24, 60 or null when the term is non-standard
     */
    public static Integer normalizeTerm(Integer months) {
        if (months == null) {
            return null;
        }
        if (months >= 24 && months <= 27) {
            return TWO_YEAR_TERM;
        }
        if (months >= 60 && months <= 63) {
            return FIVE_YEAR_TERM;
        }
        return null;
    }

    /**
     * @param period raw tie-in period, e.g. "24", "25", "2 years", "5yr"
     * @return 24, 60 or null when the term is missing, unparseable or non-standard
     */
    public static Integer normalizeTerm(String period) {
        return normalizeTerm(toMonths(period));
    }

    /**
     * Converts a raw tie-in period to months without bucketing.
     */
    public static Integer toMonths(String period) {
        if (period == null || period.isBlank()) {
            return null;
        }
        String text = period.trim().toLowerCase(Locale.ROOT);

        if (PLAIN_NUMBER.matcher(text).matches()) {
            double months = Double.parseDouble(text);
            return months > Integer.MAX_VALUE ? null : (int) months;
        }

        Matcher matcher = FIRST_DIGITS.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String digits = matcher.group(1);
        if (digits.length() > 4) {
            return null;
        }
        int value = Integer.parseInt(digits);
        boolean years = text.contains("year") || text.contains("yr");
        return years ? value * 12 : value;
    }
}
