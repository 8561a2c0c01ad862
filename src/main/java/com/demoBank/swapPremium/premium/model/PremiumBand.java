package com.demoBank.swapPremium.premium.model;

import lombok.Value;

import java.util.Comparator;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Half-open premium interval {@code [lower, upper)} in basis points, labelled "{lower}-{upper}".
 */
@Value
public class PremiumBand {

    public static final String UNKNOWN_LABEL = "Unknown";

    private static final Pattern LABEL = Pattern.compile("^(-?\\d+)-(-?\\d+)$");

    /**
     * Orders band labels by lower bound; unparseable labels sort last, alphabetically.
     */
    public static final Comparator<String> LABEL_ORDER = (left, right) -> {
        Optional<PremiumBand> a = parse(left);
        Optional<PremiumBand> b = parse(right);
        if (a.isPresent() && b.isPresent()) {
            return Integer.compare(a.get().getLower(), b.get().getLower());
        }
        if (a.isPresent()) {
            return -1;
        }
        if (b.isPresent()) {
            return 1;
        }
        return String.valueOf(left).compareTo(String.valueOf(right));
    };

    int lower;
    int upper;

    public static PremiumBand of(int lower, int width) {
        return new PremiumBand(lower, lower + width);
    }

    public static Optional<PremiumBand> parse(String label) {
        if (label == null) {
            return Optional.empty();
        }
        Matcher matcher = LABEL.matcher(label.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            int lower = Integer.parseInt(matcher.group(1));
            int upper = Integer.parseInt(matcher.group(2));
            return lower < upper ? Optional.of(new PremiumBand(lower, upper)) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public String getLabel() {
        return lower + "-" + upper;
    }

    /**
     * True when the band shares at least one basis point with the closed range [min, max].
     * Null bounds are open.
     */
    public boolean overlaps(Integer min, Integer max) {
        boolean aboveMin = min == null || upper > min;
        boolean belowMax = max == null || lower <= max;
        return aboveMin && belowMax;
    }
}
