package com.demoBank.swapPremium.filter.model;

/**
 * LTV split used by the filter and the market share view.
 */
public enum LtvBucket {
    ALL,
    BELOW_80,
    ABOVE_80;

    public static final double THRESHOLD = 80.0;

    /**
     * Bucket of a known LTV percentage; never {@link #ALL}.
     */
    public static LtvBucket of(double ltv) {
        return ltv < THRESHOLD ? BELOW_80 : ABOVE_80;
    }
}
