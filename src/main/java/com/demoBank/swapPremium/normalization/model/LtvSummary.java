package com.demoBank.swapPremium.normalization.model;

import lombok.Builder;
import lombok.Value;

/**
 * LTV coverage of a normalized batch.
 */
@Value
@Builder
public class LtvSummary {

    int recordsWithLtv;

    int recordsMissingLtv;

    /**
     * Null when no record carried an LTV.
     */
    Double averageLtv;

    int below80Count;

    int atOrAbove80Count;

    public double below80Percent() {
        return recordsWithLtv == 0 ? 0.0 : below80Count * 100.0 / recordsWithLtv;
    }

    public double atOrAbove80Percent() {
        return recordsWithLtv == 0 ? 0.0 : atOrAbove80Count * 100.0 / recordsWithLtv;
    }
}
