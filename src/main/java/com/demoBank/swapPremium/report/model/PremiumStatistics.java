package com.demoBank.swapPremium.report.model;

import lombok.Builder;
import lombok.Value;

/**
 * Summary of known premiums in basis points. Every figure is null when there are none.
 */
@Value
@Builder
public class PremiumStatistics {

    int count;

    Integer min;

    Integer max;

    Double mean;

    Double median;

    /**
     * Population standard deviation.
     */
    Double standardDeviation;

    public static PremiumStatistics empty() {
        return PremiumStatistics.builder().count(0).build();
    }
}
