package com.demoBank.swapPremium.config;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Set;

/**
 * Tunable parameters of the premium analysis engine.
 *
 * Bound from {@code analysis.*} properties by {@link AnalysisConfig}; {@link #defaults()}
 * gives the same values without a Spring context.
 */
@Value
@Builder(toBuilder = true)
public class AnalysisSettings {

    /**
     * Width of a premium band in basis points.
     */
    @Builder.Default
    int bandWidthBps = 20;

    /**
     * Lowest premium (bps) used for banding. Premiums below are banded here.
     */
    @Builder.Default
    int minPremiumBps = -60;

    /**
     * Highest premium (bps) used for banding. Premiums above are banded here.
     */
    @Builder.Default
    int maxPremiumBps = 560;

    /**
     * Calendar days a quote may lie away from the document date when no earlier quote exists.
     */
    @Builder.Default
    int toleranceDays = 5;

    /**
     * Document date assigned to records whose date is missing or unparseable.
     */
    @Builder.Default
    LocalDate defaultDocumentDate = LocalDate.of(1970, 1, 1);

    /**
     * Raw rates strictly between this bound and {@link #anomalousRateThreshold} are percentages.
     */
    @Builder.Default
    double percentageRateLowerBound = 0.5;

    /**
     * Raw rates at or above this value are logged as anomalous and used unchanged.
     */
    @Builder.Default
    double anomalousRateThreshold = 15.0;

    /**
     * Lenders whose low raw rates are stored one decimal place too high.
     */
    @Builder.Default
    Set<String> scaledRateLenders = Set.of("Nationwide Building Society");

    @Builder.Default
    double scaledRateThreshold = 0.5;

    @Builder.Default
    double scaledRateDivisor = 10.0;

    /**
     * Drop Right to Buy products before enrichment.
     */
    @Builder.Default
    boolean excludeRightToBuy = true;

    @Builder.Default
    long filterCacheMaximumSize = 512;

    /**
     * Number of lenders per month that qualify a lender for the trends view.
     */
    @Builder.Default
    int trendTopLenders = 5;

    public static AnalysisSettings defaults() {
        return AnalysisSettings.builder().build();
    }
}
