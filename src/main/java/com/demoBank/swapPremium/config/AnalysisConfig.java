package com.demoBank.swapPremium.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Binds the {@code analysis.*} properties into an {@link AnalysisSettings} bean.
 */
@Slf4j
@Configuration
public class AnalysisConfig {

    @Bean
    public AnalysisSettings analysisSettings(
            @Value("${analysis.premium.band-width-bps:20}") int bandWidthBps,
            @Value("${analysis.premium.min-bps:-60}") int minPremiumBps,
            @Value("${analysis.premium.max-bps:560}") int maxPremiumBps,
            @Value("${analysis.matching.tolerance-days:5}") int toleranceDays,
            @Value("${analysis.normalization.default-document-date:1970-01-01}") String defaultDocumentDate,
            @Value("${analysis.normalization.exclude-right-to-buy:true}") boolean excludeRightToBuy,
            @Value("${analysis.rate.percentage-lower-bound:0.5}") double percentageRateLowerBound,
            @Value("${analysis.rate.anomalous-threshold:15}") double anomalousRateThreshold,
            @Value("${analysis.rate.scaled-lenders:Nationwide Building Society}") String scaledRateLenders,
            @Value("${analysis.rate.scaled-threshold:0.5}") double scaledRateThreshold,
            @Value("${analysis.rate.scaled-divisor:10}") double scaledRateDivisor,
            @Value("${analysis.filter-cache.maximum-size:512}") long filterCacheMaximumSize,
            @Value("${analysis.trends.top-lenders:5}") int trendTopLenders) {

        if (bandWidthBps <= 0) {
            throw new IllegalArgumentException("analysis.premium.band-width-bps must be positive: " + bandWidthBps);
        }
        if (minPremiumBps >= maxPremiumBps) {
            throw new IllegalArgumentException(
                    "analysis.premium.min-bps must be below max-bps: " + minPremiumBps + " >= " + maxPremiumBps);
        }

        AnalysisSettings settings = AnalysisSettings.builder()
                .bandWidthBps(bandWidthBps)
                .minPremiumBps(minPremiumBps)
                .maxPremiumBps(maxPremiumBps)
                .toleranceDays(toleranceDays)
                .defaultDocumentDate(LocalDate.parse(defaultDocumentDate))
                .excludeRightToBuy(excludeRightToBuy)
                .percentageRateLowerBound(percentageRateLowerBound)
                .anomalousRateThreshold(anomalousRateThreshold)
                .scaledRateLenders(splitList(scaledRateLenders))
                .scaledRateThreshold(scaledRateThreshold)
                .scaledRateDivisor(scaledRateDivisor)
                .filterCacheMaximumSize(filterCacheMaximumSize)
                .trendTopLenders(trendTopLenders)
                .build();

        log.info("Analysis settings - premium range: [{}, {}] bps, band width: {} bps, tolerance: {} days",
                minPremiumBps, maxPremiumBps, bandWidthBps, toleranceDays);
        return settings;
    }

    private static Set<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }
}
