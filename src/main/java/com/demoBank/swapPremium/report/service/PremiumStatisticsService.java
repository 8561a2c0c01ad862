package com.demoBank.swapPremium.report.service;

import com.demoBank.swapPremium.enrichment.model.EnrichedLoanRecord;
import com.demoBank.swapPremium.report.model.PremiumStatistics;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

@Service
public class PremiumStatisticsService {

    public PremiumStatistics premiumStatistics(List<EnrichedLoanRecord> records) {
        int[] premiums = records.stream()
                .filter(record -> record.getPremiumBps() != null)
                .mapToInt(EnrichedLoanRecord::getPremiumBps)
                .sorted()
                .toArray();
        if (premiums.length == 0) {
            return PremiumStatistics.empty();
        }

        double mean = Arrays.stream(premiums).average().orElse(0.0);
        double variance = Arrays.stream(premiums)
                .mapToDouble(p -> (p - mean) * (p - mean))
                .sum() / premiums.length;
        int middle = premiums.length / 2;
        double median = premiums.length % 2 == 1
                ? premiums[middle]
                : (premiums[middle - 1] + premiums[middle]) / 2.0;

        return PremiumStatistics.builder()
                .count(premiums.length)
                .min(premiums[0])
                .max(premiums[premiums.length - 1])
                .mean(mean)
                .median(median)
                .standardDeviation(Math.sqrt(variance))
                .build();
    }
}
