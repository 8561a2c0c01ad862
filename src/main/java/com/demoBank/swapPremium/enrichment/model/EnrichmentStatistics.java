package com.demoBank.swapPremium.enrichment.model;

import com.demoBank.swapPremium.normalization.model.LtvSummary;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Counters describing how an enrichment batch was processed.
 */
@Value
@Builder
public class EnrichmentStatistics {

    /**
     * Raw records received.
     */
    int totalRecords;

    /**
     * Records that survived normalization and are in the enriched set.
     */
    int includedRecords;

    int matchedRecords;

    /**
     * Standard-term records for which no swap quote applied.
     */
    int unmatchedRecords;

    double unmatchedLoanAmount;

    /**
     * Unmatched record counts by document month.
     */
    Map<String, Integer> missesByMonth;

    int nonStandardTermRecords;

    double nonStandardTermLoanAmount;

    int rightToBuyExcluded;

    int duplicatesDropped;

    int invalidDropped;

    int anomalousRates;

    int twoYearRecords;

    int fiveYearRecords;

    LtvSummary ltvSummary;

    public double matchRate() {
        return includedRecords == 0 ? 0.0 : matchedRecords * 100.0 / includedRecords;
    }
}
