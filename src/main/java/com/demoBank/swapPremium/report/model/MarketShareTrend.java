package com.demoBank.swapPremium.report.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Month by month lender volume and share within the selected premium bands.
 */
@Value
@Builder
public class MarketShareTrend {

    /**
     * Month keys (YYYY-MM), ascending.
     */
    List<String> months;

    /**
     * Display labels such as "Jan 24", aligned with {@link #months}.
     */
    List<String> monthLabels;

    /**
     * Lenders ranked in the top N of at least one month, sorted by name.
     */
    List<String> topLenders;

    /**
     * lender -> month -> loan sum.
     */
    Map<String, Map<String, Double>> volumes;

    /**
     * lender -> month -> share of that month's volume.
     */
    Map<String, Map<String, Double>> shares;

    Map<String, Double> monthTotals;

    public double share(String lender, String month) {
        Map<String, Double> row = shares.get(lender);
        return row == null ? 0.0 : row.getOrDefault(month, 0.0);
    }

    public double volume(String lender, String month) {
        Map<String, Double> row = volumes.get(lender);
        return row == null ? 0.0 : row.getOrDefault(month, 0.0);
    }
}
