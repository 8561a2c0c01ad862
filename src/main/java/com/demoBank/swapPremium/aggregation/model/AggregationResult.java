package com.demoBank.swapPremium.aggregation.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Loan volume by premium band and month.
 *
 * Totals by band, totals by month and the grand total sum the same qualifying records.
 */
@Value
@Builder
public class AggregationResult {

    /**
     * Band labels ordered by lower bound.
     */
    List<String> premiumBands;

    /**
     * Month keys (YYYY-MM), ascending.
     */
    List<String> months;

    /**
     * band -> month -> loan sum; only populated cells are present.
     */
    Map<String, Map<String, Double>> cells;

    Map<String, Double> totalsByBand;

    Map<String, Double> totalsByMonth;

    double grandTotal;

    int recordCount;

    public double cell(String band, String month) {
        Map<String, Double> row = cells.get(band);
        if (row == null) {
            return 0.0;
        }
        return row.getOrDefault(month, 0.0);
    }

    public double bandTotal(String band) {
        return totalsByBand.getOrDefault(band, 0.0);
    }

    public double monthTotal(String month) {
        return totalsByMonth.getOrDefault(month, 0.0);
    }

    public boolean isEmpty() {
        return recordCount == 0;
    }
}
