package com.demoBank.swapPremium.report.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Lender by premium band loan volume, with shares in both directions.
 */
@Value
@Builder
public class HeatmapMatrix {

    List<String> lenders;

    List<String> bands;

    /**
     * lender -> band -> loan sum.
     */
    Map<String, Map<String, Double>> values;

    Map<String, Double> lenderTotals;

    Map<String, Double> bandTotals;

    double grandTotal;

    public double value(String lender, String band) {
        Map<String, Double> row = values.get(lender);
        return row == null ? 0.0 : row.getOrDefault(band, 0.0);
    }

    /**
     * Share of the lender's own volume that sits in {@code band}.
     */
    public double shareOfLender(String lender, String band) {
        double total = lenderTotals.getOrDefault(lender, 0.0);
        return total > 0 ? value(lender, band) * 100.0 / total : 0.0;
    }

    /**
     * Share of the band's volume written by {@code lender}.
     */
    public double shareOfBand(String lender, String band) {
        double total = bandTotals.getOrDefault(band, 0.0);
        return total > 0 ? value(lender, band) * 100.0 / total : 0.0;
    }
}
