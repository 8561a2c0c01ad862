package com.demoBank.swapPremium.aggregation.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Each lender's share of the filtered market within the selected premium bands.
 */
@Value
@Builder
public class LenderShareResult {

    public static final String TOTAL_MARKET = "Total Market";

    @Singular
    List<String> lenders;

    @Singular
    List<String> selectedBands;

    /**
     * One row per lender, in {@link #lenders} order.
     */
    @Singular
    List<LenderShareRow> rows;

    /**
     * Filtered market volume per selected band.
     */
    Map<String, Double> bandTotals;

    double grandTotal;

    /**
     * "Total Market" row: band and grand totals, every percentage exactly 100.
     */
    LenderShareRow summaryRow;

    public LenderShareRow row(String lender) {
        if (TOTAL_MARKET.equals(lender)) {
            return summaryRow;
        }
        return rows.stream()
                .filter(row -> row.getLender().equals(lender))
                .findFirst()
                .orElse(null);
    }

    @Value
    @Builder
    public static class LenderShareRow {

        String lender;

        /**
         * band label -> share, in selected band order.
         */
        Map<String, BandShare> bands;

        double total;

        /**
         * Share of {@link LenderShareResult#getGrandTotal()}.
         */
        double totalPercent;

        /**
         * Below-80% LTV volume across the selected bands.
         */
        double below80Total;

        double below80TotalPercent;

        double above80Total;

        double above80TotalPercent;

        public BandShare band(String label) {
            return bands.get(label);
        }
    }

    @Value
    @Builder
    public static class BandShare {

        double amount;

        /**
         * Share of the band's filtered market volume.
         */
        double percent;

        double below80Amount;

        /**
         * Share of the band's below-80% LTV volume.
         */
        double below80Percent;

        double above80Amount;

        double above80Percent;
    }
}
