package com.demoBank.swapPremium.report.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Premium band by month volume table with each band's share of the market baseline.
 */
@Value
@Builder
public class BandReport {

    public static final String TOTAL_ROW = "Total";

    @Singular
    List<String> months;

    /**
     * One row per band, then the {@value #TOTAL_ROW} row.
     */
    @Singular
    List<Row> rows;

    public Row totalRow() {
        return rows.isEmpty() ? null : rows.get(rows.size() - 1);
    }

    @Value
    @Builder
    public static class Row {

        String band;

        /**
         * month -> loan sum, in report month order.
         */
        Map<String, Double> monthValues;

        double total;

        /**
         * Share of the market baseline volume for this band.
         */
        double percentOfMarket;
    }
}
