package com.demoBank.swapPremium.report.service;

import com.demoBank.swapPremium.aggregation.model.AggregationResult;
import com.demoBank.swapPremium.enrichment.model.EnrichedLoanRecord;
import com.demoBank.swapPremium.premium.model.PremiumBand;
import com.demoBank.swapPremium.report.model.BandReport;
import com.demoBank.swapPremium.report.model.HeatmapMatrix;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;

/**
 * Tables rendered from aggregated or filtered records.
 */
@Slf4j
@Service
public class MarketReportService {

    /**
     * Band by month table for a filtered view.
     *
     * @param filtered aggregation of the current filtered view
     * @param baseline market baseline for the same date, product and purchase criteria
     * @param lenderSelectionActive whether the view is restricted to selected lenders
     */
    public BandReport bandReport(AggregationResult filtered, AggregationResult baseline, boolean lenderSelectionActive) {
        BandReport.BandReportBuilder report = BandReport.builder().months(filtered.getMonths());

        for (String band : filtered.getPremiumBands()) {
            double total = filtered.bandTotal(band);
            report.row(BandReport.Row.builder()
                    .band(band)
                    .monthValues(monthValues(filtered.getMonths(), month -> filtered.cell(band, month)))
                    .total(total)
                    .percentOfMarket(percentOfMarket(total, baseline.bandTotal(band), lenderSelectionActive))
                    .build());
        }

        report.row(BandReport.Row.builder()
                .band(BandReport.TOTAL_ROW)
                .monthValues(monthValues(filtered.getMonths(), filtered::monthTotal))
                .total(filtered.getGrandTotal())
                .percentOfMarket(percentOfMarket(filtered.getGrandTotal(), baseline.getGrandTotal(), lenderSelectionActive))
                .build());
        return report.build();
    }

    /**
     * Lender by band volume for records with a known band and a named lender.
     */
    public HeatmapMatrix heatmap(List<EnrichedLoanRecord> records) {
        Map<String, Map<String, Double>> values = new TreeMap<>();
        Map<String, Double> lenderTotals = new TreeMap<>();
        Map<String, Double> bandTotals = new TreeMap<>(PremiumBand.LABEL_ORDER);
        double grandTotal = 0;

        for (EnrichedLoanRecord record : records) {
            String lender = record.getLenderName();
            if (!record.hasKnownBand() || lender == null || lender.isEmpty()) {
                continue;
            }
            double loan = record.getLoanAmount();
            values.computeIfAbsent(lender, l -> new TreeMap<>(PremiumBand.LABEL_ORDER))
                    .merge(record.getPremiumBand(), loan, Double::sum);
            lenderTotals.merge(lender, loan, Double::sum);
            bandTotals.merge(record.getPremiumBand(), loan, Double::sum);
            grandTotal += loan;
        }

        log.debug("Heatmap built - lenders: {}, bands: {}", lenderTotals.size(), bandTotals.size());
        return HeatmapMatrix.builder()
                .lenders(List.copyOf(lenderTotals.keySet()))
                .bands(List.copyOf(bandTotals.keySet()))
                .values(Collections.unmodifiableMap(values))
                .lenderTotals(Collections.unmodifiableMap(lenderTotals))
                .bandTotals(Collections.unmodifiableMap(bandTotals))
                .grandTotal(grandTotal)
                .build();
    }

    private static Map<String, Double> monthValues(List<String> months, ToDoubleFunction<String> value) {
        Map<String, Double> row = new LinkedHashMap<>();
        for (String month : months) {
            row.put(month, value.applyAsDouble(month));
        }
        return Collections.unmodifiableMap(row);
    }

    private static double percentOfMarket(double filtered, double market, boolean lenderSelectionActive) {
        if (market <= 0) {
            return 0.0;
        }
        if (!lenderSelectionActive) {
            return 100.0;
        }
        return filtered * 100.0 / market;
    }
}
