package com.demoBank.swapPremium.aggregation.service;

import com.demoBank.swapPremium.aggregation.model.AggregationResult;
import com.demoBank.swapPremium.enrichment.model.EnrichedLoanRecord;
import com.demoBank.swapPremium.filter.model.FilterCriteria;
import com.demoBank.swapPremium.filter.model.FilterFlags;
import com.demoBank.swapPremium.filter.model.FilterKey;
import com.demoBank.swapPremium.filter.service.FilterPipeline;
import com.demoBank.swapPremium.premium.model.PremiumBand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sums loan volume into a premium band by month matrix.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AggregationService {

    private final FilterPipeline filterPipeline;

    /**
     * Aggregates records with a known band, a month and a positive loan amount; others are ignored.
     */
    public AggregationResult aggregate(List<EnrichedLoanRecord> records) {
        Map<String, Map<String, Double>> cells = new TreeMap<>(PremiumBand.LABEL_ORDER);
        Map<String, Double> byBand = new TreeMap<>(PremiumBand.LABEL_ORDER);
        Map<String, Double> byMonth = new TreeMap<>();
        double grandTotal = 0;
        int count = 0;

        for (EnrichedLoanRecord record : records) {
            if (!qualifies(record)) {
                continue;
            }
            String band = record.getPremiumBand();
            String month = record.getMonth();
            double loan = record.getLoanAmount();
            cells.computeIfAbsent(band, b -> new TreeMap<>()).merge(month, loan, Double::sum);
            byBand.merge(band, loan, Double::sum);
            byMonth.merge(month, loan, Double::sum);
            grandTotal += loan;
            count++;
        }

        Map<String, Map<String, Double>> frozenCells = new LinkedHashMap<>();
        cells.forEach((band, row) -> frozenCells.put(band, Collections.unmodifiableMap(row)));

        log.debug("Aggregated {} of {} records into {} bands x {} months, total {}",
                count, records.size(), byBand.size(), byMonth.size(), grandTotal);

        return AggregationResult.builder()
                .premiumBands(List.copyOf(byBand.keySet()))
                .months(List.copyOf(byMonth.keySet()))
                .cells(Collections.unmodifiableMap(frozenCells))
                .totalsByBand(Collections.unmodifiableMap(new LinkedHashMap<>(byBand)))
                .totalsByMonth(Collections.unmodifiableMap(new LinkedHashMap<>(byMonth)))
                .grandTotal(grandTotal)
                .recordCount(count)
                .build();
    }

    /**
     * Market volume that a lender's share is measured against: the records passing the date,
     * product type and purchase type criteria, ignoring any lender selection.
     */
    public AggregationResult aggregateMarketBaseline(List<EnrichedLoanRecord> records, FilterCriteria criteria) {
        return aggregate(filterPipeline.apply(records, criteria, FilterFlags.marketBaseline()));
    }

    /**
     * As {@link #aggregateMarketBaseline(List, FilterCriteria)} with caller-chosen flags.
     * The lender criterion is always switched off.
     */
    public AggregationResult aggregateMarketBaseline(List<EnrichedLoanRecord> records,
                                                     FilterCriteria criteria,
                                                     FilterFlags flags) {
        return aggregate(filterPipeline.apply(records, criteria, flags.without(FilterKey.LENDER)));
    }

    static boolean qualifies(EnrichedLoanRecord record) {
        return record.hasKnownBand() && record.getMonth() != null && record.getLoanAmount() > 0;
    }
}
