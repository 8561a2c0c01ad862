package com.demoBank.swapPremium.aggregation.service;

import com.demoBank.swapPremium.aggregation.model.LenderShareResult;
import com.demoBank.swapPremium.aggregation.model.LenderShareResult.BandShare;
import com.demoBank.swapPremium.aggregation.model.LenderShareResult.LenderShareRow;
import com.demoBank.swapPremium.enrichment.model.EnrichedLoanRecord;
import com.demoBank.swapPremium.filter.model.LtvBucket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Lender market share within selected premium bands.
 *
 * Input should be filtered by every criterion except the lender selection, so that shares are
 * of the market rather than of the selected lenders.
 */
@Slf4j
@Service
public class LenderShareService {

    private static final double FULL_SHARE = 100.0;

    public LenderShareResult lenderShare(List<EnrichedLoanRecord> records, List<String> selectedBands) {
        List<String> bands = List.copyOf(new LinkedHashSet<>(selectedBands));
        TreeSet<String> lenders = new TreeSet<>();
        Map<String, Volume> marketByBand = new HashMap<>();
        Map<String, Map<String, Volume>> lenderByBand = new HashMap<>();
        for (String band : bands) {
            marketByBand.put(band, new Volume());
        }

        // lenderless records belong to no row, so they stay out of the market too
        for (EnrichedLoanRecord record : records) {
            String lender = record.getLenderName();
            if (lender == null || lender.isEmpty()) {
                continue;
            }
            lenders.add(lender);
            Volume market = marketByBand.get(record.getPremiumBand());
            if (market == null) {
                continue;
            }
            market.add(record);
            lenderByBand.computeIfAbsent(lender, l -> new HashMap<>())
                    .computeIfAbsent(record.getPremiumBand(), b -> new Volume())
                    .add(record);
        }

        Map<String, Double> bandTotals = new LinkedHashMap<>();
        Volume overall = new Volume();
        for (String band : bands) {
            Volume market = marketByBand.get(band);
            bandTotals.put(band, market.amount);
            overall.addAll(market);
        }
        double grandTotal = overall.amount;

        LenderShareResult.LenderShareResultBuilder result = LenderShareResult.builder()
                .lenders(lenders)
                .selectedBands(bands)
                .bandTotals(bandTotals)
                .grandTotal(grandTotal);

        for (String lender : lenders) {
            Map<String, Volume> own = lenderByBand.getOrDefault(lender, Map.of());
            Map<String, BandShare> shares = new LinkedHashMap<>();
            Volume lenderTotal = new Volume();
            for (String band : bands) {
                Volume volume = own.getOrDefault(band, Volume.EMPTY);
                Volume market = marketByBand.get(band);
                shares.put(band, BandShare.builder()
                        .amount(volume.amount)
                        .percent(percent(volume.amount, market.amount))
                        .below80Amount(volume.below80)
                        .below80Percent(percent(volume.below80, market.below80))
                        .above80Amount(volume.above80)
                        .above80Percent(percent(volume.above80, market.above80))
                        .build());
                lenderTotal.addAll(volume);
            }
            result.row(LenderShareRow.builder()
                    .lender(lender)
                    .bands(shares)
                    .total(lenderTotal.amount)
                    .totalPercent(percent(lenderTotal.amount, overall.amount))
                    .below80Total(lenderTotal.below80)
                    .below80TotalPercent(percent(lenderTotal.below80, overall.below80))
                    .above80Total(lenderTotal.above80)
                    .above80TotalPercent(percent(lenderTotal.above80, overall.above80))
                    .build());
        }

        result.summaryRow(summaryRow(bands, marketByBand, overall));
        log.debug("Lender share computed - lenders: {}, bands: {}, market total: {}", lenders.size(), bands, grandTotal);
        return result.build();
    }

    private static LenderShareRow summaryRow(List<String> bands, Map<String, Volume> marketByBand, Volume overall) {
        Map<String, BandShare> shares = new LinkedHashMap<>();
        for (String band : bands) {
            Volume market = marketByBand.get(band);
            shares.put(band, BandShare.builder()
                    .amount(market.amount)
                    .percent(FULL_SHARE)
                    .below80Amount(market.below80)
                    .below80Percent(FULL_SHARE)
                    .above80Amount(market.above80)
                    .above80Percent(FULL_SHARE)
                    .build());
        }
        return LenderShareRow.builder()
                .lender(LenderShareResult.TOTAL_MARKET)
                .bands(shares)
                .total(overall.amount)
                .totalPercent(FULL_SHARE)
                .below80Total(overall.below80)
                .below80TotalPercent(FULL_SHARE)
                .above80Total(overall.above80)
                .above80TotalPercent(FULL_SHARE)
                .build();
    }

    private static double percent(double part, double whole) {
        return whole > 0 ? part * 100.0 / whole : 0.0;
    }

    /**
     * Loan volume with its LTV split. Records without LTV count only in {@code amount}.
     */
    private static final class Volume {
        private static final Volume EMPTY = new Volume();

        private double amount;
        private double below80;
        private double above80;

        private void add(EnrichedLoanRecord record) {
            double loan = record.getLoanAmount();
            amount += loan;
            if (record.getLtv() == null) {
                return;
            }
            if (LtvBucket.of(record.getLtv()) == LtvBucket.BELOW_80) {
                below80 += loan;
            } else {
                above80 += loan;
            }
        }

        private void addAll(Volume other) {
            amount += other.amount;
            below80 += other.below80;
            above80 += other.above80;
        }
    }
}
