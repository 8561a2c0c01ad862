package com.demoBank.swapPremium.report.service;

import com.demoBank.swapPremium.config.AnalysisSettings;
import com.demoBank.swapPremium.enrichment.model.EnrichedLoanRecord;
import com.demoBank.swapPremium.report.model.MarketShareTrend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Lender share of monthly volume over time, for the lenders that led at least one month.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketShareTrendService {

    private static final DateTimeFormatter MONTH_LABEL = DateTimeFormatter.ofPattern("MMM yy", Locale.ENGLISH);

    private final AnalysisSettings settings;

    public MarketShareTrend trends(List<EnrichedLoanRecord> records, Collection<String> selectedBands,
                                   String startMonth, String endMonth) {
        return trends(records, selectedBands, startMonth, endMonth, settings.getTrendTopLenders());
    }

    /**
     * @param selectedBands bands to include; empty means every known band
     * @param startMonth first month (YYYY-MM), null for open
     * @param endMonth last month (YYYY-MM), null for open
     * @param topN lenders per month that qualify for the result
     */
    public MarketShareTrend trends(List<EnrichedLoanRecord> records, Collection<String> selectedBands,
                                   String startMonth, String endMonth, int topN) {
        Set<String> bands = new HashSet<>(selectedBands);
        // month -> lender -> volume
        TreeMap<String, Map<String, Double>> byMonth = new TreeMap<>();
        TreeMap<String, Double> monthTotals = new TreeMap<>();

        for (EnrichedLoanRecord record : records) {
            String month = record.getMonth();
            String lender = record.getLenderName();
            if (!record.hasKnownBand() || month == null || lender == null || lender.isEmpty()) {
                continue;
            }
            if (!bands.isEmpty() && !bands.contains(record.getPremiumBand())) {
                continue;
            }
            if ((startMonth != null && month.compareTo(startMonth) < 0)
                    || (endMonth != null && month.compareTo(endMonth) > 0)) {
                continue;
            }
            byMonth.computeIfAbsent(month, m -> new TreeMap<>()).merge(lender, record.getLoanAmount(), Double::sum);
            monthTotals.merge(month, record.getLoanAmount(), Double::sum);
        }

        TreeSet<String> topLenders = new TreeSet<>();
        byMonth.forEach((month, lenders) -> lenders.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.<String, Double>comparingByKey()))
                .limit(topN)
                .forEach(entry -> topLenders.add(entry.getKey())));

        Map<String, Map<String, Double>> volumes = new TreeMap<>();
        Map<String, Map<String, Double>> shares = new TreeMap<>();
        for (String lender : topLenders) {
            Map<String, Double> lenderVolumes = new TreeMap<>();
            Map<String, Double> lenderShares = new TreeMap<>();
            byMonth.forEach((month, lenders) -> {
                double volume = lenders.getOrDefault(lender, 0.0);
                double total = monthTotals.get(month);
                lenderVolumes.put(month, volume);
                lenderShares.put(month, total > 0 ? volume * 100.0 / total : 0.0);
            });
            volumes.put(lender, lenderVolumes);
            shares.put(lender, lenderShares);
        }

        List<String> months = new ArrayList<>(byMonth.keySet());
        List<String> labels = new ArrayList<>(months.size());
        for (String month : months) {
            labels.add(YearMonth.parse(month).format(MONTH_LABEL));
        }

        log.debug("Market share trends - months: {}, top lenders: {}", months.size(), topLenders);
        return MarketShareTrend.builder()
                .months(months)
                .monthLabels(labels)
                .topLenders(new ArrayList<>(topLenders))
                .volumes(volumes)
                .shares(shares)
                .monthTotals(monthTotals)
                .build();
    }
}
