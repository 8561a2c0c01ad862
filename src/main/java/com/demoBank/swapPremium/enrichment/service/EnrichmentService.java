package com.demoBank.swapPremium.enrichment.service;

import com.demoBank.swapPremium.enrichment.exception.EmptyInputException;
import com.demoBank.swapPremium.enrichment.model.EnrichedLoanRecord;
import com.demoBank.swapPremium.enrichment.model.EnrichmentResult;
import com.demoBank.swapPremium.enrichment.model.EnrichmentStatistics;
import com.demoBank.swapPremium.matching.model.MatchExclusions;
import com.demoBank.swapPremium.matching.model.QuoteIndex;
import com.demoBank.swapPremium.matching.model.RateQuote;
import com.demoBank.swapPremium.matching.service.SwapMatcher;
import com.demoBank.swapPremium.normalization.model.NormalizationResult;
import com.demoBank.swapPremium.normalization.model.NormalizedLoanRecord;
import com.demoBank.swapPremium.normalization.model.RawLoanRecord;
import com.demoBank.swapPremium.normalization.service.NormalizationService;
import com.demoBank.swapPremium.normalization.util.TermNormalizer;
import com.demoBank.swapPremium.premium.model.PremiumBand;
import com.demoBank.swapPremium.premium.service.PremiumCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Turns raw disclosure records into the enriched record set of a session.
 *
 * Flow: normalize -> match swap quote -> compute premium -> band.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnrichmentService {

    private static final double MINIMUM_TERM_SHARE = 10.0;

    private final NormalizationService normalizationService;
    private final SwapMatcher swapMatcher;
    private final PremiumCalculator premiumCalculator;

    /**
     * Enriches a batch of disclosure records against normalized swap quotes.
     *
     * @param rawRecords records from the ingestion collaborator
     * @param quotes swap quotes, rates as decimal fractions
     * @return enriched records, including unmatched ones, with processing statistics
     * @throws EmptyInputException when either input is null or empty
     */
    public EnrichmentResult enrich(List<RawLoanRecord> rawRecords, List<RateQuote> quotes) {
        if (rawRecords == null || rawRecords.isEmpty()) {
            throw new EmptyInputException("No disclosure records to enrich");
        }
        if (quotes == null || quotes.isEmpty()) {
            throw new EmptyInputException("No swap rate quotes to match against");
        }

        long start = System.currentTimeMillis();
        log.info("Step ENRICH - records: {}, swap quotes: {}", rawRecords.size(), quotes.size());

        NormalizationResult normalization = normalizationService.normalizeAll(rawRecords);
        if (normalization.getRecords().isEmpty()) {
            log.warn("No disclosure records left after normalization");
        }

        QuoteIndex index = QuoteIndex.of(quotes);
        log.debug("Swap quotes indexed - usable: {}, terms: {}", index.size(), index.terms());
        MatchExclusions exclusions = new MatchExclusions();
        List<EnrichedLoanRecord> enriched = new ArrayList<>(normalization.getRecords().size());
        int matched = 0;
        int nonStandard = 0;
        double nonStandardVolume = 0;
        int anomalous = 0;
        int twoYear = 0;
        int fiveYear = 0;

        for (NormalizedLoanRecord record : normalization.getRecords()) {
            Integer term = record.getNormalizedTerm();
            if (term == null) {
                nonStandard++;
                nonStandardVolume += record.getLoanAmount();
                enriched.add(unpriced(record));
                continue;
            }
            if (term == TermNormalizer.TWO_YEAR_TERM) {
                twoYear++;
            } else if (term == TermNormalizer.FIVE_YEAR_TERM) {
                fiveYear++;
            }

            RateQuote quote = swapMatcher.match(record, index, exclusions);
            if (quote == null) {
                enriched.add(unpriced(record));
                continue;
            }
            if (premiumCalculator.isAnomalousRate(record)) {
                anomalous++;
            }
            Integer premium = premiumCalculator.computePremium(record, quote);
            enriched.add(EnrichedLoanRecord.builder()
                    .record(record)
                    .matchedQuote(quote)
                    .premiumBps(premium)
                    .premiumBand(premiumCalculator.assignBand(premium))
                    .month(record.getMonth())
                    .build());
            matched++;
        }

        EnrichmentStatistics statistics = EnrichmentStatistics.builder()
                .totalRecords(rawRecords.size())
                .includedRecords(enriched.size())
                .matchedRecords(matched)
                .unmatchedRecords(exclusions.getExcludedRecords())
                .unmatchedLoanAmount(exclusions.getExcludedLoanAmount())
                .missesByMonth(exclusions.getMissesByMonth())
                .nonStandardTermRecords(nonStandard)
                .nonStandardTermLoanAmount(nonStandardVolume)
                .rightToBuyExcluded(normalization.getRightToBuyExcluded())
                .duplicatesDropped(normalization.getDuplicatesDropped())
                .invalidDropped(normalization.getInvalidDropped())
                .anomalousRates(anomalous)
                .twoYearRecords(twoYear)
                .fiveYearRecords(fiveYear)
                .ltvSummary(normalization.getLtvSummary())
                .build();

        logTermMix(twoYear, fiveYear);
        if (exclusions.getExcludedRecords() > 0) {
            log.warn("{} records (loan volume {}) had no applicable swap quote - misses by month: {}",
                    exclusions.getExcludedRecords(),
                    String.format(Locale.ROOT, "%.0f", exclusions.getExcludedLoanAmount()),
                    exclusions.getMissesByMonth());
        }
        log.info("Enrichment completed - included: {}, matched: {} ({}%), unmatched: {}, non-standard term: {}, duration: {}ms",
                enriched.size(), matched, String.format(Locale.ROOT, "%.1f", statistics.matchRate()),
                exclusions.getExcludedRecords(), nonStandard, System.currentTimeMillis() - start);

        return new EnrichmentResult(Collections.unmodifiableList(enriched), statistics);
    }

    private static EnrichedLoanRecord unpriced(NormalizedLoanRecord record) {
        return EnrichedLoanRecord.builder()
                .record(record)
                .premiumBand(PremiumBand.UNKNOWN_LABEL)
                .month(record.getMonth())
                .build();
    }

    private static void logTermMix(int twoYear, int fiveYear) {
        int standard = twoYear + fiveYear;
        if (standard == 0) {
            log.warn("No 2-year or 5-year products in the dataset");
            return;
        }
        double twoYearShare = twoYear * 100.0 / standard;
        double fiveYearShare = fiveYear * 100.0 / standard;
        log.info("Product mix - 2-year: {} ({}%), 5-year: {} ({}%)",
                twoYear, String.format(Locale.ROOT, "%.1f", twoYearShare),
                fiveYear, String.format(Locale.ROOT, "%.1f", fiveYearShare));
        if (twoYearShare < MINIMUM_TERM_SHARE || fiveYearShare < MINIMUM_TERM_SHARE) {
            log.warn("Unbalanced product mix - 2-year {}%, 5-year {}%",
                    String.format(Locale.ROOT, "%.1f", twoYearShare),
                    String.format(Locale.ROOT, "%.1f", fiveYearShare));
        }
    }
}
