package com.demoBank.swapPremium.matching.service;

import com.demoBank.swapPremium.config.AnalysisSettings;
import com.demoBank.swapPremium.matching.model.MatchExclusions;
import com.demoBank.swapPremium.matching.model.QuoteIndex;
import com.demoBank.swapPremium.matching.model.RateQuote;
import com.demoBank.swapPremium.normalization.model.NormalizedLoanRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Finds the swap quote in effect for a disclosure record.
 *
 * Matching rule, in order:
 * 1. quotes of the record's normalized term, else of the nearest available term (ties to the smaller);
 * 2. the latest quote effective on or before the document date;
 * 3. otherwise the nearest quote by day distance if within the tolerance window;
 * 4. otherwise no match, which is tallied in the caller's {@link MatchExclusions}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SwapMatcher {

    private final AnalysisSettings settings;

    /**
     * Indexes {@code quotes} and discards the exclusion tally. Callers outside this package
     * go through {@link #match(NormalizedLoanRecord, QuoteIndex, MatchExclusions)}.
     */
    RateQuote match(NormalizedLoanRecord record, List<RateQuote> quotes) {
        return match(record, QuoteIndex.of(quotes), new MatchExclusions());
    }

    /**
     * @param record normalized record; records with a null term are not matched
     * @param index quotes indexed by term
     * @param exclusions tally updated on every miss
     * @return the applicable quote, or null
     */
    public RateQuote match(NormalizedLoanRecord record, QuoteIndex index, MatchExclusions exclusions) {
        Integer term = record.getNormalizedTerm();
        if (term == null) {
            return null;
        }

        LocalDate documentDate = record.getDocumentDate();
        List<RateQuote> candidates = index.candidatesFor(term);
        if (documentDate == null || candidates.isEmpty()) {
            exclusions.record(record.getMonth(), record.getLoanAmount());
            return null;
        }

        int preceding = lastOnOrBefore(candidates, documentDate);
        if (preceding >= 0) {
            return candidates.get(preceding);
        }

        RateQuote nearest = nearestByDays(candidates, documentDate);
        long distance = Math.abs(ChronoUnit.DAYS.between(documentDate, nearest.getEffectiveDate()));
        if (distance <= settings.getToleranceDays()) {
            log.debug("Using swap quote from {} for '{}' document dated {} ({} days apart)",
                    nearest.getEffectiveDate(), record.getLenderName(), documentDate, distance);
            return nearest;
        }

        exclusions.record(record.getMonth(), record.getLoanAmount());
        log.trace("No swap quote within {} days for '{}' on {}", settings.getToleranceDays(),
                record.getLenderName(), documentDate);
        return null;
    }

    /**
     * Index of the last quote effective on or before {@code date}, or -1.
     */
    static int lastOnOrBefore(List<RateQuote> sorted, LocalDate date) {
        int low = 0;
        int high = sorted.size() - 1;
        int found = -1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (!sorted.get(mid).getEffectiveDate().isAfter(date)) {
                found = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return found;
    }

    private static RateQuote nearestByDays(List<RateQuote> sorted, LocalDate date) {
        RateQuote best = sorted.get(0);
        long bestDistance = Math.abs(ChronoUnit.DAYS.between(date, best.getEffectiveDate()));
        for (RateQuote quote : sorted) {
            long distance = Math.abs(ChronoUnit.DAYS.between(date, quote.getEffectiveDate()));
            if (distance < bestDistance) {
                best = quote;
                bestDistance = distance;
            }
        }
        return best;
    }
}
