package com.demoBank.swapPremium.filter.service;

import com.demoBank.swapPremium.enrichment.model.EnrichedLoanRecord;
import com.demoBank.swapPremium.filter.model.FilterCriteria;
import com.demoBank.swapPremium.filter.model.LtvBucket;
import com.demoBank.swapPremium.premium.model.PremiumBand;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.Set;

/**
 * One predicate per filter criterion. Each is independent of the others.
 */
@Slf4j
public final class FilterPredicates {

    private FilterPredicates() {}

    /**
     * Month key within [start, end], both ends optional. A record without a month fails
     * when any bound is set.
     */
    public static boolean inMonthRange(EnrichedLoanRecord record, FilterCriteria criteria) {
        String start = criteria.getStartMonth();
        String end = criteria.getEndMonth();
        if (start == null && end == null) {
            return true;
        }
        String month = record.getMonth();
        if (month == null) {
            return false;
        }
        return (start == null || month.compareTo(start) >= 0)
                && (end == null || month.compareTo(end) <= 0);
    }

    public static boolean matchesLender(EnrichedLoanRecord record, FilterCriteria criteria) {
        Set<String> lenders = criteria.getLenders();
        if (lenders.isEmpty()) {
            return true;
        }
        return lenders.contains(record.getLenderName()) || lenders.contains(record.getProviderName());
    }

    /**
     * A known premium must lie in the range; otherwise the band must overlap it.
     * "Unknown" never passes a restricted range.
     */
    public static boolean inPremiumRange(EnrichedLoanRecord record, FilterCriteria criteria) {
        Integer min = criteria.getMinPremiumBps();
        Integer max = criteria.getMaxPremiumBps();
        if (min == null && max == null) {
            return true;
        }
        Integer premium = record.getPremiumBps();
        if (premium != null) {
            return (min == null || premium >= min) && (max == null || premium <= max);
        }
        Optional<PremiumBand> band = PremiumBand.parse(record.getPremiumBand());
        return band.isPresent() && band.get().overlaps(min, max);
    }

    public static boolean matchesProductType(EnrichedLoanRecord record, FilterCriteria criteria) {
        return criteria.getProductTypes().isEmpty() || criteria.getProductTypes().contains(record.getProductType());
    }

    public static boolean matchesPurchaseType(EnrichedLoanRecord record, FilterCriteria criteria) {
        return criteria.getPurchaseTypes().isEmpty() || criteria.getPurchaseTypes().contains(record.getPurchaseType());
    }

    /**
     * Records without an LTV pass every bucket.
     */
    public static boolean inLtvBucket(EnrichedLoanRecord record, FilterCriteria criteria) {
        LtvBucket bucket = criteria.getLtvBucket();
        if (bucket == null || bucket == LtvBucket.ALL) {
            return true;
        }
        Double ltv = record.getLtv();
        if (ltv == null) {
            log.trace("Record of '{}' has no LTV - kept by {} filter", record.getLenderName(), bucket);
            return true;
        }
        return LtvBucket.of(ltv) == bucket;
    }

    public static boolean matchesTerm(EnrichedLoanRecord record, FilterCriteria criteria) {
        Integer term = criteria.getNormalizedTerm();
        return term == null || term.equals(record.getNormalizedTerm());
    }
}
