package com.demoBank.swapPremium.filter.service;

import com.demoBank.swapPremium.enrichment.model.EnrichedLoanRecord;
import com.demoBank.swapPremium.filter.model.FilterCriteria;
import com.demoBank.swapPremium.filter.model.FilterFlags;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Memoizes filtered slices of one record set by the canonical form of (criteria, flags).
 *
 * Belongs to a single analysis session. Handing it a different record list clears it.
 */
@Slf4j
public class FilterCache {

    private final FilterPipeline pipeline;
    private final ObjectMapper objectMapper;
    private final Cache<String, List<EnrichedLoanRecord>> cache;
    private volatile List<EnrichedLoanRecord> source;

    public FilterCache(FilterPipeline pipeline, ObjectMapper objectMapper, long maximumSize) {
        this.pipeline = pipeline;
        this.objectMapper = objectMapper;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build();
    }

    /**
     * Filtered slice of {@code records}, computed at most once per distinct key.
     */
    public List<EnrichedLoanRecord> getCachedFiltered(List<EnrichedLoanRecord> records,
                                                      FilterCriteria criteria,
                                                      FilterFlags flags) {
        if (source != records) {
            if (source != null) {
                log.debug("Source record set changed - invalidating filter cache");
            }
            invalidateCache();
            source = records;
        }
        String key = cacheKey(criteria, flags);
        return cache.get(key, k -> {
            log.debug("Filter cache miss - key: {}", k);
            return pipeline.apply(records, criteria, flags);
        });
    }

    public void invalidateCache() {
        cache.invalidateAll();
        log.debug("Filter cache invalidated");
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    /**
     * JSON of criteria and enabled flags with keys and set members in sorted order, so that
     * equal selections give equal keys regardless of insertion order.
     */
    String cacheKey(FilterCriteria criteria, FilterFlags flags) {
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("startMonth", criteria.getStartMonth());
        canonical.put("endMonth", criteria.getEndMonth());
        canonical.put("lenders", sorted(criteria.getLenders()));
        canonical.put("minPremiumBps", criteria.getMinPremiumBps());
        canonical.put("maxPremiumBps", criteria.getMaxPremiumBps());
        canonical.put("productTypes", sorted(criteria.getProductTypes()));
        canonical.put("purchaseTypes", sorted(criteria.getPurchaseTypes()));
        canonical.put("ltvBucket", criteria.getLtvBucket());
        canonical.put("normalizedTerm", criteria.getNormalizedTerm());
        canonical.put("flags", new TreeSet<>(flags.enabledKeys()));
        try {
            return objectMapper.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to build filter cache key", e);
        }
    }

    // null entries are legal in criteria sets and sort first
    private static Set<String> sorted(Set<String> values) {
        Set<String> sorted = new TreeSet<>(Comparator.nullsFirst(Comparator.<String>naturalOrder()));
        sorted.addAll(values);
        return sorted;
    }
}
