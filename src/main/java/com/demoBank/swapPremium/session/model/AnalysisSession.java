package com.demoBank.swapPremium.session.model;

import com.demoBank.swapPremium.aggregation.model.AggregationResult;
import com.demoBank.swapPremium.enrichment.model.EnrichedLoanRecord;
import com.demoBank.swapPremium.enrichment.model.EnrichmentResult;
import com.demoBank.swapPremium.enrichment.model.EnrichmentStatistics;
import com.demoBank.swapPremium.filter.model.FilterCriteria;
import com.demoBank.swapPremium.filter.model.FilterFlags;
import com.demoBank.swapPremium.filter.service.FilterCache;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;

/**
 * State of one analysis run: the enriched record set, its full-dataset aggregation and the
 * filter cache over it.
 *
 * The record set is immutable between reloads; only the cache changes as views are requested.
 */
@Slf4j
@Getter
public class AnalysisSession {

    private final String sessionId;

    private final Instant createdAt;

    private final FilterCache filterCache;

    private volatile EnrichmentResult enrichment;

    /**
     * Aggregation of every record in the session, unfiltered.
     */
    private volatile AggregationResult fullAggregation;

    private volatile Instant loadedAt;

    public AnalysisSession(String sessionId, FilterCache filterCache,
                           EnrichmentResult enrichment, AggregationResult fullAggregation) {
        this.sessionId = sessionId;
        this.createdAt = Instant.now();
        this.filterCache = filterCache;
        this.enrichment = enrichment;
        this.fullAggregation = fullAggregation;
        this.loadedAt = createdAt;
    }

    public List<EnrichedLoanRecord> getRecords() {
        return enrichment.getRecords();
    }

    public EnrichmentStatistics getStatistics() {
        return enrichment.getStatistics();
    }

    public List<EnrichedLoanRecord> getCachedFiltered(FilterCriteria criteria, FilterFlags flags) {
        return filterCache.getCachedFiltered(getRecords(), criteria, flags);
    }

    public void invalidateCache() {
        filterCache.invalidateCache();
    }

    /**
     * Replaces the session's data and clears every cached view.
     */
    public void reload(EnrichmentResult enrichment, AggregationResult fullAggregation) {
        this.enrichment = enrichment;
        this.fullAggregation = fullAggregation;
        this.loadedAt = Instant.now();
        invalidateCache();
        log.info("Session reloaded - sessionId: {}, records: {}", sessionId, enrichment.getRecords().size());
    }
}
