package com.demoBank.swapPremium.session.service;

import com.demoBank.swapPremium.aggregation.model.AggregationResult;
import com.demoBank.swapPremium.aggregation.model.LenderShareResult;
import com.demoBank.swapPremium.aggregation.service.AggregationService;
import com.demoBank.swapPremium.aggregation.service.LenderShareService;
import com.demoBank.swapPremium.config.AnalysisSettings;
import com.demoBank.swapPremium.enrichment.model.EnrichedLoanRecord;
import com.demoBank.swapPremium.enrichment.model.EnrichmentResult;
import com.demoBank.swapPremium.enrichment.service.EnrichmentService;
import com.demoBank.swapPremium.filter.model.FilterCriteria;
import com.demoBank.swapPremium.filter.model.FilterFlags;
import com.demoBank.swapPremium.filter.model.FilterKey;
import com.demoBank.swapPremium.filter.service.FilterCache;
import com.demoBank.swapPremium.filter.service.FilterPipeline;
import com.demoBank.swapPremium.matching.model.RateQuote;
import com.demoBank.swapPremium.normalization.model.RawLoanRecord;
import com.demoBank.swapPremium.normalization.model.RawRateQuote;
import com.demoBank.swapPremium.normalization.service.NormalizationService;
import com.demoBank.swapPremium.report.model.BandReport;
import com.demoBank.swapPremium.report.service.MarketReportService;
import com.demoBank.swapPremium.report.service.MarketShareTrendService;
import com.demoBank.swapPremium.report.service.PremiumStatisticsService;
import com.demoBank.swapPremium.session.model.AnalysisSession;
import com.demoBank.swapPremium.session.model.AnalysisView;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Owns the analysis workflow.
 *
 * Workflow steps:
 * OPEN: ENRICH -> AGGREGATE (full dataset) -> new session with an empty filter cache
 * VIEW: FILTER (cached) -> AGGREGATE -> BASELINE -> BAND REPORT -> LENDER SHARE -> HEATMAP -> TRENDS -> STATISTICS
 * RELOAD: ENRICH -> AGGREGATE -> replace session data -> INVALIDATE cache
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisOrchestrator {

    private final EnrichmentService enrichmentService;
    private final NormalizationService normalizationService;
    private final AggregationService aggregationService;
    private final LenderShareService lenderShareService;
    private final MarketReportService marketReportService;
    private final MarketShareTrendService marketShareTrendService;
    private final PremiumStatisticsService premiumStatisticsService;
    private final FilterPipeline filterPipeline;
    private final ObjectMapper objectMapper;
    private final AnalysisSettings settings;

    /**
     * Enriches the records and opens a session over them.
     *
     * @param quotes swap quotes with rates as decimal fractions
     */
    public AnalysisSession openSession(List<RawLoanRecord> rawRecords, List<RateQuote> quotes) {
        EnrichmentResult enrichment = enrichmentService.enrich(rawRecords, quotes);
        AggregationResult full = aggregationService.aggregate(enrichment.getRecords());
        FilterCache cache = new FilterCache(filterPipeline, objectMapper, settings.getFilterCacheMaximumSize());
        AnalysisSession session = new AnalysisSession(UUID.randomUUID().toString(), cache, enrichment, full);
        log.info("Opened analysis session - sessionId: {}, records: {}, matched: {}, market total: {}",
                session.getSessionId(), enrichment.getRecords().size(),
                enrichment.getStatistics().getMatchedRecords(), full.getGrandTotal());
        return session;
    }

    /**
     * As {@link #openSession(List, List)}, normalizing the swap quotes first.
     */
    public AnalysisSession openSessionFromRawQuotes(List<RawLoanRecord> rawRecords, List<RawRateQuote> rawQuotes) {
        return openSession(rawRecords, normalizationService.normalizeQuotes(rawQuotes));
    }

    /**
     * Builds the view for a filter selection.
     *
     * @param selectedBands bands for the lender share and trends; empty means every band in the view
     */
    public AnalysisView view(AnalysisSession session, FilterCriteria criteria, FilterFlags flags,
                             List<String> selectedBands) {
        long start = System.currentTimeMillis();

        List<EnrichedLoanRecord> filtered = session.getCachedFiltered(criteria, flags);
        AggregationResult filteredAggregation = aggregationService.aggregate(filtered);

        FilterFlags baselineFlags = FilterFlags.marketBaseline().intersect(flags);
        AggregationResult baseline = aggregationService.aggregate(session.getCachedFiltered(criteria, baselineFlags));

        boolean lenderSelectionActive = flags.isEnabled(FilterKey.LENDER) && !criteria.getLenders().isEmpty();
        BandReport bandReport = marketReportService.bandReport(filteredAggregation, baseline, lenderSelectionActive);

        List<EnrichedLoanRecord> marketView = session.getCachedFiltered(criteria, flags.without(FilterKey.LENDER));
        List<String> bands = selectedBands == null || selectedBands.isEmpty()
                ? aggregationService.aggregate(marketView).getPremiumBands()
                : selectedBands;
        LenderShareResult lenderShare = lenderShareService.lenderShare(marketView, bands);

        String startMonth = flags.isEnabled(FilterKey.DATE_RANGE) ? criteria.getStartMonth() : null;
        String endMonth = flags.isEnabled(FilterKey.DATE_RANGE) ? criteria.getEndMonth() : null;

        AnalysisView view = AnalysisView.builder()
                .criteria(criteria)
                .flags(flags)
                .filteredRecords(filtered)
                .filteredAggregation(filteredAggregation)
                .marketBaseline(baseline)
                .bandReport(bandReport)
                .lenderShare(lenderShare)
                .heatmap(marketReportService.heatmap(filtered))
                .trends(marketShareTrendService.trends(marketView, bands, startMonth, endMonth))
                .premiumStatistics(premiumStatisticsService.premiumStatistics(filtered))
                .build();

        log.debug("View built - sessionId: {}, filtered: {}, duration: {}ms",
                session.getSessionId(), filtered.size(), System.currentTimeMillis() - start);
        return view;
    }

    /**
     * Replaces the session's data with a fresh enrichment and invalidates its filter cache.
     */
    public AnalysisSession reload(AnalysisSession session, List<RawLoanRecord> rawRecords, List<RateQuote> quotes) {
        EnrichmentResult enrichment = enrichmentService.enrich(rawRecords, quotes);
        session.reload(enrichment, aggregationService.aggregate(enrichment.getRecords()));
        return session;
    }
}
