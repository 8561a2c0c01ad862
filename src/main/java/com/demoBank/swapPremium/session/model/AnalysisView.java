package com.demoBank.swapPremium.session.model;

import com.demoBank.swapPremium.aggregation.model.AggregationResult;
import com.demoBank.swapPremium.aggregation.model.LenderShareResult;
import com.demoBank.swapPremium.enrichment.model.EnrichedLoanRecord;
import com.demoBank.swapPremium.filter.model.FilterCriteria;
import com.demoBank.swapPremium.filter.model.FilterFlags;
import com.demoBank.swapPremium.report.model.BandReport;
import com.demoBank.swapPremium.report.model.HeatmapMatrix;
import com.demoBank.swapPremium.report.model.MarketShareTrend;
import com.demoBank.swapPremium.report.model.PremiumStatistics;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything rendered for one filter selection.
 */
@Value
@Builder
public class AnalysisView {

    FilterCriteria criteria;

    FilterFlags flags;

    List<EnrichedLoanRecord> filteredRecords;

    AggregationResult filteredAggregation;

    /**
     * Volume of the market under the same date, product and purchase criteria, any lender.
     */
    AggregationResult marketBaseline;

    BandReport bandReport;

    /**
     * Shares computed over the view with the lender criterion switched off.
     */
    LenderShareResult lenderShare;

    HeatmapMatrix heatmap;

    MarketShareTrend trends;

    PremiumStatistics premiumStatistics;
}
