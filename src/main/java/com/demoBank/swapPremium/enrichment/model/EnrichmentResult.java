package com.demoBank.swapPremium.enrichment.model;

import lombok.Value;

import java.util.List;

@Value
public class EnrichmentResult {

    List<EnrichedLoanRecord> records;

    EnrichmentStatistics statistics;
}
