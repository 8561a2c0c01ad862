package com.demoBank.swapPremium.normalization.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Swap rate row as delivered by the ingestion collaborator.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawRateQuote {

    @JsonProperty("product_term_in_months")
    @JsonAlias("TieInPeriod")
    private String term;

    @JsonProperty("effective_at")
    @JsonAlias("Date")
    private String effectiveDate;

    /**
     * Decimal fraction, e.g. "0.015" for 1.5%.
     */
    @JsonProperty("rate")
    @JsonAlias("Rate")
    private String rate;
}
