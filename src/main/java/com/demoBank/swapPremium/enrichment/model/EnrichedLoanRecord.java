package com.demoBank.swapPremium.enrichment.model;

import com.demoBank.swapPremium.matching.model.RateQuote;
import com.demoBank.swapPremium.normalization.model.NormalizedLoanRecord;
import com.demoBank.swapPremium.premium.model.PremiumBand;
import lombok.Builder;
import lombok.Value;

/**
 * Normalized record with its matched swap quote, premium and band.
 *
 * Unmatched records keep a null quote and premium and the "Unknown" band.
 */
@Value
@Builder(toBuilder = true)
public class EnrichedLoanRecord {

    NormalizedLoanRecord record;

    RateQuote matchedQuote;

    Integer premiumBps;

    @Builder.Default
    String premiumBand = PremiumBand.UNKNOWN_LABEL;

    /**
     * YYYY-MM of the document date.
     */
    String month;

    public boolean isMatched() {
        return matchedQuote != null;
    }

    public boolean hasKnownBand() {
        return premiumBand != null && !PremiumBand.UNKNOWN_LABEL.equals(premiumBand);
    }

    public String getLenderName() {
        return record.getLenderName();
    }

    public String getProviderName() {
        return record.getProviderName();
    }

    public double getLoanAmount() {
        return record.getLoanAmount();
    }

    public Double getLtv() {
        return record.getLtv();
    }

    public String getProductType() {
        return record.getProductType();
    }

    public String getPurchaseType() {
        return record.getPurchaseType();
    }

    public Integer getNormalizedTerm() {
        return record.getNormalizedTerm();
    }
}
