package com.demoBank.swapPremium.support;

import com.demoBank.swapPremium.enrichment.model.EnrichedLoanRecord;
import com.demoBank.swapPremium.matching.model.RateQuote;
import com.demoBank.swapPremium.normalization.model.NormalizedLoanRecord;
import com.demoBank.swapPremium.normalization.model.RawLoanRecord;
import com.demoBank.swapPremium.premium.model.PremiumBand;

import java.time.LocalDate;

/**
 * Builders for records used across tests.
 */
public final class RecordFixtures {

    private RecordFixtures() {}

    public static NormalizedLoanRecord normalized(String lender, LocalDate date, Integer term, double rawRate, double loan) {
        return NormalizedLoanRecord.builder()
                .documentDate(date)
                .lenderName(lender)
                .providerName(lender)
                .rawRate(rawRate)
                .loanAmount(loan)
                .normalizedTerm(term)
                .productType("Fixed")
                .purchaseType("Remortgage")
                .build();
    }

    /**
     * Enriched record in {@code band} for {@code month}; premium is the band's lower bound.
     */
    public static EnrichedLoanRecord enriched(String lender, String band, String month, double loan, Double ltv) {
        LocalDate date = LocalDate.parse(month + "-15");
        NormalizedLoanRecord record = normalized(lender, date, 24, 4.5, loan).toBuilder().ltv(ltv).build();
        Integer premium = PremiumBand.parse(band).map(PremiumBand::getLower).orElse(null);
        return EnrichedLoanRecord.builder()
                .record(record)
                .matchedQuote(premium == null ? null : RateQuote.of(24, date, 0.04))
                .premiumBps(premium)
                .premiumBand(band)
                .month(month)
                .build();
    }

    public static EnrichedLoanRecord enriched(String lender, String band, String month, double loan) {
        return enriched(lender, band, month, loan, null);
    }

    public static RawLoanRecord raw(String id, String provider, String documentDate, String rate, String loan, String term) {
        return RawLoanRecord.builder()
                .id(id)
                .provider(provider)
                .documentDate(documentDate)
                .initialRate(rate)
                .loan(loan)
                .tieInPeriod(term)
                .productType("Fixed")
                .purchaseType("Remortgage")
                .build();
    }
}
