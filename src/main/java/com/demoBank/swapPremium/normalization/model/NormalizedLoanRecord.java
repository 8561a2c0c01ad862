package com.demoBank.swapPremium.normalization.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Canonical disclosure record.
 */
@Value
@Builder(toBuilder = true)
public class NormalizedLoanRecord {

    /**
     * Parsed document date, or the configured default when the source had none.
     */
    LocalDate documentDate;

    /**
     * Base lender, else provider, trimmed. Empty when neither was present.
     */
    String lenderName;

    /**
     * Provider as given by the source, trimmed. May differ from {@link #lenderName}.
     */
    String providerName;

    /**
     * Initial rate as found in the source (percentage or fraction), 0 when missing.
     */
    double rawRate;

    /**
     * Loan amount in pounds, 0 when missing.
     */
    double loanAmount;

    /**
     * Loan-to-value as a percentage, null when the source had no usable value.
     */
    Double ltv;

    /**
     * 24, 60 or null for non-standard terms.
     */
    Integer normalizedTerm;

    String productType;

    String purchaseType;

    public String getMonth() {
        return documentDate == null ? null : YearMonth.from(documentDate).toString();
    }

    public boolean hasLtv() {
        return ltv != null;
    }
}
