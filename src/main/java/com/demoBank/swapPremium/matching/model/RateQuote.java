package com.demoBank.swapPremium.matching.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Benchmark swap rate quote.
 */
@Value
@Builder
public class RateQuote {

    int termMonths;

    LocalDate effectiveDate;

    /**
     * Decimal fraction, e.g. 0.015 for 1.5%.
     */
    double rate;

    public static RateQuote of(int termMonths, LocalDate effectiveDate, double rate) {
        return new RateQuote(termMonths, effectiveDate, rate);
    }
}
