package com.demoBank.swapPremium.premium.service;

import com.demoBank.swapPremium.config.AnalysisSettings;
import com.demoBank.swapPremium.matching.model.RateQuote;
import com.demoBank.swapPremium.normalization.model.NormalizedLoanRecord;
import com.demoBank.swapPremium.premium.model.PremiumBand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Computes the spread between a disclosed initial rate and its matched swap rate, and bands it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PremiumCalculator {

    private static final double BPS_PER_UNIT = 10_000.0;

    private final AnalysisSettings settings;

    /**
     * Converts a raw disclosed rate to a decimal fraction.
     *
     * Lenders listed in the scaled-rate setting store low rates ten times too large and are
     * divided first. Otherwise values between the percentage bounds are percentages.
     * Anything else, including anomalously high values, is returned unchanged.
     */
    public double normalizeRate(NormalizedLoanRecord record) {
        double raw = record.getRawRate();
        if (isScaledRateLender(record) && raw < settings.getScaledRateThreshold()) {
            return raw / settings.getScaledRateDivisor();
        }
        if (raw > settings.getPercentageRateLowerBound() && raw < settings.getAnomalousRateThreshold()) {
            return raw / 100.0;
        }
        return raw;
    }

    public boolean isAnomalousRate(NormalizedLoanRecord record) {
        return record.getRawRate() >= settings.getAnomalousRateThreshold();
    }

    /**
     * Premium in basis points, rounded half-up, unclamped. Values beyond the int range saturate.
     *
     * @return null when {@code quote} is null
     */
    public Integer computePremium(NormalizedLoanRecord record, RateQuote quote) {
        if (quote == null) {
            return null;
        }
        if (isAnomalousRate(record)) {
            log.warn("Anomalous rate {} for lender '{}' on {} - used unchanged",
                    record.getRawRate(), record.getLenderName(), record.getDocumentDate());
        }
        double spread = normalizeRate(record) - quote.getRate();
        long bps = Math.round(spread * BPS_PER_UNIT);
        return Math.toIntExact(Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, bps)));
    }

    public int clamp(int bps) {
        return Math.max(settings.getMinPremiumBps(), Math.min(settings.getMaxPremiumBps(), bps));
    }

    /**
     * Band label for a premium, after clamping to the configured range.
     *
     * @return "{lower}-{lower+width}", or "Unknown" for a null premium
     */
    public String assignBand(Integer premiumBps) {
        if (premiumBps == null) {
            return PremiumBand.UNKNOWN_LABEL;
        }
        int width = settings.getBandWidthBps();
        int lower = Math.floorDiv(clamp(premiumBps), width) * width;
        return PremiumBand.of(lower, width).getLabel();
    }

    private boolean isScaledRateLender(NormalizedLoanRecord record) {
        return settings.getScaledRateLenders().contains(record.getLenderName())
                || settings.getScaledRateLenders().contains(record.getProviderName());
    }
}
