package com.demoBank.swapPremium.normalization.service;

import com.demoBank.swapPremium.config.AnalysisSettings;
import com.demoBank.swapPremium.matching.model.RateQuote;
import com.demoBank.swapPremium.normalization.exception.RecordValidationException;
import com.demoBank.swapPremium.normalization.model.LtvSummary;
import com.demoBank.swapPremium.normalization.model.NormalizationResult;
import com.demoBank.swapPremium.normalization.model.NormalizedLoanRecord;
import com.demoBank.swapPremium.normalization.model.RawLoanRecord;
import com.demoBank.swapPremium.normalization.model.RawRateQuote;
import com.demoBank.swapPremium.normalization.util.SourceValueParser;
import com.demoBank.swapPremium.normalization.util.TermNormalizer;
import com.demoBank.swapPremium.util.Outcome;
import com.demoBank.swapPremium.util.Recovery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Service for normalizing raw disclosure records and swap quotes to canonical internal models.
 *
 * Per-record problems are defaulted or the single record is dropped; a batch is never aborted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NormalizationService {

    private static final double LTV_THRESHOLD = 80.0;

    private final AnalysisSettings settings;

    /**
     * Normalizes a batch of disclosure records.
     *
     * Drops duplicates, Right to Buy products (when configured) and records that fail
     * validation, and summarizes LTV coverage.
     *
     * @param rawRecords records from the ingestion collaborator
     * @return surviving records with drop counts
     */
    public NormalizationResult normalizeAll(List<RawLoanRecord> rawRecords) {
        List<RawLoanRecord> input = rawRecords == null ? List.of() : rawRecords;
        log.debug("Step NORMALIZE - records: {}", input.size());

        Function<RawLoanRecord, Outcome<NormalizedLoanRecord>> normalizer =
                Recovery.withRecovery(this::normalize, Recovery.Policy.DROP, "normalize");

        NormalizationResult.NormalizationResultBuilder result = NormalizationResult.builder()
                .inputCount(input.size());
        Set<String> seenKeys = new HashSet<>();
        List<NormalizedLoanRecord> kept = new ArrayList<>();
        int duplicates = 0;
        int rightToBuy = 0;
        int invalid = 0;

        for (RawLoanRecord raw : input) {
            if (raw != null && !seenKeys.add(deduplicationKey(raw))) {
                duplicates++;
                continue;
            }
            if (raw != null && settings.isExcludeRightToBuy() && isRightToBuy(raw)) {
                rightToBuy++;
                continue;
            }

            Outcome<NormalizedLoanRecord> outcome = normalizer.apply(raw);
            if (outcome.isFailure()) {
                invalid++;
                continue;
            }
            kept.add(outcome.getValue());
        }

        LtvSummary ltvSummary = summarizeLtv(kept);
        log.info("Normalization completed - input: {}, kept: {}, duplicates: {}, right to buy: {}, invalid: {}",
                input.size(), kept.size(), duplicates, rightToBuy, invalid);
        logLtvSummary(ltvSummary);

        return result
                .records(kept)
                .duplicatesDropped(duplicates)
                .rightToBuyExcluded(rightToBuy)
                .invalidDropped(invalid)
                .ltvSummary(ltvSummary)
                .build();
    }

    /**
     * Normalizes a single disclosure record.
     *
     * @throws RecordValidationException when the record is null or carries a negative loan amount
     */
    public NormalizedLoanRecord normalize(RawLoanRecord raw) {
        if (raw == null) {
            throw new RecordValidationException("Disclosure record is null");
        }

        double loanAmount = SourceValueParser.parseNumber(raw.getLoan()).orElse(0.0);
        if (loanAmount < 0) {
            throw new RecordValidationException("Negative loan amount " + raw.getLoan()
                    + " for provider '" + SourceValueParser.trimToEmpty(raw.getProvider()) + "'");
        }

        String rateText = !SourceValueParser.isBlank(raw.getRate()) ? raw.getRate() : raw.getInitialRate();
        double rawRate = SourceValueParser.parseNumber(rateText).orElse(0.0);

        String productType = !SourceValueParser.isBlank(raw.getProductType())
                ? raw.getProductType().trim()
                : SourceValueParser.trimToEmpty(raw.getMortgageType());

        return NormalizedLoanRecord.builder()
                .documentDate(resolveDocumentDate(raw))
                .lenderName(resolveLenderName(raw))
                .providerName(SourceValueParser.trimToEmpty(raw.getProvider()))
                .rawRate(rawRate)
                .loanAmount(loanAmount)
                .ltv(normalizeLtv(raw))
                .normalizedTerm(TermNormalizer.normalizeTerm(raw.getTieInPeriod()))
                .productType(productType)
                .purchaseType(resolvePurchaseType(raw))
                .build();
    }

    /**
     * Normalizes raw swap quotes, dropping any with a missing or unparseable term, date or rate.
     */
    public List<RateQuote> normalizeQuotes(List<RawRateQuote> rawQuotes) {
        if (rawQuotes == null) {
            return List.of();
        }
        List<RateQuote> quotes = new ArrayList<>(rawQuotes.size());
        int dropped = 0;
        for (RawRateQuote raw : rawQuotes) {
            if (raw == null) {
                dropped++;
                continue;
            }
            Integer term = TermNormalizer.toMonths(raw.getTerm());
            Optional<LocalDate> date = SourceValueParser.parseDate(raw.getEffectiveDate());
            Optional<Double> rate = SourceValueParser.parseNumber(raw.getRate());
            if (term == null || date.isEmpty() || rate.isEmpty()) {
                dropped++;
                continue;
            }
            quotes.add(RateQuote.of(term, date.get(), rate.get()));
        }
        if (dropped > 0) {
            log.warn("Dropped {} invalid swap quotes out of {}", dropped, rawQuotes.size());
        }
        log.info("Swap quotes normalized - kept: {}", quotes.size());
        return quotes;
    }

    /**
     * Base lender when present, otherwise provider, trimmed; empty when neither is present.
     */
    public String resolveLenderName(RawLoanRecord raw) {
        if (!SourceValueParser.isBlank(raw.getBaseLender())) {
            return raw.getBaseLender().trim();
        }
        return SourceValueParser.trimToEmpty(raw.getProvider());
    }

    /**
     * LTV as a percentage. Values in (0, 1) are fractions and are scaled by 100.
     *
     * @return the percentage, or null when no LTV field is usable
     */
    public Double normalizeLtv(RawLoanRecord raw) {
        String text = !SourceValueParser.isBlank(raw.getLtv()) ? raw.getLtv() : raw.getLoanToValue();
        Optional<Double> parsed = SourceValueParser.parseNumber(text);
        if (parsed.isEmpty()) {
            return null;
        }
        double ltv = parsed.get();
        if (ltv > 0 && ltv < 1) {
            ltv = ltv * 100;
        }
        return ltv;
    }

    private LocalDate resolveDocumentDate(RawLoanRecord raw) {
        Optional<LocalDate> date = SourceValueParser.parseDate(raw.getDocumentDate());
        if (date.isEmpty()) {
            date = SourceValueParser.parseDate(raw.getTimestamp());
        }
        if (date.isEmpty()) {
            log.debug("Missing or invalid document date '{}' for provider '{}' - using default {}",
                    raw.getDocumentDate(), raw.getProvider(), settings.getDefaultDocumentDate());
            return settings.getDefaultDocumentDate();
        }
        return date.get();
    }

    private String resolvePurchaseType(RawLoanRecord raw) {
        if (!SourceValueParser.isBlank(raw.getPurchaseType())) {
            return raw.getPurchaseType().trim();
        }
        if (SourceValueParser.isAffirmative(raw.getFirstTimeBuyer())) {
            return "First Time Buyer";
        }
        if (SourceValueParser.isAffirmative(raw.getHomeMover())) {
            return "Home mover";
        }
        if (SourceValueParser.isAffirmative(raw.getRemortgage())) {
            return "Remortgage";
        }
        if (mentionsRightToBuy(raw.getProductType()) || mentionsRightToBuy(raw.getMortgageType())
                || mentionsRightToBuy(raw.getDescription())) {
            return "Right to buy";
        }
        return "Unknown";
    }

    /**
     * True when product type, purchase type or description mention Right to Buy.
     */
    public boolean isRightToBuy(RawLoanRecord raw) {
        return mentionsRightToBuy(raw.getProductType())
                || mentionsRightToBuy(raw.getMortgageType())
                || mentionsRightToBuy(raw.getPurchaseType())
                || mentionsRightToBuy(raw.getDescription());
    }

    private static boolean mentionsRightToBuy(String text) {
        if (text == null) {
            return false;
        }
        String value = text.toLowerCase(Locale.ROOT);
        return value.contains("right to buy") || value.contains("rtb");
    }

    private static String deduplicationKey(RawLoanRecord raw) {
        if (!SourceValueParser.isBlank(raw.getId())) {
            return "id:" + raw.getId().trim();
        }
        return raw.getProvider() + "-" + raw.getDocumentDate() + "-" + raw.getLoan();
    }

    private static LtvSummary summarizeLtv(List<NormalizedLoanRecord> records) {
        int withLtv = 0;
        int below = 0;
        double sum = 0;
        for (NormalizedLoanRecord record : records) {
            if (!record.hasLtv()) {
                continue;
            }
            withLtv++;
            sum += record.getLtv();
            if (record.getLtv() < LTV_THRESHOLD) {
                below++;
            }
        }
        return LtvSummary.builder()
                .recordsWithLtv(withLtv)
                .recordsMissingLtv(records.size() - withLtv)
                .averageLtv(withLtv == 0 ? null : sum / withLtv)
                .below80Count(below)
                .atOrAbove80Count(withLtv - below)
                .build();
    }

    private static void logLtvSummary(LtvSummary summary) {
        if (summary.getRecordsWithLtv() == 0) {
            log.warn("No LTV data found in the dataset - check field names or data quality");
            return;
        }
        log.info("LTV coverage - with LTV: {}, missing: {}, average: {}%, below 80%: {}%, 80% and above: {}%",
                summary.getRecordsWithLtv(),
                summary.getRecordsMissingLtv(),
                String.format(Locale.ROOT, "%.2f", summary.getAverageLtv()),
                String.format(Locale.ROOT, "%.2f", summary.below80Percent()),
                String.format(Locale.ROOT, "%.2f", summary.atOrAbove80Percent()));
    }
}
