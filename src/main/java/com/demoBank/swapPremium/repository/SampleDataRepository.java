package com.demoBank.swapPremium.repository;

import com.demoBank.swapPremium.normalization.model.RawLoanRecord;
import com.demoBank.swapPremium.normalization.model.RawRateQuote;
import com.demoBank.swapPremium.util.JsonFileLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Disclosure records and swap quotes read from JSON files in the classpath.
 *
 * Stands in for the ingestion collaborator in demos and tests.
 */
@Repository
public class SampleDataRepository {

    private static final Logger log = LoggerFactory.getLogger(SampleDataRepository.class);

    private final String disclosuresPath;
    private final String swapRatesPath;

    public SampleDataRepository(
            @Value("${analysis.sample-data.disclosures:data/sample-disclosures.json}") String disclosuresPath,
            @Value("${analysis.sample-data.swap-rates:data/sample-swap-rates.json}") String swapRatesPath) {
        this.disclosuresPath = disclosuresPath;
        this.swapRatesPath = swapRatesPath;
    }

    /**
     * @return the disclosure records, or an empty list when the file is missing or malformed
     */
    public List<RawLoanRecord> findAllDisclosures() {
        List<RawLoanRecord> records = JsonFileLoader.loadAsListOrEmpty(disclosuresPath, RawLoanRecord.class);
        log.debug("Loaded {} disclosure records from {}", records.size(), disclosuresPath);
        return records;
    }

    /**
     * @return the raw swap quotes, or an empty list when the file is missing or malformed
     */
    public List<RawRateQuote> findAllSwapRates() {
        List<RawRateQuote> quotes = JsonFileLoader.loadAsListOrEmpty(swapRatesPath, RawRateQuote.class);
        log.debug("Loaded {} swap quotes from {}", quotes.size(), swapRatesPath);
        return quotes;
    }
}
