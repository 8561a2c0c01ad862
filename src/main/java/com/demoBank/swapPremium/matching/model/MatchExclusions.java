package com.demoBank.swapPremium.matching.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Running tally of records that found no applicable swap quote.
 *
 * One instance per enrichment batch; never shared between sessions.
 */
public class MatchExclusions {

    private int excludedRecords;
    private double excludedLoanAmount;
    private final TreeMap<String, Integer> missesByMonth = new TreeMap<>();

    public void record(String month, double loanAmount) {
        excludedRecords++;
        excludedLoanAmount += loanAmount;
        if (month != null) {
            missesByMonth.merge(month, 1, Integer::sum);
        }
    }

    public int getExcludedRecords() {
        return excludedRecords;
    }

    public double getExcludedLoanAmount() {
        return excludedLoanAmount;
    }

    /**
     * Miss counts keyed by the document date's month (YYYY-MM), in month order.
     */
    public Map<String, Integer> getMissesByMonth() {
        return Collections.unmodifiableMap(missesByMonth);
    }
}
