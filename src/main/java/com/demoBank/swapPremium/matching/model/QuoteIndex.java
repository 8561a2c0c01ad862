package com.demoBank.swapPremium.matching.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Swap quotes grouped by term, each group sorted ascending by effective date.
 *
 * Built once per session so that matching a record is a map lookup plus a binary search.
 */
public final class QuoteIndex {

    private final TreeMap<Integer, List<RateQuote>> quotesByTerm;
    private final int size;

    private QuoteIndex(TreeMap<Integer, List<RateQuote>> quotesByTerm, int size) {
        this.quotesByTerm = quotesByTerm;
        this.size = size;
    }

    public static QuoteIndex of(List<RateQuote> quotes) {
        TreeMap<Integer, List<RateQuote>> byTerm = new TreeMap<>();
        int size = 0;
        if (quotes != null) {
            for (RateQuote quote : quotes) {
                if (quote == null || quote.getEffectiveDate() == null) {
                    continue;
                }
                byTerm.computeIfAbsent(quote.getTermMonths(), t -> new ArrayList<>()).add(quote);
                size++;
            }
        }
        for (Map.Entry<Integer, List<RateQuote>> entry : byTerm.entrySet()) {
            List<RateQuote> sorted = new ArrayList<>(entry.getValue());
            sorted.sort(Comparator.comparing(RateQuote::getEffectiveDate));
            entry.setValue(Collections.unmodifiableList(sorted));
        }
        return new QuoteIndex(byTerm, size);
    }

    public int size() {
        return size;
    }

    public List<Integer> terms() {
        return List.copyOf(quotesByTerm.keySet());
    }

    /**
     * Quotes for {@code term}, or for the nearest available term when there are none.
     * Equidistant terms resolve to the smaller one.
     *
     * @return date-sorted quotes, empty only when the index is empty
     */
    public List<RateQuote> candidatesFor(int term) {
        List<RateQuote> exact = quotesByTerm.get(term);
        if (exact != null) {
            return exact;
        }
        Integer nearest = nearestTerm(term);
        return nearest == null ? List.of() : quotesByTerm.get(nearest);
    }

    /**
     * Closest available term to {@code term}; ties go to the smaller term.
     */
    public Integer nearestTerm(int term) {
        Integer best = null;
        int bestDistance = Integer.MAX_VALUE;
        // ascending iteration keeps the smaller term on ties
        for (Integer candidate : quotesByTerm.keySet()) {
            int distance = Math.abs(candidate - term);
            if (distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return best;
    }
}
