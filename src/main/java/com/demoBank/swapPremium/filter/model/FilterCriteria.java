package com.demoBank.swapPremium.filter.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * User selection for a filtered view. Null bounds and empty sets mean "no restriction".
 */
@Value
@Builder(toBuilder = true)
public class FilterCriteria {

    /**
     * First month included, YYYY-MM.
     */
    String startMonth;

    /**
     * Last month included, YYYY-MM.
     */
    String endMonth;

    /**
     * Matched against lender name and provider alias.
     */
    @Singular
    Set<String> lenders;

    Integer minPremiumBps;

    Integer maxPremiumBps;

    @Singular
    Set<String> productTypes;

    @Singular
    Set<String> purchaseTypes;

    @Builder.Default
    LtvBucket ltvBucket = LtvBucket.ALL;

    /**
     * 24 or 60; null for both.
     */
    Integer normalizedTerm;

    public static FilterCriteria none() {
        return FilterCriteria.builder().build();
    }
}
