package com.demoBank.swapPremium.filter.model;

/**
 * Independent filter criteria, in the order the pipeline evaluates them.
 */
public enum FilterKey {
    DATE_RANGE,
    LENDER,
    PREMIUM_RANGE,
    PRODUCT_TYPE,
    PURCHASE_TYPE,
    LTV_BUCKET,
    TERM
}
