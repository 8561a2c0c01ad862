package com.demoBank.swapPremium.normalization.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Output of a batch normalization: surviving records plus what was dropped and why.
 */
@Value
@Builder
public class NormalizationResult {

    @Singular
    List<NormalizedLoanRecord> records;

    int inputCount;

    int duplicatesDropped;

    int rightToBuyExcluded;

    int invalidDropped;

    LtvSummary ltvSummary;
}
