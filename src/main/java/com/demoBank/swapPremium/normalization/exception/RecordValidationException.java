package com.demoBank.swapPremium.normalization.exception;

/**
 * Exception thrown when a single disclosure record cannot be normalized.
 * Recovered per record; never aborts a batch.
 */
public class RecordValidationException extends RuntimeException {

    public RecordValidationException(String message) {
        super(message);
    }
}
