package com.demoBank.swapPremium.enrichment.exception;

/**
 * Thrown when an analysis session is started without disclosure records or without swap quotes.
 */
public class EmptyInputException extends RuntimeException {

    public EmptyInputException(String message) {
        super(message);
    }
}
