package com.jay.valuator.layer3_engine;

import lombok.Getter;

import java.util.List;

/**
 * No valuation method could run, or every method that ran produced zero value.
 * Carries the human-readable prerequisites that were missing.
 */
@Getter
public class InsufficientDataException extends RuntimeException {

    private final List<String> missingFields;

    public InsufficientDataException(String message, List<String> missingFields) {
        super(message);
        this.missingFields = List.copyOf(missingFields);
    }
}
