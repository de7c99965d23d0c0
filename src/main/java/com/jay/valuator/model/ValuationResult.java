package com.jay.valuator.model;

import com.jay.valuator.model.enums.ValuationMethod;

import java.util.List;

/**
 * Common read surface of the three method results.
 * An enterprise value of 0 means the method did not produce a usable estimate.
 */
public interface ValuationResult {

    ValuationMethod method();

    double getEnterpriseValue();

    /** Mutable; consistency checks append to it after the method ran. */
    List<String> getWarnings();

    /** True when the method ran on research-estimated inputs rather than caller-supplied ones. */
    boolean isEstimated();

    default boolean hasValue() {
        return getEnterpriseValue() > 0;
    }
}
