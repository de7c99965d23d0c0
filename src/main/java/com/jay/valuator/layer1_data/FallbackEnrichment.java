package com.jay.valuator.layer1_data;

import com.jay.valuator.model.EnrichedInput;
import com.jay.valuator.model.ValuationRequest;
import com.jay.valuator.model.enums.ValuationMethod;

import java.util.ArrayList;
import java.util.List;

/** Enrichment built from the raw request alone, used when research is unavailable. */
public final class FallbackEnrichment {

    public static final String NOTES = "Fallback: research enrichment unavailable, using raw inputs";

    private FallbackEnrichment() {}

    public static EnrichedInput from(ValuationRequest request) {
        List<ValuationMethod> methods = new ArrayList<>();
        if (request.getRevenue() != null && request.getRevenue() > 0) {
            methods.add(ValuationMethod.COMPS);
        }
        if (request.getFinancialProjections() != null) {
            methods.add(ValuationMethod.DCF);
        }
        if (request.getLastRoundValuation() != null && request.getLastRoundDate() != null) {
            methods.add(ValuationMethod.LAST_ROUND);
        }
        if (methods.isEmpty()) {
            methods.add(ValuationMethod.COMPS);
        }

        return EnrichedInput.builder()
            .sector(request.getSector() != null ? request.getSector() : "Unknown")
            .comparableTickers(request.getComparableTickers() != null
                ? new ArrayList<>(request.getComparableTickers()) : new ArrayList<>())
            .applicableMethods(methods)
            .enrichmentNotes(NOTES)
            .fallback(true)
            .build();
    }
}
