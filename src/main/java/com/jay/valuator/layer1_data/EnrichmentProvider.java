package com.jay.valuator.layer1_data;

import com.jay.valuator.model.EnrichedInput;
import com.jay.valuator.model.LlmCallLog;
import com.jay.valuator.model.ValuationRequest;

import java.util.List;

/**
 * Turns a raw request into sector context, comparable tickers, applicable methods
 * and estimates for whatever the caller left out.
 */
public interface EnrichmentProvider {

    /**
     * @param callLog receives one entry per language-model call made for this run
     * @throws AcquisitionException when the research service is unreachable or unusable
     */
    EnrichedInput enrich(ValuationRequest request, List<LlmCallLog> callLog);
}
