package com.jay.valuator.layer5_report;

import com.jay.valuator.model.BlendedValuation;
import com.jay.valuator.model.LlmCallLog;
import com.jay.valuator.model.ValuationRequest;

import java.util.List;
import java.util.Map;

/** Writes the auditor-facing prose summary of a blended valuation. */
public interface NarrativeWriter {

    String write(ValuationRequest request, BlendedValuation blended,
                 Map<String, Object> assumptions, List<LlmCallLog> callLog);
}
