package com.jay.valuator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final output of one pipeline run. Always produced, even when valuation failed:
 * callers branch on {@code error}, {@code missingData} and the step statuses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ValuationReport {

    private String id;
    private String companyName;
    private ValuationRequest request;
    private EnrichedInput enrichedInput;
    private Map<String, Object> marketDataSummary;
    private BlendedValuation blendedValuation;
    private String narrative;

    // ── Failure surface ───────────────────────────────────────────────────────
    private String error;
    @Builder.Default private List<String> missingData = new ArrayList<>();

    // ── Audit trail ───────────────────────────────────────────────────────────
    @Builder.Default private List<PipelineStep> pipelineSteps = new ArrayList<>();
    @Builder.Default private List<LlmCallLog> llmCallLogs = new ArrayList<>();
    @Builder.Default private Map<String, Object> assumptions = new LinkedHashMap<>();

    private LocalDateTime createdAt;

    public double fairValue() {
        return blendedValuation != null ? blendedValuation.getFairValue() : 0;
    }
}
