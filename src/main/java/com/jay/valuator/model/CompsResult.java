package com.jay.valuator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.jay.valuator.model.enums.ValuationMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompsResult implements ValuationResult {

    private double enterpriseValue;

    // ── Multiples ─────────────────────────────────────────────────────────────
    private double evToRevenueMedian;
    private double evToRevenueMean;
    private Double evToEbitdaMedian;    // null when no comp had a positive EV/EBITDA
    private Double evToEbitdaMean;

    private int comparableCount;
    @Builder.Default private List<String> compsUsed = new ArrayList<>();

    // ── Selection audit ───────────────────────────────────────────────────────
    @Builder.Default private List<CompSelectionScore> selectionScores = new ArrayList<>();
    @Builder.Default private Map<String, Object> selectionCriteria = new LinkedHashMap<>();

    @Builder.Default private List<String> warnings = new ArrayList<>();
    private boolean estimated;

    @Override
    @JsonIgnore
    public ValuationMethod method() {
        return ValuationMethod.COMPS;
    }
}
