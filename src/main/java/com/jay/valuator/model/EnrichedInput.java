package com.jay.valuator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.jay.valuator.model.enums.ValuationMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of the enrich step. Carries the sector context, the tickers to fetch,
 * which methods apply, and any values the research step had to estimate.
 * Estimates are tagged with a confidence level and the reasoning behind them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EnrichedInput {

    private String sector;
    private String subSector;

    @Builder.Default
    private List<String> comparableTickers = new ArrayList<>();
    @Builder.Default
    private List<ValuationMethod> applicableMethods = new ArrayList<>();

    private EstimatedFinancials estimatedFinancials;
    private EstimatedProjections estimatedProjections;
    private EstimatedLastRound estimatedLastRound;

    @Builder.Default
    private List<ResearchSource> researchSources = new ArrayList<>();
    private String enrichmentNotes;

    /** True when the research collaborator was unavailable and raw inputs were used. */
    private boolean fallback;

    public boolean isApplicable(ValuationMethod method) {
        return applicableMethods != null && applicableMethods.contains(method);
    }

    // ── Estimates ─────────────────────────────────────────────────────────────

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EstimatedFinancials {
        private Double estimatedRevenue;
        private Double estimatedEbitda;
        private String revenueSource;
        @Builder.Default private String confidence = "low";
        private String reasoning;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EstimatedProjections {
        @Builder.Default private List<Double> estimatedGrowthRates = new ArrayList<>();
        @Builder.Default private List<Double> estimatedEbitdaMargins = new ArrayList<>();
        @Builder.Default private double estimatedWacc = 0.12;
        @Builder.Default private double estimatedTerminalGrowthRate = 0.03;
        private String source;
        @Builder.Default private String confidence = "low";
        private String reasoning;

        public boolean hasGrowthRates() {
            return estimatedGrowthRates != null && !estimatedGrowthRates.isEmpty();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EstimatedLastRound {
        private double estimatedValuation;
        private String estimatedDate;       // YYYY-MM-DD
        private String source;
        @Builder.Default private String confidence = "low";
        private String reasoning;
    }

    public record ResearchSource(String title, String url) {}
}
