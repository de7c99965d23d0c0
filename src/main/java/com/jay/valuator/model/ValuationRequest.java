package com.jay.valuator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Caller input for one valuation run. Only the company name is mandatory;
 * everything else is filled from enrichment when missing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ValuationRequest {

    @NotBlank
    private String companyName;
    private String description;
    private String sector;

    @PositiveOrZero private Double revenue;
    private Double ebitda;

    @Builder.Default
    private List<String> comparableTickers = new ArrayList<>();

    @Valid
    private FinancialProjections financialProjections;

    @PositiveOrZero private Double lastRoundValuation;
    private String lastRoundDate;    // YYYY-MM-DD

    @Builder.Default
    private String indexTicker = "^IXIC";
}
