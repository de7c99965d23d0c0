package com.jay.valuator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Multi-year operating projections for the DCF method.
 * WACC and terminal growth are independent inputs; the DCF engine checks WACC > g itself.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FinancialProjections {

    @Builder.Default
    private List<Double> revenueProjections = new ArrayList<>();
    @Builder.Default
    private List<Double> ebitdaMargins = new ArrayList<>();   // padded with the last value

    @Builder.Default private double capexPercent = 0.05;
    @Builder.Default private double nwcChangePercent = 0.02;
    @Builder.Default private double taxRate = 0.25;
    @Builder.Default private double wacc = 0.12;
    @Builder.Default private double terminalGrowthRate = 0.03;
    @Builder.Default private double depreciationPercent = 0.0;

    /** Copy with a different discount rate and terminal growth; used for sensitivity cells. */
    public FinancialProjections withRates(double newWacc, double newGrowth) {
        return toBuilder()
            .wacc(newWacc)
            .terminalGrowthRate(newGrowth)
            .build();
    }
}
