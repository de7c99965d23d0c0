package com.jay.valuator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Weighted consensus of the method results. A fair value of 0 with no weights
 * means nothing contributed; callers check for it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BlendedValuation {

    private double fairValue;
    private double fairValueLow;
    private double fairValueHigh;

    @Builder.Default
    private List<MethodologyWeight> methodologyWeights = new ArrayList<>();

    // Underlying results, null when that method did not run
    private CompsResult compsResult;
    private DcfResult dcfResult;
    private LastRoundResult lastRoundResult;
}
