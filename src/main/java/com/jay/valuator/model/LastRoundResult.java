package com.jay.valuator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.jay.valuator.model.enums.ValuationMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LastRoundResult implements ValuationResult {

    private double enterpriseValue;
    private double lastRoundValuation;
    private Double indexReturn;          // null when no index data was available
    @Builder.Default private double adjustmentFactor = 1.0;
    private Integer monthsSinceRound;    // null when the round date could not be parsed

    @Builder.Default private List<String> warnings = new ArrayList<>();
    private boolean estimated;

    @Override
    @JsonIgnore
    public ValuationMethod method() {
        return ValuationMethod.LAST_ROUND;
    }
}
