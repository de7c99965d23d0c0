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
public class DcfResult implements ValuationResult {

    private double enterpriseValue;
    @Builder.Default private List<Double> projectedFcfs = new ArrayList<>();
    private double terminalValue;
    private double discountRate;
    private double terminalGrowthRate;
    @Builder.Default private List<SensitivityCell> sensitivityTable = new ArrayList<>();

    @Builder.Default private List<String> warnings = new ArrayList<>();
    private boolean estimated;

    @Override
    @JsonIgnore
    public ValuationMethod method() {
        return ValuationMethod.DCF;
    }

    @JsonIgnore
    public int getProjectionYears() {
        return projectedFcfs == null ? 0 : projectedFcfs.size();
    }
}
