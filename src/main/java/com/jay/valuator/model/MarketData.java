package com.jay.valuator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** Output of the fetch step: comparables plus optional index history for the last round. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MarketData {
    @Builder.Default
    private List<ComparableCompany> comparables = new ArrayList<>();
    private IndexData indexData;

    public static MarketData empty() {
        return new MarketData(new ArrayList<>(), null);
    }
}
