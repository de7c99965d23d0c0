package com.jay.valuator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One scoring record per candidate comparable, included or not. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompSelectionScore {
    private String ticker;
    private String name;

    // Each 0.0 - 1.0, rounded to 2dp
    private double sectorScore;
    private double sizeScore;
    private double qualityScore;
    private double compositeScore;

    private boolean included;
    private String exclusionReason;     // null when included
}
