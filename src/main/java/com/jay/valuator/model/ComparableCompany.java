package com.jay.valuator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/** Snapshot of one public comparable, fetched once per run. Ticker is the key. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ComparableCompany {
    private String ticker;
    private String name;
    private String sector;

    // Financials (USD); null when the provider had no value
    private Double marketCap;
    private Double enterpriseValue;
    private Double revenue;
    private Double ebitda;

    // Derived multiples
    private Double evToRevenue;
    private Double evToEbitda;

    private String dataSource;       // yahoo / mock
    private String dataSourceUrl;
    private LocalDateTime fetchedAt;
}
