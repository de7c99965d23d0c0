package com.jay.valuator.layer1_data;

import com.jay.valuator.model.ComparableCompany;
import com.jay.valuator.model.IndexData;

import java.util.List;

/** Public market data for comparables and the benchmark index. */
public interface MarketDataProvider {

    /** One snapshot per ticker that could be resolved; unknown tickers are omitted. */
    List<ComparableCompany> fetchComparables(List<String> tickers);

    /** Index return from {@code sinceDate} (YYYY-MM-DD) to today, or null when unavailable. */
    IndexData fetchIndexReturn(String indexTicker, String sinceDate);
}
