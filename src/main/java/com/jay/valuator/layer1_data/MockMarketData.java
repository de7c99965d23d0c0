package com.jay.valuator.layer1_data;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.jay.valuator.model.ComparableCompany;
import com.jay.valuator.model.IndexData;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Offline comparables table loaded from {@code mock-comparables.yaml}, plus a
 * synthetic index that compounds linearly at 12% a year from a base of 14,000.
 */
@Slf4j
@Component
public class MockMarketData {

    static final String RESOURCE = "mock-comparables.yaml";
    static final double INDEX_BASE_PRICE = 14_000.0;
    static final double INDEX_ANNUAL_RETURN = 0.12;

    private final Map<String, ComparableCompany> table = new LinkedHashMap<>();

    @PostConstruct
    public void load() {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(RESOURCE)) {
            if (is == null) {
                log.warn("Mock market data '{}' not found on classpath", RESOURCE);
                return;
            }
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            List<ComparableCompany> rows = mapper.readValue(is, new TypeReference<List<ComparableCompany>>() {});
            table.clear();
            rows.forEach(c -> table.put(c.getTicker().toUpperCase(Locale.ROOT), c));
            log.info("Loaded {} mock comparables", table.size());
        } catch (Exception e) {
            log.error("Failed to load {}: {}", RESOURCE, e.getMessage());
        }
    }

    /** Copy of the mock snapshot for {@code ticker}, or null if the table has no such ticker. */
    public ComparableCompany comparable(String ticker) {
        ComparableCompany row = ticker == null ? null : table.get(ticker.trim().toUpperCase(Locale.ROOT));
        if (row == null) {
            log.warn("No mock data for ticker {}", ticker);
            return null;
        }
        return ComparableCompany.builder()
            .ticker(row.getTicker())
            .name(row.getName())
            .sector(row.getSector())
            .marketCap(row.getMarketCap())
            .enterpriseValue(row.getEnterpriseValue())
            .revenue(row.getRevenue())
            .ebitda(row.getEbitda())
            .evToRevenue(row.getEvToRevenue())
            .evToEbitda(row.getEvToEbitda())
            .dataSource("mock")
            .dataSourceUrl("https://finance.yahoo.com/quote/" + row.getTicker())
            .fetchedAt(LocalDateTime.now())
            .build();
    }

    /** Synthetic index return since {@code roundDate}; null when the date cannot be parsed. */
    public IndexData indexReturn(String indexTicker, String roundDate) {
        if (roundDate == null) return null;
        try {
            LocalDate since = LocalDate.parse(roundDate.trim());
            double months = ChronoUnit.DAYS.between(since, LocalDate.now()) / 30.0;
            double ret = INDEX_ANNUAL_RETURN * (months / 12);
            return IndexData.builder()
                .ticker(indexTicker)
                .priceAtRound(INDEX_BASE_PRICE)
                .priceCurrent(INDEX_BASE_PRICE * (1 + ret))
                .returnSinceRound(ret)
                .build();
        } catch (DateTimeParseException e) {
            log.warn("Mock index: cannot parse round date '{}'", roundDate);
            return null;
        }
    }

    public int size() {
        return table.size();
    }
}
