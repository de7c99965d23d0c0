package com.jay.valuator.layer1_data;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.jay.valuator.model.FinancialProjections;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns an uploaded projections file into {@link FinancialProjections}.
 *
 * Accepted shapes:
 *   .json  the projections object itself (snake_case keys)
 *   .csv   simple: one row per year with {@code revenue} and {@code ebitda_margin}
 *          columns; scalar columns (wacc, tax_rate, ...) are read from the first row
 *   .csv   sectioned: a {@code Section} column splitting Projections rows
 *          (revenue / EBITDA margin columns) from Assumptions rows (Metric / Value)
 *
 * Anything else raises {@link IllegalArgumentException}.
 */
@Slf4j
@Component
public class ProjectionsUploadParser {

    private static final double DEFAULT_MARGIN = 0.2;

    private static final List<String> SCALAR_COLUMNS = List.of(
        "wacc", "tax_rate", "capex_percent", "nwc_change_percent",
        "terminal_growth_rate", "depreciation_percent");

    private static final Map<String, String> METRIC_MAP = Map.ofEntries(
        Map.entry("wacc", "wacc"),
        Map.entry("terminal growth", "terminal_growth_rate"),
        Map.entry("terminal growth rate", "terminal_growth_rate"),
        Map.entry("tax rate", "tax_rate"),
        Map.entry("capex % revenue", "capex_percent"),
        Map.entry("capex percent", "capex_percent"),
        Map.entry("nwc change % revenue", "nwc_change_percent"),
        Map.entry("nwc change percent", "nwc_change_percent"),
        Map.entry("d&a % revenue", "depreciation_percent"),
        Map.entry("depreciation % revenue", "depreciation_percent"),
        Map.entry("depreciation percent", "depreciation_percent"));

    private final ObjectMapper mapper = new ObjectMapper()
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public FinancialProjections parse(String filename, byte[] content) {
        String name = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
        try {
            if (name.endsWith(".json")) {
                return mapper.readValue(content, FinancialProjections.class);
            }
            if (name.endsWith(".csv")) {
                String text = stripBom(new String(content, StandardCharsets.UTF_8));
                FinancialProjections result = parseSimpleCsv(text);
                if (result == null) result = parseSectionedCsv(text);
                if (result == null) {
                    throw new IllegalArgumentException(
                        "Unrecognized CSV format. Expected 'revenue'/'ebitda_margin' columns or a 'Section' column");
                }
                log.info("Parsed {} projection year(s) from {}", result.getRevenueProjections().size(), filename);
                return result;
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to parse file: " + e.getMessage(), e);
        }
        throw new IllegalArgumentException("Unsupported file type. Upload .json or .csv");
    }

    // ── Simple CSV ────────────────────────────────────────────────────────────

    FinancialProjections parseSimpleCsv(String text) throws IOException {
        try (CSVParser parser = csvFormat().parse(new StringReader(text))) {
            List<String> headers = parser.getHeaderNames();
            if (!headers.contains("revenue") || !headers.contains("ebitda_margin")) return null;

            List<Double> revenues = new ArrayList<>();
            List<Double> margins = new ArrayList<>();
            FinancialProjections.FinancialProjectionsBuilder out = FinancialProjections.builder();
            boolean first = true;
            for (CSVRecord row : parser) {
                revenues.add(Double.parseDouble(row.get("revenue")));
                margins.add(Double.parseDouble(row.get("ebitda_margin")));
                if (first) {
                    first = false;
                    for (String key : SCALAR_COLUMNS) {
                        if (row.isMapped(key) && row.isSet(key) && !row.get(key).isBlank()) {
                            applyScalar(out, key, Double.parseDouble(row.get(key)));
                        }
                    }
                }
            }
            if (revenues.isEmpty()) return null;
            return out.revenueProjections(revenues).ebitdaMargins(margins).build();
        } catch (IllegalArgumentException e) {
            log.debug("Simple CSV parse failed: {}", e.getMessage());
            return null;
        }
    }

    // ── Sectioned CSV ─────────────────────────────────────────────────────────

    FinancialProjections parseSectionedCsv(String text) throws IOException {
        try (CSVParser parser = csvFormat().parse(new StringReader(text))) {
            List<String> headers = parser.getHeaderNames();
            if (!headers.contains("Section")) return null;

            String revCol = headers.stream()
                .filter(h -> h.toLowerCase(Locale.ROOT).contains("revenue")).findFirst().orElse(null);
            String marginCol = headers.stream()
                .filter(h -> h.toLowerCase(Locale.ROOT).contains("ebitda") && h.toLowerCase(Locale.ROOT).contains("margin"))
                .findFirst().orElse(null);
            String metricCol = headers.stream().filter(h -> h.equalsIgnoreCase("metric")).findFirst().orElse(null);
            String valueCol = headers.stream().filter(h -> h.equalsIgnoreCase("value")).findFirst().orElse(null);
            if (revCol == null || marginCol == null) return null;

            double multiplier = unitMultiplier(revCol);
            List<Double> revenues = new ArrayList<>();
            List<Double> margins = new ArrayList<>();
            FinancialProjections.FinancialProjectionsBuilder out = FinancialProjections.builder();

            for (CSVRecord row : parser) {
                String section = cell(row, "Section").toLowerCase(Locale.ROOT);
                if (section.equals("projections")) {
                    String rev = cell(row, revCol);
                    String margin = cell(row, marginCol);
                    if (!rev.isEmpty()) {
                        revenues.add(Double.parseDouble(rev) * multiplier);
                        margins.add(margin.isEmpty() ? DEFAULT_MARGIN : Double.parseDouble(margin));
                    }
                } else if (section.equals("assumptions") && metricCol != null && valueCol != null) {
                    String metric = cell(row, metricCol).toLowerCase(Locale.ROOT);
                    String value = cell(row, valueCol);
                    String param = METRIC_MAP.get(metric);
                    if (param != null && !value.isEmpty()) {
                        applyScalar(out, param, Double.parseDouble(value));
                    }
                }
            }
            if (revenues.isEmpty()) return null;
            return out.revenueProjections(revenues).ebitdaMargins(margins).build();
        } catch (IllegalArgumentException e) {
            log.debug("Sectioned CSV parse failed: {}", e.getMessage());
            return null;
        }
    }

    /** "Revenue ($M)" scales by 1e6, "($B)" by 1e9, "($K)" by 1e3. */
    static double unitMultiplier(String header) {
        String h = header.toLowerCase(Locale.ROOT);
        if (h.contains("($b)") || h.contains("(b)")) return 1e9;
        if (h.contains("($m)") || h.contains("(m)") || h.contains("($mm)")) return 1e6;
        if (h.contains("($k)") || h.contains("(k)")) return 1e3;
        return 1.0;
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static CSVFormat csvFormat() {
        return CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .build();
    }

    private static String cell(CSVRecord row, String column) {
        return row.isMapped(column) && row.isSet(column) ? row.get(column).trim() : "";
    }

    private static void applyScalar(FinancialProjections.FinancialProjectionsBuilder b, String key, double v) {
        switch (key) {
            case "wacc" -> b.wacc(v);
            case "tax_rate" -> b.taxRate(v);
            case "capex_percent" -> b.capexPercent(v);
            case "nwc_change_percent" -> b.nwcChangePercent(v);
            case "terminal_growth_rate" -> b.terminalGrowthRate(v);
            case "depreciation_percent" -> b.depreciationPercent(v);
            default -> log.debug("Ignoring unknown projection field {}", key);
        }
    }

    private static String stripBom(String s) {
        return s.startsWith("\uFEFF") ? s.substring(1) : s;
    }
}
