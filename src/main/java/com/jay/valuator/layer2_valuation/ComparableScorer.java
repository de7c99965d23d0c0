package com.jay.valuator.layer2_valuation;

import com.jay.valuator.config.ValuatorConfig;
import com.jay.valuator.model.CompSelectionScore;
import com.jay.valuator.model.ComparableCompany;
import com.jay.valuator.model.CompsResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Layer 2: Comparable Company Analysis.
 *
 * Scores each candidate public comparable against the target on three factors
 * (sector relatedness, size proximity, data quality), filters on the composite,
 * and values the target at the median EV/Revenue multiple of the survivors.
 *
 * When no target sector is known the scorer is bypassed and every comparable
 * with a positive EV/Revenue multiple is used.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ComparableScorer {

    private final ValuatorConfig config;

    /** Composite weights and inclusion threshold. Defaults come from the comps config section. */
    public record ScoringWeights(double sector, double size, double quality, double minComposite) {
        public static ScoringWeights from(ValuatorConfig.Comps cfg) {
            return new ScoringWeights(cfg.getSectorWeight(), cfg.getSizeWeight(),
                cfg.getQualityWeight(), cfg.getMinComposite());
        }
    }

    public record Selection(List<ComparableCompany> included, List<CompSelectionScore> scores) {}

    // ── Scoring ───────────────────────────────────────────────────────────────

    public Selection score(List<ComparableCompany> comparables, double targetRevenue, String targetSector) {
        return score(comparables, targetRevenue, targetSector, ScoringWeights.from(config.comps()));
    }

    /**
     * Scores every comparable and returns the included subset plus one score per input.
     * Inclusion rules run in order: missing EV/Revenue, size out of range, composite below threshold.
     */
    public Selection score(List<ComparableCompany> comparables, double targetRevenue,
                           String targetSector, ScoringWeights weights) {
        ValuatorConfig.Comps cfg = config.comps();
        List<ComparableCompany> included = new ArrayList<>();
        List<CompSelectionScore> scores = new ArrayList<>();

        for (ComparableCompany comp : comparables) {
            double sector  = sectorScore(targetSector, comp.getSector());
            double size    = targetRevenue > 0 ? sizeScore(comp.getRevenue(), targetRevenue) : 0.5;
            double quality = qualityScore(comp);
            double composite = sector * weights.sector() + size * weights.size() + quality * weights.quality();

            String reason = null;
            if (quality == 0.0) {
                reason = "Missing EV/Revenue data";
            } else if (size == 0.0 && targetRevenue > 0) {
                reason = String.format("Revenue outside %sx-%sx range of target",
                    plain(cfg.getMinSizeRatio()), plain(cfg.getMaxSizeRatio()));
            } else if (composite < weights.minComposite()) {
                reason = String.format("Composite score %.2f below %s threshold",
                    composite, plain(weights.minComposite()));
            }

            boolean isIncluded = reason == null;
            if (isIncluded) included.add(comp);
            log.debug("Comp {}: sector={} size={} quality={} composite={} -> {}",
                comp.getTicker(), sector, size, quality, composite, isIncluded ? "included" : reason);

            scores.add(CompSelectionScore.builder()
                .ticker(comp.getTicker())
                .name(comp.getName())
                .sectorScore(round2(sector))
                .sizeScore(round2(size))
                .qualityScore(round2(quality))
                .compositeScore(round2(composite))
                .included(isIncluded)
                .exclusionReason(reason)
                .build());
        }
        return new Selection(included, scores);
    }

    /** 1.0 exact match, 0.5 unknown or same sector group, else 0.0. Case-insensitive. */
    public double sectorScore(String a, String b) {
        if (isBlank(a) || isBlank(b)) return 0.5;
        if (a.equalsIgnoreCase(b)) return 1.0;
        for (List<String> group : config.comps().getSectorGroups()) {
            boolean hasA = group.stream().anyMatch(s -> s.equalsIgnoreCase(a));
            boolean hasB = group.stream().anyMatch(s -> s.equalsIgnoreCase(b));
            if (hasA && hasB) return 0.5;
        }
        return 0.0;
    }

    /** Log-space decay: 1.0 at equal revenue, 0.0 at the 10x bounds and beyond. */
    public double sizeScore(Double compRevenue, double targetRevenue) {
        if (compRevenue == null || compRevenue <= 0 || targetRevenue <= 0) return 0.0;
        double ratio = compRevenue / targetRevenue;
        ValuatorConfig.Comps cfg = config.comps();
        if (ratio < cfg.getMinSizeRatio() || ratio > cfg.getMaxSizeRatio()) return 0.0;
        return Math.max(0.0, 1.0 - Math.abs(Math.log10(ratio)));
    }

    /** 0 without a positive EV/Revenue, else the filled share of the six key fields. */
    public static double qualityScore(ComparableCompany comp) {
        if (!isPositive(comp.getEvToRevenue())) return 0.0;
        long filled = Stream.of(comp.getMarketCap(), comp.getEnterpriseValue(), comp.getRevenue(),
                comp.getEbitda(), comp.getEvToRevenue(), comp.getEvToEbitda())
            .filter(v -> v != null)
            .count();
        return filled / 6.0;
    }

    // ── Valuation ─────────────────────────────────────────────────────────────

    /**
     * Values the target from its comparables. EV = target revenue × median EV/Revenue.
     * EV/EBITDA statistics are informational and come from the filtered set.
     */
    public CompsResult value(double targetRevenue, List<ComparableCompany> comparables, String targetSector) {
        List<String> warnings = new ArrayList<>();
        List<ComparableCompany> filtered;
        List<CompSelectionScore> scores;
        Map<String, Object> criteria = new LinkedHashMap<>();

        if (!isBlank(targetSector)) {
            ScoringWeights weights = ScoringWeights.from(config.comps());
            Selection selection = score(comparables, targetRevenue, targetSector, weights);
            filtered = selection.included();
            scores = selection.scores();
            criteria.put("sector_weight", weights.sector());
            criteria.put("size_weight", weights.size());
            criteria.put("quality_weight", weights.quality());
            criteria.put("min_composite", weights.minComposite());
            criteria.put("target_sector", targetSector);
            criteria.put("target_revenue", targetRevenue);
        } else {
            // No sector context: lenient path, no scoring
            filtered = comparables;
            scores = new ArrayList<>();
        }

        List<ComparableCompany> valid = filtered.stream()
            .filter(c -> isPositive(c.getEvToRevenue()))
            .toList();

        if (valid.size() < 2) {
            warnings.add(String.format("Only %d valid comparable(s) with EV/Revenue data", valid.size()));
        }
        if (valid.isEmpty()) {
            warnings.add("No valid comparables available");
            return CompsResult.builder()
                .enterpriseValue(0)
                .comparableCount(0)
                .selectionScores(scores)
                .selectionCriteria(criteria)
                .warnings(warnings)
                .build();
        }

        List<Double> evRev = valid.stream().map(ComparableCompany::getEvToRevenue).toList();
        double median = median(evRev);

        List<Double> evEbitda = filtered.stream()
            .map(ComparableCompany::getEvToEbitda)
            .filter(ComparableScorer::isPositive)
            .toList();

        CompsResult result = CompsResult.builder()
            .enterpriseValue(targetRevenue * median)
            .evToRevenueMedian(median)
            .evToRevenueMean(mean(evRev))
            .evToEbitdaMedian(evEbitda.isEmpty() ? null : median(evEbitda))
            .evToEbitdaMean(evEbitda.isEmpty() ? null : mean(evEbitda))
            .comparableCount(valid.size())
            .compsUsed(valid.stream().map(ComparableCompany::getTicker).toList())
            .selectionScores(scores)
            .selectionCriteria(criteria)
            .warnings(warnings)
            .build();
        log.info("Comps: {} of {} comparables used, median EV/Revenue {}x, EV {}",
            valid.size(), comparables.size(), String.format("%.2f", median),
            String.format("%,.0f", result.getEnterpriseValue()));
        return result;
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    static double median(List<Double> values) {
        List<Double> sorted = values.stream().sorted().toList();
        int n = sorted.size();
        if (n == 0) return 0;
        return n % 2 == 1 ? sorted.get(n / 2) : (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
    }

    static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    private static String plain(double v) {
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
    }

    private static boolean isPositive(Double v) {
        return v != null && v > 0;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
