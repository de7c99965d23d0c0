package com.jay.valuator.layer2_valuation;

import com.jay.valuator.config.ValuatorConfig;
import com.jay.valuator.model.BlendedValuation;
import com.jay.valuator.model.CompsResult;
import com.jay.valuator.model.DcfResult;
import com.jay.valuator.model.LastRoundResult;
import com.jay.valuator.model.MethodologyWeight;
import com.jay.valuator.model.ValuationResult;
import com.jay.valuator.model.enums.ValuationMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Layer 2: Methodology Blender.
 *
 * Combines the comps, DCF and last-round results into one fair value.
 * Only methods with a positive enterprise value contribute. Weights come from
 * the heuristic below unless the caller supplies its own; either way they are
 * renormalised over the contributing methods. Negative custom weights are
 * rejected, and custom weights that leave the contributing methods with no
 * positive total fall back to the heuristic.
 *
 * Default weights:
 *   comps       0.40 with at least 3 comparables, else 0.25
 *   DCF         0.35, or 0.15 when inputs were estimated
 *   last round  0.10 when estimated, else 0.15 when stale, else 0.25
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ValuationBlender {

    private final ValuatorConfig config;

    private record Weighted(double weight, String rationale) {}

    public BlendedValuation blend(CompsResult comps, DcfResult dcf, LastRoundResult lastRound) {
        return blend(comps, dcf, lastRound, null);
    }

    public BlendedValuation blend(CompsResult comps, DcfResult dcf, LastRoundResult lastRound,
                                  Map<ValuationMethod, Double> customWeights) {
        Map<ValuationMethod, ValuationResult> contributing = new EnumMap<>(ValuationMethod.class);
        Stream.of(comps, dcf, lastRound)
            .filter(r -> r != null && r.hasValue())
            .forEach(r -> contributing.put(r.method(), r));

        BlendedValuation.BlendedValuationBuilder out = BlendedValuation.builder()
            .compsResult(comps)
            .dcfResult(dcf)
            .lastRoundResult(lastRound);

        if (contributing.isEmpty()) {
            log.warn("Blender: no method produced a positive value");
            return out.fairValue(0).fairValueLow(0).fairValueHigh(0).build();
        }

        Map<ValuationMethod, Weighted> raw = null;
        if (customWeights != null && !customWeights.isEmpty()) {
            raw = customWeights(customWeights, contributing);
            if (raw.values().stream().mapToDouble(Weighted::weight).sum() <= 0) {
                log.warn("Custom weights {} give no contributing method a positive weight, using defaults",
                    customWeights);
                raw = null;
            }
        }
        if (raw == null) {
            raw = defaultWeights(comps, dcf, lastRound, contributing);
        }

        double total = raw.values().stream().mapToDouble(Weighted::weight).sum();
        List<MethodologyWeight> weights = new ArrayList<>();
        double fairValue = 0;
        for (Map.Entry<ValuationMethod, Weighted> e : raw.entrySet()) {
            double w = total > 0 ? e.getValue().weight() / total : e.getValue().weight();
            fairValue += w * contributing.get(e.getKey()).getEnterpriseValue();
            weights.add(new MethodologyWeight(e.getKey(), w, e.getValue().rationale()));
        }

        ValuatorConfig.Blender cfg = config.blender();
        double rangePct = (comps != null && comps.getComparableCount() >= cfg.getTightRangeMinComps())
            ? cfg.getTightRangePct()
            : cfg.getDefaultRangePct();

        log.info("Blended fair value {} from {} method(s), range ±{}%",
            String.format("%,.0f", fairValue), weights.size(), Math.round(rangePct * 100));

        return out.fairValue(fairValue)
            .fairValueLow(fairValue * (1 - rangePct))
            .fairValueHigh(fairValue * (1 + rangePct))
            .methodologyWeights(weights)
            .build();
    }

    // ── Weighting ─────────────────────────────────────────────────────────────

    private Map<ValuationMethod, Weighted> customWeights(Map<ValuationMethod, Double> custom,
                                                         Map<ValuationMethod, ValuationResult> contributing) {
        Map<ValuationMethod, Weighted> out = new EnumMap<>(ValuationMethod.class);
        custom.forEach((method, w) -> {
            if (w != null && w < 0) {
                throw new IllegalArgumentException(String.format(
                    "Weight for %s must not be negative (got %s)", method != null ? method.key() : "null", w));
            }
            if (method != null && w != null && contributing.containsKey(method)) {
                out.put(method, new Weighted(w, String.format("Custom weight %.2f", w)));
            }
        });
        return out;
    }

    private Map<ValuationMethod, Weighted> defaultWeights(CompsResult comps, DcfResult dcf, LastRoundResult lastRound,
                                                          Map<ValuationMethod, ValuationResult> contributing) {
        ValuatorConfig.Blender cfg = config.blender();
        Map<ValuationMethod, Weighted> out = new EnumMap<>(ValuationMethod.class);

        if (contributing.containsKey(ValuationMethod.COMPS)) {
            int count = comps.getComparableCount();
            int threshold = cfg.getMinCompsForFullWeight();
            out.put(ValuationMethod.COMPS, count >= threshold
                ? new Weighted(cfg.getCompsFullWeight(), String.format(
                    "Weight %.2f: comparable_count (%d) >= %d threshold, strong market signal",
                    cfg.getCompsFullWeight(), count, threshold))
                : new Weighted(cfg.getCompsLimitedWeight(), String.format(
                    "Weight %.2f: comparable_count (%d) < %d threshold, limited market data",
                    cfg.getCompsLimitedWeight(), count, threshold)));
        }

        if (contributing.containsKey(ValuationMethod.DCF)) {
            int years = dcf.getProjectionYears();
            out.put(ValuationMethod.DCF, dcf.isEstimated()
                ? new Weighted(cfg.getDcfEstimatedWeight(), String.format(
                    "Weight %.2f: DCF with %d-year projections, model-estimated inputs, significantly reduced weight",
                    cfg.getDcfEstimatedWeight(), years))
                : new Weighted(cfg.getDcfWeight(), String.format(
                    "Weight %.2f: DCF with %d-year projections, intrinsic value anchor",
                    cfg.getDcfWeight(), years)));
        }

        if (contributing.containsKey(ValuationMethod.LAST_ROUND)) {
            Integer months = lastRound.getMonthsSinceRound();
            int stalenessMonths = config.lastRound().getStalenessMonths();
            // Estimation is checked before staleness: an estimated stale round gets the estimated weight
            if (lastRound.isEstimated()) {
                out.put(ValuationMethod.LAST_ROUND, new Weighted(cfg.getLastRoundEstimatedWeight(), String.format(
                    "Weight %.2f: last round data is model-estimated, significantly reduced weight",
                    cfg.getLastRoundEstimatedWeight())));
            } else if (months != null && months > stalenessMonths) {
                out.put(ValuationMethod.LAST_ROUND, new Weighted(cfg.getLastRoundStaleWeight(), String.format(
                    "Weight %.2f: last round %dmo ago > %dmo staleness threshold, reduced weight",
                    cfg.getLastRoundStaleWeight(), months, stalenessMonths)));
            } else {
                String age = months != null ? months + "mo ago" : "date unknown";
                out.put(ValuationMethod.LAST_ROUND, new Weighted(cfg.getLastRoundFreshWeight(), String.format(
                    "Weight %.2f: last round %s, within %dmo freshness window",
                    cfg.getLastRoundFreshWeight(), age, stalenessMonths)));
            }
        }
        return out;
    }
}
