package com.jay.valuator.layer3_engine;

import com.jay.valuator.config.ValuatorConfig;
import com.jay.valuator.layer2_valuation.ComparableScorer;
import com.jay.valuator.layer2_valuation.DcfEngine;
import com.jay.valuator.layer2_valuation.LastRoundAdjuster;
import com.jay.valuator.layer2_valuation.ValuationBlender;
import com.jay.valuator.model.BlendedValuation;
import com.jay.valuator.model.CompsResult;
import com.jay.valuator.model.DcfResult;
import com.jay.valuator.model.EnrichedInput;
import com.jay.valuator.model.FinancialProjections;
import com.jay.valuator.model.LastRoundResult;
import com.jay.valuator.model.MarketData;
import com.jay.valuator.model.ValuationRequest;
import com.jay.valuator.model.enums.ValuationMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Layer 3: Valuation Engine.
 *
 * Resolves the inputs each method needs (caller values first, research estimates second),
 * runs every method that has what it needs, annotates the results with consistency
 * warnings and blends them. A failing method is logged and skipped; the others still run.
 *
 * Throws {@link InsufficientDataException} when nothing can run or the blend comes out at zero.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValuationEngine {

    private final ComparableScorer comparableScorer;
    private final DcfEngine dcfEngine;
    private final LastRoundAdjuster lastRoundAdjuster;
    private final ValuationBlender blender;
    private final ValuatorConfig config;

    /** Inputs after merging the request with enrichment estimates. */
    public record ResolvedInputs(
        Double revenue,
        String revenueSource,
        Double ebitda,
        FinancialProjections projections,
        boolean projectionsEstimated,
        Double lastRoundValuation,
        String lastRoundDate,
        boolean lastRoundEstimated
    ) {
        public boolean revenueEstimated() {
            return !"user-provided".equals(revenueSource);
        }
    }

    public BlendedValuation run(ValuationRequest request, EnrichedInput enriched, MarketData marketData) {
        ResolvedInputs in = resolve(request, enriched);
        String sourceLinks = sourceLinks(enriched);

        boolean canComps = enriched.isApplicable(ValuationMethod.COMPS)
            && positive(in.revenue()) && !marketData.getComparables().isEmpty();
        boolean canDcf = enriched.isApplicable(ValuationMethod.DCF) && in.projections() != null;
        boolean canLastRound = enriched.isApplicable(ValuationMethod.LAST_ROUND)
            && positive(in.lastRoundValuation()) && in.lastRoundDate() != null;

        if (!canComps && !canDcf && !canLastRound) {
            List<String> missing = identifyMissing(enriched, in.revenue(), marketData);
            StringBuilder msg = new StringBuilder()
                .append(String.format("Unable to perform valuation for \"%s\". ", request.getCompanyName()))
                .append("Comparable Company Analysis could not run.\n\nWhat went wrong:\n");
            missing.forEach(m -> msg.append("  - ").append(m).append('\n'));
            msg.append("\nTo run a valuation, please provide at least:\n")
                .append("  - Annual Revenue (for Comparable Company Analysis)");
            log.error("No valuation method runnable for '{}': {}", request.getCompanyName(), missing);
            throw new InsufficientDataException(msg.toString(), missing);
        }

        CompsResult comps = null;
        DcfResult dcf = null;
        LastRoundResult lastRound = null;

        if (canComps) {
            try {
                comps = comparableScorer.value(in.revenue(), marketData.getComparables(), enriched.getSector());
                if (in.revenueEstimated()) {
                    comps.setEstimated(true);
                    comps.getWarnings().add("Revenue source: " + in.revenueSource() + "." + sourceLinks);
                }
            } catch (Exception e) {
                log.error("Comps valuation failed: {}", e.getMessage(), e);
            }
        }

        if (canDcf) {
            try {
                dcf = dcfEngine.value(in.projections());
                if (in.projectionsEstimated()) {
                    EnrichedInput.EstimatedProjections ep = enriched.getEstimatedProjections();
                    dcf.setEstimated(true);
                    dcf.getWarnings().add(String.format(
                        "DCF inputs are model-estimated (%s confidence). Growth rates, margins, WACC, and TGR "
                            + "were inferred from web research. Source: %s.%s",
                        ep.getConfidence(), ep.getSource(), sourceLinks));
                }
            } catch (Exception e) {
                log.error("DCF valuation failed: {}", e.getMessage(), e);
            }
        }

        if (canLastRound) {
            try {
                lastRound = lastRoundAdjuster.value(in.lastRoundValuation(), in.lastRoundDate(),
                    marketData.getIndexData());
                if (in.lastRoundEstimated()) {
                    EnrichedInput.EstimatedLastRound elr = enriched.getEstimatedLastRound();
                    lastRound.setEstimated(true);
                    lastRound.getWarnings().add(String.format(
                        "Last round data is model-estimated (%s confidence). Source: %s.%s",
                        elr.getConfidence(), elr.getSource(), sourceLinks));
                }
            } catch (Exception e) {
                log.error("Last round valuation failed: {}", e.getMessage(), e);
            }
        }

        checkConsistency(request, enriched, dcf, lastRound, sourceLinks);

        BlendedValuation blended = blender.blend(comps, dcf, lastRound);
        if (blended.getFairValue() == 0) {
            throw new InsufficientDataException(String.format(
                "All valuation methods produced $0 for \"%s\". This typically means the input data was "
                    + "insufficient or invalid. Please verify the provided financials and try again.",
                request.getCompanyName()),
                identifyMissing(enriched, in.revenue(), marketData));
        }
        return blended;
    }

    /** Re-weights stored method results without rerunning acquisition or the methods. */
    public BlendedValuation reblend(BlendedValuation previous, Map<ValuationMethod, Double> weights) {
        return blender.blend(previous.getCompsResult(), previous.getDcfResult(),
            previous.getLastRoundResult(), weights);
    }

    // ── Input resolution ──────────────────────────────────────────────────────

    public ResolvedInputs resolve(ValuationRequest request, EnrichedInput enriched) {
        Double revenue = request.getRevenue();
        Double ebitda = request.getEbitda();
        String revenueSource = "user-provided";

        EnrichedInput.EstimatedFinancials ef = enriched.getEstimatedFinancials();
        if (revenue == null && ef != null) {
            if (positive(ef.getEstimatedRevenue())) {
                revenue = ef.getEstimatedRevenue();
                revenueSource = String.format("LLM estimate (%s confidence)",
                    ef.getConfidence() != null ? ef.getConfidence() : "unknown");
                log.info("Using estimated revenue {} ({})", String.format("%,.0f", revenue), revenueSource);
            }
            if (ebitda == null && ef.getEstimatedEbitda() != null && ef.getEstimatedEbitda() != 0) {
                ebitda = ef.getEstimatedEbitda();
            }
        }

        Double lastRoundValuation = request.getLastRoundValuation();
        String lastRoundDate = request.getLastRoundDate();
        boolean lastRoundEstimated = false;
        EnrichedInput.EstimatedLastRound elr = enriched.getEstimatedLastRound();
        if ((lastRoundValuation == null || lastRoundDate == null) && elr != null
                && elr.getEstimatedValuation() > 0 && elr.getEstimatedDate() != null) {
            lastRoundValuation = elr.getEstimatedValuation();
            lastRoundDate = elr.getEstimatedDate();
            lastRoundEstimated = true;
            log.info("Using estimated last round {} on {} ({} confidence)",
                String.format("%,.0f", lastRoundValuation), lastRoundDate, elr.getConfidence());
        }

        FinancialProjections projections = request.getFinancialProjections();
        boolean projectionsEstimated = false;
        EnrichedInput.EstimatedProjections ep = enriched.getEstimatedProjections();
        if (projections == null && ep != null && ep.hasGrowthRates() && positive(revenue)) {
            projections = buildEstimatedProjections(revenue, ep);
            projectionsEstimated = true;
            log.info("Using estimated projections: {}-yr growth, WACC {} g {} ({} confidence)",
                ep.getEstimatedGrowthRates().size(), ep.getEstimatedWacc(),
                ep.getEstimatedTerminalGrowthRate(), ep.getConfidence());
        }

        return new ResolvedInputs(revenue, revenueSource, ebitda, projections, projectionsEstimated,
            lastRoundValuation, lastRoundDate, lastRoundEstimated);
    }

    /** Compounds the estimated growth rates on the base revenue; margins padded with the last value. */
    FinancialProjections buildEstimatedProjections(double baseRevenue, EnrichedInput.EstimatedProjections ep) {
        List<Double> revenues = new ArrayList<>();
        double rev = baseRevenue;
        for (double rate : ep.getEstimatedGrowthRates()) {
            rev = rev * (1 + rate);
            revenues.add(rev);
        }
        List<Double> margins = new ArrayList<>(ep.getEstimatedEbitdaMargins() != null
            ? ep.getEstimatedEbitdaMargins() : List.of());
        while (margins.size() < revenues.size()) {
            margins.add(margins.isEmpty() ? config.dcf().getDefaultMargin() : margins.get(margins.size() - 1));
        }
        ValuatorConfig.Dcf d = config.dcf();
        return FinancialProjections.builder()
            .revenueProjections(revenues)
            .ebitdaMargins(new ArrayList<>(margins.subList(0, revenues.size())))
            .capexPercent(d.getDefaultCapexPercent())
            .nwcChangePercent(d.getDefaultNwcChangePercent())
            .taxRate(d.getDefaultTaxRate())
            .depreciationPercent(d.getDefaultDepreciationPercent())
            .wacc(ep.getEstimatedWacc())
            .terminalGrowthRate(ep.getEstimatedTerminalGrowthRate())
            .build();
    }

    // ── Consistency checks ────────────────────────────────────────────────────

    /** Flags large gaps between caller inputs and research estimates. Annotates only. */
    void checkConsistency(ValuationRequest request, EnrichedInput enriched,
                          DcfResult dcf, LastRoundResult lastRound, String sourceLinks) {
        ValuatorConfig.Consistency cfg = config.consistency();
        FinancialProjections user = request.getFinancialProjections();
        EnrichedInput.EstimatedProjections ep = enriched.getEstimatedProjections();

        if (user != null && ep != null && ep.hasGrowthRates() && dcf != null) {
            double waccGap = Math.abs(user.getWacc() - ep.getEstimatedWacc());
            if (waccGap >= cfg.getWaccDiff()) {
                dcf.getWarnings().add(String.format(
                    "WACC mismatch: user provided %s vs research estimate %s (difference: %s).%s",
                    pct(user.getWacc()), pct(ep.getEstimatedWacc()), pct(waccGap), sourceLinks));
            }
            double growthGap = Math.abs(user.getTerminalGrowthRate() - ep.getEstimatedTerminalGrowthRate());
            if (growthGap >= cfg.getGrowthDiff()) {
                dcf.getWarnings().add(String.format(
                    "Terminal growth rate mismatch: user provided %s vs research estimate %s (difference: %s).%s",
                    pct(user.getTerminalGrowthRate()), pct(ep.getEstimatedTerminalGrowthRate()),
                    pct(growthGap), sourceLinks));
            }

            List<Double> revs = user.getRevenueProjections();
            if (revs != null && revs.size() >= 2) {
                List<Double> implied = new ArrayList<>();
                for (int i = 1; i < revs.size(); i++) {
                    if (revs.get(i - 1) > 0) implied.add(revs.get(i) / revs.get(i - 1) - 1);
                }
                if (!implied.isEmpty()) {
                    double avgUser = implied.stream().mapToDouble(Double::doubleValue).average().orElse(0);
                    double avgEst = ep.getEstimatedGrowthRates().stream()
                        .mapToDouble(Double::doubleValue).average().orElse(0);
                    if (avgEst != 0 && Math.abs(avgUser - avgEst) / Math.abs(avgEst) > cfg.getAvgGrowthRelative()) {
                        dcf.getWarnings().add(String.format(
                            "Growth rate mismatch: user implied avg %s/yr vs research estimate avg %s/yr "
                                + "(>%d%% relative difference).%s",
                            pct(avgUser), pct(avgEst), Math.round(cfg.getAvgGrowthRelative() * 100), sourceLinks));
                    }
                }
            }
        }

        EnrichedInput.EstimatedLastRound elr = enriched.getEstimatedLastRound();
        if (request.getLastRoundValuation() != null && elr != null && elr.getEstimatedValuation() > 0
                && lastRound != null) {
            double userVal = request.getLastRoundValuation();
            double estVal = elr.getEstimatedValuation();
            if (Math.abs(userVal - estVal) / estVal > cfg.getLastRoundRelative()) {
                lastRound.getWarnings().add(String.format(
                    "Last round valuation mismatch: user provided $%,.0f vs research estimate $%,.0f "
                        + "(>%d%% relative difference).%s",
                    userVal, estVal, Math.round(cfg.getLastRoundRelative() * 100), sourceLinks));
            }
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private List<String> identifyMissing(EnrichedInput enriched, Double revenue, MarketData marketData) {
        List<String> missing = new ArrayList<>();
        if (!positive(revenue)) {
            if (enriched.isFallback()) {
                missing.add("Revenue: No annual revenue provided. Web research could not run because the "
                    + "research service is unavailable (check the OPENAI_API_KEY setting). "
                    + "Please enter the company's annual revenue manually.");
            } else {
                missing.add("Revenue: No annual revenue provided, and web research could not determine it. "
                    + "Please enter the company's annual revenue.");
            }
        }
        if (positive(revenue) && marketData.getComparables().isEmpty()) {
            missing.add("Comparable companies: Revenue is available but no comparable company data could be "
                + "fetched. Try providing ticker symbols of similar public companies.");
        }
        if (missing.isEmpty()) {
            missing.add("Valuation inputs: none of the applicable methods " + enriched.getApplicableMethods()
                + " had usable data. Provide revenue, financial projections or last round details.");
        }
        return missing;
    }

    private String sourceLinks(EnrichedInput enriched) {
        if (enriched.getResearchSources() == null || enriched.getResearchSources().isEmpty()) return "";
        return " Sources: " + enriched.getResearchSources().stream()
            .limit(config.consistency().getMaxSourceLinks())
            .map(s -> String.format("%s (%s)", s.title() != null ? s.title() : "Link",
                s.url() != null ? s.url() : ""))
            .collect(Collectors.joining(", "));
    }

    private static String pct(double fraction) {
        return String.format("%.1f%%", fraction * 100);
    }

    private static boolean positive(Double v) {
        return v != null && v > 0;
    }
}
