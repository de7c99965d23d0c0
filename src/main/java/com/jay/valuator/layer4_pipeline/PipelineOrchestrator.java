package com.jay.valuator.layer4_pipeline;

import com.jay.valuator.layer1_data.EnrichmentProvider;
import com.jay.valuator.layer1_data.FallbackEnrichment;
import com.jay.valuator.layer1_data.MarketDataProvider;
import com.jay.valuator.layer3_engine.InsufficientDataException;
import com.jay.valuator.layer3_engine.ValuationEngine;
import com.jay.valuator.layer5_report.FallbackNarrative;
import com.jay.valuator.layer5_report.NarrativeWriter;
import com.jay.valuator.layer6_persistence.ReportStore;
import com.jay.valuator.model.BlendedValuation;
import com.jay.valuator.model.ComparableCompany;
import com.jay.valuator.model.EnrichedInput;
import com.jay.valuator.model.FinancialProjections;
import com.jay.valuator.model.IndexData;
import com.jay.valuator.model.LlmCallLog;
import com.jay.valuator.model.MarketData;
import com.jay.valuator.model.PipelineStep;
import com.jay.valuator.model.StepEvent;
import com.jay.valuator.model.ValuationReport;
import com.jay.valuator.model.ValuationRequest;
import com.jay.valuator.model.enums.StepStatus;
import com.jay.valuator.model.enums.ValuationMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Layer 4: Valuation Pipeline.
 *
 * Runs the six steps of a valuation strictly in order:
 *   validate → enrich → fetch → valuate → narrate → persist
 *
 * Every step is timed and recorded, and each transition is published on the run's
 * status bus when one is supplied. Acquisition failures (enrich, fetch) fall back
 * to raw inputs / empty market data. A valuation failure is surfaced on the report,
 * narrate is skipped, and the report is still persisted. {@link #run} never throws.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineOrchestrator {

    public static final String NARRATE_SKIPPED = "Skipped - no valuation results to narrate";

    private final EnrichmentProvider enrichmentProvider;
    private final MarketDataProvider marketDataProvider;
    private final ValuationEngine valuationEngine;
    private final NarrativeWriter narrativeWriter;
    private final ReportStore reportStore;

    @FunctionalInterface
    private interface StepAction<T> {
        T call() throws Exception;
    }

    public ValuationReport run(ValuationRequest request) {
        return run(request, UUID.randomUUID().toString(), null);
    }

    /**
     * Runs the pipeline under the given report id, publishing progress on {@code bus}
     * (may be null). The bus is marked complete before returning; removing it from the
     * registry is left to the caller.
     */
    public ValuationReport run(ValuationRequest request, String reportId, StatusEventBus bus) {
        log.info("=== Pipeline started for '{}' (id={}) ===", request.getCompanyName(), reportId);
        List<PipelineStep> steps = new ArrayList<>();
        List<LlmCallLog> callLog = new ArrayList<>();
        Map<String, Object> assumptions = baseAssumptions(request);

        // ── Step 1: validate (request is bean-validated at the boundary) ──────
        LocalDateTime now = LocalDateTime.now();
        PipelineStep validate = PipelineStep.builder()
            .stepName("validate").status(StepStatus.COMPLETED)
            .startedAt(now).completedAt(now).durationMs(0.0)
            .build();
        steps.add(validate);
        publish(bus, StepEvent.of(validate));

        // ── Step 2: enrich ────────────────────────────────────────────────────
        EnrichedInput enriched = runStep("enrich", steps, bus,
            () -> enrichmentProvider.enrich(request, callLog), null);
        if (enriched == null) {
            log.warn("Enrichment unavailable for '{}', using raw inputs", request.getCompanyName());
            enriched = FallbackEnrichment.from(request);
        }
        addEstimateAssumptions(assumptions, request, enriched);

        // ── Step 3: fetch ─────────────────────────────────────────────────────
        EnrichedInput forFetch = enriched;
        MarketData marketData = runStep("fetch", steps, bus, () -> fetch(request, forFetch), null);
        if (marketData == null) marketData = MarketData.empty();

        // ── Step 4: valuate ───────────────────────────────────────────────────
        EnrichedInput forValuation = enriched;
        MarketData forValuationData = marketData;
        String[] error = new String[1];
        List<String> missingData = new ArrayList<>();
        BlendedValuation blended = runStep("valuate", steps, bus,
            () -> valuationEngine.run(request, forValuation, forValuationData),
            e -> {
                if (e instanceof InsufficientDataException) {
                    error[0] = e.getMessage();
                    missingData.addAll(((InsufficientDataException) e).getMissingFields());
                } else {
                    error[0] = "Valuation step encountered an unexpected error: " + e.getMessage();
                }
            });

        // ── Step 5: narrate ───────────────────────────────────────────────────
        String narrative = null;
        if (blended != null && blended.getFairValue() > 0) {
            narrative = runStep("narrate", steps, bus,
                () -> narrate(request, blended, assumptions, callLog), null);
        } else {
            LocalDateTime skippedAt = LocalDateTime.now();
            PipelineStep skipped = PipelineStep.builder()
                .stepName("narrate").status(StepStatus.SKIPPED)
                .startedAt(skippedAt).completedAt(skippedAt).durationMs(0.0)
                .error(NARRATE_SKIPPED)
                .build();
            steps.add(skipped);
            publish(bus, StepEvent.of(skipped));
        }

        ValuationReport report = ValuationReport.builder()
            .id(reportId)
            .companyName(request.getCompanyName())
            .request(request)
            .enrichedInput(enriched)
            .marketDataSummary(marketSummary(marketData))
            .blendedValuation(blended)
            .narrative(narrative)
            .error(error[0])
            .missingData(missingData)
            .pipelineSteps(steps)
            .llmCallLogs(callLog)
            .assumptions(assumptions)
            .createdAt(LocalDateTime.now())
            .build();

        // ── Step 6: persist (always, so failed attempts stay auditable) ───────
        runStep("persist", steps, bus, () -> reportStore.save(report), null);

        if (bus != null) bus.markComplete();
        log.info("=== Pipeline completed for '{}': fair_value={} ===", request.getCompanyName(),
            blended != null ? String.format("%,.0f", blended.getFairValue()) : "FAILED");
        return report;
    }

    // ── Step bodies ───────────────────────────────────────────────────────────

    private MarketData fetch(ValuationRequest request, EnrichedInput enriched) {
        List<ComparableCompany> comparables = new ArrayList<>();
        if (enriched.isApplicable(ValuationMethod.COMPS) && !enriched.getComparableTickers().isEmpty()) {
            comparables = marketDataProvider.fetchComparables(enriched.getComparableTickers());
        }

        String roundDate = request.getLastRoundDate();
        if (isBlank(roundDate) && enriched.getEstimatedLastRound() != null) {
            roundDate = enriched.getEstimatedLastRound().getEstimatedDate();
        }
        IndexData index = null;
        if (enriched.isApplicable(ValuationMethod.LAST_ROUND) && !isBlank(request.getIndexTicker())
                && !isBlank(roundDate)) {
            index = marketDataProvider.fetchIndexReturn(request.getIndexTicker(), roundDate);
        }
        log.info("Fetched {} comparable(s), index data: {}", comparables.size(), index != null);
        return new MarketData(new ArrayList<>(comparables), index);
    }

    private String narrate(ValuationRequest request, BlendedValuation blended,
                           Map<String, Object> assumptions, List<LlmCallLog> callLog) {
        try {
            return narrativeWriter.write(request, blended, assumptions, callLog);
        } catch (Exception e) {
            log.warn("Narrative generation failed: {}, using fallback", e.getMessage());
            return FallbackNarrative.of(blended);
        }
    }

    // ── Step runner ───────────────────────────────────────────────────────────

    /** Times one step, records it, publishes both transitions. Returns null when the step failed. */
    private <T> T runStep(String name, List<PipelineStep> steps, StatusEventBus bus,
                          StepAction<T> action, Consumer<Exception> onFailure) {
        PipelineStep step = PipelineStep.builder()
            .stepName(name).status(StepStatus.RUNNING).startedAt(LocalDateTime.now())
            .build();
        publish(bus, StepEvent.of(name, StepStatus.RUNNING));
        log.info("Step '{}' started", name);
        long start = System.nanoTime();
        try {
            T result = action.call();
            step.setStatus(StepStatus.COMPLETED);
            return result;
        } catch (Exception e) {
            step.setStatus(StepStatus.FAILED);
            step.setError(e.getMessage());
            if (onFailure != null) onFailure.accept(e);
            return null;
        } finally {
            step.setCompletedAt(LocalDateTime.now());
            step.setDurationMs((System.nanoTime() - start) / 1_000_000.0);
            steps.add(step);
            publish(bus, StepEvent.of(step));
            if (step.getStatus() == StepStatus.COMPLETED) {
                log.info("Step '{}' completed in {}ms", name, Math.round(step.getDurationMs()));
            } else {
                log.error("Step '{}' failed in {}ms: {}", name, Math.round(step.getDurationMs()), step.getError());
            }
        }
    }

    private static void publish(StatusEventBus bus, StepEvent event) {
        if (bus != null) bus.publish(event);
    }

    // ── Report assembly ───────────────────────────────────────────────────────

    private static Map<String, Object> baseAssumptions(ValuationRequest request) {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("company_name", request.getCompanyName());
        a.put("revenue", request.getRevenue());
        a.put("revenue_source", request.getRevenue() != null ? "user-provided" : "not provided");
        a.put("ebitda", request.getEbitda());
        FinancialProjections fp = request.getFinancialProjections();
        if (fp != null) {
            a.put("wacc", fp.getWacc());
            a.put("terminal_growth_rate", fp.getTerminalGrowthRate());
            a.put("tax_rate", fp.getTaxRate());
            a.put("capex_percent", fp.getCapexPercent());
        }
        if (request.getLastRoundValuation() != null) {
            a.put("last_round_valuation", request.getLastRoundValuation());
            a.put("last_round_date", request.getLastRoundDate());
        }
        return a;
    }

    private static void addEstimateAssumptions(Map<String, Object> a, ValuationRequest request,
                                               EnrichedInput enriched) {
        if (enriched.getResearchSources() != null && !enriched.getResearchSources().isEmpty()) {
            a.put("research_sources", enriched.getResearchSources());
        }

        EnrichedInput.EstimatedFinancials ef = enriched.getEstimatedFinancials();
        if (ef != null) {
            if (ef.getEstimatedRevenue() != null && ef.getEstimatedRevenue() != 0) {
                a.put("estimated_revenue", ef.getEstimatedRevenue());
                a.put("revenue_confidence", ef.getConfidence());
                a.put("revenue_reasoning", ef.getReasoning());
                if (request.getRevenue() == null) {
                    a.put("revenue", ef.getEstimatedRevenue());
                    a.put("revenue_source", String.format("LLM estimate (%s confidence)",
                        ef.getConfidence() != null ? ef.getConfidence() : "unknown"));
                }
            }
            if (ef.getEstimatedEbitda() != null && ef.getEstimatedEbitda() != 0) {
                a.put("estimated_ebitda", ef.getEstimatedEbitda());
                if (request.getEbitda() == null) a.put("ebitda", ef.getEstimatedEbitda());
            }
        }

        EnrichedInput.EstimatedProjections ep = enriched.getEstimatedProjections();
        if (ep != null && ep.hasGrowthRates()) {
            a.put("estimated_growth_rates", ep.getEstimatedGrowthRates());
            a.put("estimated_ebitda_margins", ep.getEstimatedEbitdaMargins());
            a.put("estimated_wacc", ep.getEstimatedWacc());
            a.put("estimated_terminal_growth_rate", ep.getEstimatedTerminalGrowthRate());
            a.put("projections_source", ep.getSource());
            a.put("projections_confidence", ep.getConfidence());
            a.put("projections_reasoning", ep.getReasoning());
        }

        EnrichedInput.EstimatedLastRound elr = enriched.getEstimatedLastRound();
        if (elr != null && elr.getEstimatedValuation() > 0) {
            a.put("estimated_last_round_valuation", elr.getEstimatedValuation());
            a.put("estimated_last_round_date", elr.getEstimatedDate());
            a.put("last_round_source", elr.getSource());
            a.put("last_round_confidence", elr.getConfidence());
            a.put("last_round_reasoning", elr.getReasoning());
        }
    }

    private static Map<String, Object> marketSummary(MarketData marketData) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("comparables_count", marketData.getComparables().size());
        summary.put("comparables", marketData.getComparables());
        summary.put("index_data", marketData.getIndexData());
        return summary;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
