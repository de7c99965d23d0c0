package com.jay.valuator.layer4_pipeline;

import com.jay.valuator.config.ValuatorConfig;
import com.jay.valuator.layer3_engine.ValuationEngine;
import com.jay.valuator.layer6_persistence.ReportStore;
import com.jay.valuator.model.BlendedValuation;
import com.jay.valuator.model.ValuationReport;
import com.jay.valuator.model.ValuationRequest;
import com.jay.valuator.model.enums.ValuationMethod;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for callers of the pipeline: synchronous runs, background runs
 * observed through a status bus, and re-weighting of stored reports.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValuationRunService {

    private final PipelineOrchestrator orchestrator;
    private final StatusBusRegistry busRegistry;
    private final ValuationEngine valuationEngine;
    private final ReportStore reportStore;
    private final ValuatorConfig config;

    private ExecutorService pipelineExecutor;

    @PostConstruct
    public void init() {
        int threads = Math.max(1, config.pipeline().getAsyncThreads());
        AtomicInteger counter = new AtomicInteger();
        this.pipelineExecutor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "valuation-pipeline-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Pipeline executor started with {} thread(s)", threads);
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        pipelineExecutor.shutdown();
        if (!pipelineExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
            log.warn("Pipeline executor did not drain in 30s, interrupting running valuations");
            pipelineExecutor.shutdownNow();
        }
    }

    public ValuationReport runSync(ValuationRequest request) {
        return orchestrator.run(request);
    }

    /**
     * Registers a status bus under a fresh report id and starts the pipeline in
     * the background. The bus stays registered until the stream consumer removes it
     * or, once the run has finished unread, until the registry's retention sweep.
     */
    public String startAsync(ValuationRequest request) {
        String reportId = UUID.randomUUID().toString();
        StatusEventBus bus = busRegistry.create(reportId);
        pipelineExecutor.submit(() -> {
            try {
                orchestrator.run(request, reportId, bus);
            } catch (Exception e) {
                log.error("Background valuation {} crashed: {}", reportId, e.getMessage(), e);
                bus.markComplete();
            }
        });
        log.info("Async valuation {} queued for '{}'", reportId, request.getCompanyName());
        return reportId;
    }

    /**
     * Re-blends a stored report with caller-supplied weights keyed by method
     * ("comps", "dcf", "last_round"). Unknown keys are ignored. Empty when no
     * stored report has that id or it has no valuation to re-weight.
     */
    public Optional<ValuationReport> reweight(String reportId, Map<String, Double> weights) {
        Optional<ValuationReport> stored = reportStore.findById(reportId);
        if (stored.isEmpty() || stored.get().getBlendedValuation() == null) {
            return Optional.empty();
        }

        Map<ValuationMethod, Double> byMethod = new EnumMap<>(ValuationMethod.class);
        if (weights != null) {
            weights.forEach((key, w) -> {
                ValuationMethod method = ValuationMethod.fromKey(key);
                if (method != null && w != null) {
                    byMethod.put(method, w);
                } else {
                    log.warn("Ignoring weight for unknown method '{}'", key);
                }
            });
        }

        BlendedValuation reblended = valuationEngine.reblend(stored.get().getBlendedValuation(), byMethod);
        return reportStore.updateBlend(reportId, reblended);
    }
}
