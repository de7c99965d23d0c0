package com.jay.valuator.controller;

import com.jay.valuator.config.ValuatorConfig;
import com.jay.valuator.layer1_data.ProjectionsUploadParser;
import com.jay.valuator.layer4_pipeline.StatusBusRegistry;
import com.jay.valuator.layer4_pipeline.StatusEventBus;
import com.jay.valuator.layer4_pipeline.ValuationRunService;
import com.jay.valuator.layer6_persistence.ReportStore;
import com.jay.valuator.model.AuditLog;
import com.jay.valuator.model.FinancialProjections;
import com.jay.valuator.model.ReportSummary;
import com.jay.valuator.model.StepEvent;
import com.jay.valuator.model.ValuationReport;
import com.jay.valuator.model.ValuationRequest;
import jakarta.annotation.PreDestroy;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * REST API: Valuations.
 *
 * Endpoints:
 *   POST   /api/valuations                     run the pipeline and return the report
 *   POST   /api/valuations/async               start a background run, returns id + stream URL
 *   GET    /api/valuations/{id}/stream         server-sent step events, then "complete"
 *   POST   /api/valuations/{id}/reweight       re-blend a stored report with custom weights
 *   GET    /api/valuations                     report summaries, newest first
 *   GET    /api/valuations/{id}                full report
 *   DELETE /api/valuations/{id}                delete a report and its audit rows
 *   GET    /api/valuations/{id}/audit-log      stored steps and LLM calls
 *   POST   /api/valuations/upload-projections  parse a .json / .csv projections file
 */
@Slf4j
@RestController
@RequestMapping("/api/valuations")
@RequiredArgsConstructor
public class ValuationController {

    private final ValuationRunService runService;
    private final StatusBusRegistry busRegistry;
    private final ReportStore reportStore;
    private final ProjectionsUploadParser uploadParser;
    private final ValuatorConfig config;

    private final ExecutorService streamExecutor = Executors.newCachedThreadPool();

    public record ReweightRequest(Map<String, Double> weights) {}

    @PreDestroy
    public void shutdown() {
        streamExecutor.shutdownNow();
    }

    // ── POST /api/valuations ───────────────────────────────────────────────────

    @PostMapping
    public ResponseEntity<ValuationReport> create(@Valid @RequestBody ValuationRequest request) {
        return ResponseEntity.ok(runService.runSync(request));
    }

    // ── POST /api/valuations/async ─────────────────────────────────────────────

    @PostMapping("/async")
    public ResponseEntity<Map<String, String>> createAsync(@Valid @RequestBody ValuationRequest request) {
        String reportId = runService.startAsync(request);
        return ResponseEntity.ok(Map.of(
            "report_id", reportId,
            "stream_url", "/api/valuations/" + reportId + "/stream"
        ));
    }

    // ── GET /api/valuations/{id}/stream ────────────────────────────────────────

    @GetMapping(value = "/{id}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String id) {
        StatusEventBus bus = busRegistry.get(id)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No active pipeline for this ID"));
        SseEmitter emitter = new SseEmitter(0L);
        emitter.onCompletion(() -> busRegistry.removeIfComplete(id));
        emitter.onTimeout(() -> busRegistry.removeIfComplete(id));
        emitter.onError(e -> busRegistry.removeIfComplete(id));
        streamExecutor.execute(() -> relay(id, bus, emitter));
        return emitter;
    }

    private void relay(String id, StatusEventBus bus, SseEmitter emitter) {
        Duration poll = Duration.ofSeconds(config.pipeline().getStreamPollTimeoutSeconds());
        try {
            while (true) {
                for (StepEvent evt : bus.awaitEvents(poll)) {
                    emitter.send(SseEmitter.event().data(stepPayload(evt), MediaType.APPLICATION_JSON));
                }
                if (bus.isComplete() && bus.isDrained()) {
                    Map<String, Object> done = new LinkedHashMap<>();
                    done.put("type", "complete");
                    done.put("report_id", id);
                    emitter.send(SseEmitter.event().data(done, MediaType.APPLICATION_JSON));
                    busRegistry.remove(id);
                    emitter.complete();
                    return;
                }
            }
        } catch (IOException e) {
            log.warn("Stream for {} closed by client: {}", id, e.getMessage());
            busRegistry.removeIfComplete(id);
            emitter.completeWithError(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            emitter.completeWithError(e);
        }
    }

    private static Map<String, Object> stepPayload(StepEvent evt) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", "step");
        m.put("step_name", evt.step());
        m.put("status", evt.status().wire());
        m.put("timestamp", evt.timestamp() != null ? evt.timestamp().toString() : null);
        m.put("duration_ms", evt.durationMs());
        m.put("error", evt.error());
        return m;
    }

    // ── POST /api/valuations/{id}/reweight ─────────────────────────────────────

    @PostMapping("/{id}/reweight")
    public ResponseEntity<ValuationReport> reweight(@PathVariable String id, @RequestBody ReweightRequest body) {
        try {
            return runService.reweight(id, body.weights())
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Valuation not found"));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    // ── GET /api/valuations ────────────────────────────────────────────────────

    @GetMapping
    public ResponseEntity<List<ReportSummary>> list() {
        return ResponseEntity.ok(reportStore.list());
    }

    // ── GET /api/valuations/{id} ───────────────────────────────────────────────

    @GetMapping("/{id}")
    public ResponseEntity<ValuationReport> get(@PathVariable String id) {
        return reportStore.findById(id)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Valuation not found"));
    }

    // ── DELETE /api/valuations/{id} ────────────────────────────────────────────

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable String id) {
        if (!reportStore.delete(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Valuation not found");
        }
        return ResponseEntity.ok(Map.of("status", "deleted"));
    }

    // ── GET /api/valuations/{id}/audit-log ─────────────────────────────────────

    @GetMapping("/{id}/audit-log")
    public ResponseEntity<AuditLog> auditLog(@PathVariable String id) {
        return reportStore.auditLog(id)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Valuation not found"));
    }

    // ── POST /api/valuations/upload-projections ────────────────────────────────

    @PostMapping(value = "/upload-projections", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<FinancialProjections> uploadProjections(@RequestParam("file") MultipartFile file) {
        try {
            return ResponseEntity.ok(uploadParser.parse(file.getOriginalFilename(), file.getBytes()));
        } catch (IllegalArgumentException | IOException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }
}
