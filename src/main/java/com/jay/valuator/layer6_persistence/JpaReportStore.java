package com.jay.valuator.layer6_persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.jay.valuator.entity.AuditLogEntry;
import com.jay.valuator.entity.LlmCallRecord;
import com.jay.valuator.entity.ValuationRecord;
import com.jay.valuator.model.AuditLog;
import com.jay.valuator.model.BlendedValuation;
import com.jay.valuator.model.LlmCallLog;
import com.jay.valuator.model.PipelineStep;
import com.jay.valuator.model.ReportSummary;
import com.jay.valuator.model.ValuationReport;
import com.jay.valuator.model.enums.StepStatus;
import com.jay.valuator.repository.AuditLogEntryRepository;
import com.jay.valuator.repository.LlmCallRecordRepository;
import com.jay.valuator.repository.ValuationRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Layer 6: Persistence.
 *
 * Stores each report as one JSON document in {@code valuation_records}, with
 * its step rows and LLM calls copied into their own tables for auditing.
 * Saving an existing id replaces the document and its audit rows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaReportStore implements ReportStore {

    private final ValuationRecordRepository recordRepo;
    private final AuditLogEntryRepository auditRepo;
    private final LlmCallRecordRepository llmCallRepo;

    private final ObjectMapper mapper = new ObjectMapper()
        .findAndRegisterModules()
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    @Override
    @Transactional
    public String save(ValuationReport report) {
        if (report.getCreatedAt() == null) report.setCreatedAt(LocalDateTime.now());
        double fv = report.fairValue();

        recordRepo.save(ValuationRecord.builder()
            .id(report.getId())
            .companyName(report.getCompanyName())
            .fairValue(report.getBlendedValuation() != null ? fv : null)
            .reportJson(toJson(report))
            .createdAt(report.getCreatedAt())
            .build());

        auditRepo.deleteByValuationId(report.getId());
        llmCallRepo.deleteByValuationId(report.getId());

        LocalDateTime now = LocalDateTime.now();
        for (PipelineStep step : report.getPipelineSteps()) {
            auditRepo.save(AuditLogEntry.builder()
                .valuationId(report.getId())
                .stepName(step.getStepName())
                .status(step.getStatus().wire())
                .durationMs(step.getDurationMs())
                .error(truncate(step.getError(), 2000))
                .startedAt(step.getStartedAt())
                .completedAt(step.getCompletedAt())
                .createdAt(now)
                .build());
        }
        for (LlmCallLog call : report.getLlmCallLogs()) {
            llmCallRepo.save(LlmCallRecord.builder()
                .valuationId(report.getId())
                .stepName(call.getStepName())
                .model(call.getModel())
                .systemPrompt(call.getSystemPrompt())
                .userPrompt(call.getUserPrompt())
                .response(call.getResponse())
                .tokensUsed(call.getTokensUsed())
                .durationMs(call.getDurationMs())
                .calledAt(call.getTimestamp())
                .build());
        }

        log.info("Saved report {} for {} ({} steps, {} LLM calls)", report.getId(), report.getCompanyName(),
            report.getPipelineSteps().size(), report.getLlmCallLogs().size());
        return report.getId();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ValuationReport> findById(String id) {
        return recordRepo.findById(id).map(r -> fromJson(r.getReportJson()));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReportSummary> list() {
        return recordRepo.findAllByOrderByCreatedAtDesc().stream()
            .map(r -> new ReportSummary(r.getId(), r.getCompanyName(), r.getFairValue(), r.getCreatedAt()))
            .toList();
    }

    @Override
    @Transactional
    public boolean delete(String id) {
        if (!recordRepo.existsById(id)) return false;
        auditRepo.deleteByValuationId(id);
        llmCallRepo.deleteByValuationId(id);
        recordRepo.deleteById(id);
        log.info("Deleted report {}", id);
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AuditLog> auditLog(String id) {
        if (!recordRepo.existsById(id)) return Optional.empty();

        List<PipelineStep> steps = auditRepo.findByValuationIdOrderByIdAsc(id).stream()
            .map(a -> PipelineStep.builder()
                .stepName(a.getStepName())
                .status(StepStatus.fromWire(a.getStatus()))
                .startedAt(a.getStartedAt())
                .completedAt(a.getCompletedAt())
                .durationMs(a.getDurationMs())
                .error(a.getError())
                .build())
            .toList();
        List<LlmCallLog> calls = llmCallRepo.findByValuationIdOrderByIdAsc(id).stream()
            .map(c -> LlmCallLog.builder()
                .stepName(c.getStepName())
                .model(c.getModel())
                .systemPrompt(c.getSystemPrompt())
                .userPrompt(c.getUserPrompt())
                .response(c.getResponse())
                .tokensUsed(c.getTokensUsed())
                .durationMs(c.getDurationMs() != null ? c.getDurationMs() : 0)
                .timestamp(c.getCalledAt())
                .build())
            .toList();
        return Optional.of(new AuditLog(id, steps, calls));
    }

    @Override
    @Transactional
    public Optional<ValuationReport> updateBlend(String id, BlendedValuation blended) {
        Optional<ValuationRecord> existing = recordRepo.findById(id);
        if (existing.isEmpty()) return Optional.empty();

        ValuationRecord record = existing.get();
        ValuationReport report = fromJson(record.getReportJson());
        report.setBlendedValuation(blended);
        record.setReportJson(toJson(report));
        record.setFairValue(blended.getFairValue());
        recordRepo.save(record);
        log.info("Re-weighted report {}: fair value now {}", id, String.format("%,.0f", blended.getFairValue()));
        return Optional.of(report);
    }

    // ── JSON ──────────────────────────────────────────────────────────────────

    private String toJson(ValuationReport report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise report " + report.getId(), e);
        }
    }

    private ValuationReport fromJson(String json) {
        try {
            return mapper.readValue(json, ValuationReport.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored report is not readable: " + e.getMessage(), e);
        }
    }

    private static String truncate(String s, int max) {
        return s != null && s.length() > max ? s.substring(0, max) : s;
    }
}
