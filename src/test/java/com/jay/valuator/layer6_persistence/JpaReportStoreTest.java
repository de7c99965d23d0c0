package com.jay.valuator.layer6_persistence;

import com.jay.valuator.model.AuditLog;
import com.jay.valuator.model.BlendedValuation;
import com.jay.valuator.model.CompsResult;
import com.jay.valuator.model.LastRoundResult;
import com.jay.valuator.model.LlmCallLog;
import com.jay.valuator.model.MethodologyWeight;
import com.jay.valuator.model.PipelineStep;
import com.jay.valuator.model.ReportSummary;
import com.jay.valuator.model.ValuationReport;
import com.jay.valuator.model.ValuationRequest;
import com.jay.valuator.model.enums.StepStatus;
import com.jay.valuator.model.enums.ValuationMethod;
import com.jay.valuator.repository.AuditLogEntryRepository;
import com.jay.valuator.repository.LlmCallRecordRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DataJpaTest
@Import(JpaReportStore.class)
class JpaReportStoreTest {

    @Autowired private JpaReportStore store;
    @Autowired private AuditLogEntryRepository auditRepo;
    @Autowired private LlmCallRecordRepository llmCallRepo;

    private static ValuationReport report(String id, String company, LocalDateTime createdAt) {
        LocalDateTime t = LocalDateTime.of(2025, 3, 1, 10, 0);
        CompsResult comps = CompsResult.builder()
            .enterpriseValue(400_000_000).evToRevenueMedian(8.0).comparableCount(3)
            .compsUsed(new ArrayList<>(List.of("AAA", "BBB", "CCC")))
            .build();
        LastRoundResult lastRound = LastRoundResult.builder()
            .enterpriseValue(115_000_000).lastRoundValuation(100_000_000).adjustmentFactor(1.15).monthsSinceRound(6)
            .build();
        return ValuationReport.builder()
            .id(id)
            .companyName(company)
            .request(ValuationRequest.builder().companyName(company).revenue(50_000_000.0).build())
            .blendedValuation(BlendedValuation.builder()
                .fairValue(300_000_000).fairValueLow(255_000_000).fairValueHigh(345_000_000)
                .methodologyWeights(List.of(
                    new MethodologyWeight(ValuationMethod.COMPS, 0.6, "comps"),
                    new MethodologyWeight(ValuationMethod.LAST_ROUND, 0.4, "round")))
                .compsResult(comps)
                .lastRoundResult(lastRound)
                .build())
            .narrative("Narrative.")
            .pipelineSteps(new ArrayList<>(List.of(
                PipelineStep.builder().stepName("validate").status(StepStatus.COMPLETED)
                    .startedAt(t).completedAt(t).durationMs(0.0).build(),
                PipelineStep.builder().stepName("enrich").status(StepStatus.FAILED)
                    .startedAt(t).completedAt(t).durationMs(12.5).error("research down").build())))
            .llmCallLogs(new ArrayList<>(List.of(LlmCallLog.builder()
                .stepName("narrate").model("gpt-4o-mini").systemPrompt("sys").userPrompt("user")
                .response("Narrative.").tokensUsed(321).durationMs(800.0).timestamp(t).build())))
            .createdAt(createdAt)
            .build();
    }

    @Test
    void savedReportReadsBackWhole() {
        store.save(report("r-1", "Acme", LocalDateTime.of(2025, 3, 1, 10, 0)));

        ValuationReport loaded = store.findById("r-1").orElseThrow();

        assertThat(loaded.getCompanyName()).isEqualTo("Acme");
        assertThat(loaded.getNarrative()).isEqualTo("Narrative.");
        assertThat(loaded.fairValue()).isEqualTo(300_000_000.0);
        assertThat(loaded.getBlendedValuation().getMethodologyWeights())
            .extracting(MethodologyWeight::method)
            .containsExactly(ValuationMethod.COMPS, ValuationMethod.LAST_ROUND);
        assertThat(loaded.getBlendedValuation().getCompsResult().getCompsUsed()).containsExactly("AAA", "BBB", "CCC");
        assertThat(loaded.getBlendedValuation().getDcfResult()).isNull();
        assertThat(loaded.getPipelineSteps()).extracting(PipelineStep::getStatus)
            .containsExactly(StepStatus.COMPLETED, StepStatus.FAILED);
        assertThat(loaded.getCreatedAt()).isEqualTo(LocalDateTime.of(2025, 3, 1, 10, 0));
    }

    @Test
    void missingReportIsEmpty() {
        assertThat(store.findById("nope")).isEmpty();
        assertThat(store.auditLog("nope")).isEmpty();
        assertThat(store.delete("nope")).isFalse();
    }

    @Test
    void listIsNewestFirst() {
        store.save(report("old", "Old Co", LocalDateTime.of(2024, 1, 1, 0, 0)));
        store.save(report("new", "New Co", LocalDateTime.of(2025, 1, 1, 0, 0)));
        ValuationReport failed = report("failed", "Failed Co", LocalDateTime.of(2024, 6, 1, 0, 0));
        failed.setBlendedValuation(null);
        store.save(failed);

        List<ReportSummary> summaries = store.list();

        assertThat(summaries).extracting(ReportSummary::id).containsExactly("new", "failed", "old");
        assertThat(summaries.get(1).fairValue()).isNull();
        assertThat(summaries.get(0).fairValue()).isEqualTo(300_000_000.0);
    }

    @Test
    void auditLogMirrorsStepsAndCalls() {
        store.save(report("r-2", "Acme", LocalDateTime.now()));

        AuditLog log = store.auditLog("r-2").orElseThrow();

        assertThat(log.valuationId()).isEqualTo("r-2");
        assertThat(log.steps()).extracting(PipelineStep::getStepName).containsExactly("validate", "enrich");
        assertThat(log.steps().get(1).getError()).isEqualTo("research down");
        assertThat(log.steps().get(1).getDurationMs()).isEqualTo(12.5);
        assertThat(log.llmCalls()).singleElement().satisfies(c -> {
            assertThat(c.getModel()).isEqualTo("gpt-4o-mini");
            assertThat(c.getTokensUsed()).isEqualTo(321);
            assertThat(c.getUserPrompt()).isEqualTo("user");
        });
    }

    @Test
    void resavingReplacesAuditRows() {
        ValuationReport r = report("r-3", "Acme", LocalDateTime.now());
        store.save(r);
        store.save(r);

        assertThat(auditRepo.findByValuationIdOrderByIdAsc("r-3")).hasSize(2);
        assertThat(llmCallRepo.findByValuationIdOrderByIdAsc("r-3")).hasSize(1);
    }

    @Test
    void deleteRemovesReportAndAuditRows() {
        store.save(report("r-4", "Acme", LocalDateTime.now()));

        assertThat(store.delete("r-4")).isTrue();

        assertThat(store.findById("r-4")).isEmpty();
        assertThat(auditRepo.findByValuationIdOrderByIdAsc("r-4")).isEmpty();
        assertThat(llmCallRepo.findByValuationIdOrderByIdAsc("r-4")).isEmpty();
    }

    @Test
    void updateBlendRewritesValuationOnly() {
        store.save(report("r-5", "Acme", LocalDateTime.now()));
        ValuationReport stored = store.findById("r-5").orElseThrow();
        BlendedValuation reblended = stored.getBlendedValuation();
        reblended.setFairValue(400_000_000);
        reblended.setMethodologyWeights(List.of(new MethodologyWeight(ValuationMethod.COMPS, 1.0, "Custom weight 1.00")));

        ValuationReport updated = store.updateBlend("r-5", reblended).orElseThrow();

        assertThat(updated.fairValue()).isEqualTo(400_000_000.0);
        assertThat(updated.getNarrative()).isEqualTo("Narrative.");
        assertThat(store.findById("r-5").orElseThrow().getBlendedValuation().getMethodologyWeights())
            .singleElement().satisfies(w -> assertThat(w.weight()).isCloseTo(1.0, within(1e-9)));
        assertThat(store.list()).singleElement()
            .satisfies(s -> assertThat(s.fairValue()).isEqualTo(400_000_000.0));
        assertThat(store.updateBlend("missing", reblended)).isEmpty();
    }
}
