package com.jay.valuator.layer4_pipeline;

import com.jay.valuator.config.ValuatorConfig;
import com.jay.valuator.layer1_data.AcquisitionException;
import com.jay.valuator.layer1_data.EnrichmentProvider;
import com.jay.valuator.layer1_data.FallbackEnrichment;
import com.jay.valuator.layer1_data.MarketDataProvider;
import com.jay.valuator.layer2_valuation.ComparableScorer;
import com.jay.valuator.layer2_valuation.DcfEngine;
import com.jay.valuator.layer2_valuation.LastRoundAdjuster;
import com.jay.valuator.layer2_valuation.ValuationBlender;
import com.jay.valuator.layer3_engine.ValuationEngine;
import com.jay.valuator.layer5_report.NarrativeWriter;
import com.jay.valuator.layer6_persistence.ReportStore;
import com.jay.valuator.model.ComparableCompany;
import com.jay.valuator.model.PipelineStep;
import com.jay.valuator.model.StepEvent;
import com.jay.valuator.model.ValuationReport;
import com.jay.valuator.model.ValuationRequest;
import com.jay.valuator.model.enums.StepStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PipelineOrchestratorTest {

    private EnrichmentProvider enrichment;
    private MarketDataProvider marketData;
    private NarrativeWriter writer;
    private ReportStore store;
    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        ValuatorConfig config = new ValuatorConfig();
        ValuationEngine engine = new ValuationEngine(new ComparableScorer(config), new DcfEngine(config),
            new LastRoundAdjuster(config), new ValuationBlender(config), config);
        enrichment = mock(EnrichmentProvider.class);
        marketData = mock(MarketDataProvider.class);
        writer = mock(NarrativeWriter.class);
        store = mock(ReportStore.class);
        orchestrator = new PipelineOrchestrator(enrichment, marketData, engine, writer, store);
    }

    private static ComparableCompany comp(String ticker, double revenue, double multiple) {
        return ComparableCompany.builder()
            .ticker(ticker).name(ticker).sector("Technology")
            .marketCap(revenue * multiple).enterpriseValue(revenue * multiple)
            .revenue(revenue).ebitda(revenue * 0.25)
            .evToRevenue(multiple).evToEbitda(multiple * 4)
            .build();
    }

    private static ValuationRequest revenueOnly() {
        return ValuationRequest.builder()
            .companyName("Acme Analytics")
            .sector("Technology")
            .revenue(50_000_000.0)
            .comparableTickers(List.of("AAA", "BBB", "CCC"))
            .build();
    }

    private void stubHappyPath(ValuationRequest request) {
        when(enrichment.enrich(any(), anyList())).thenReturn(FallbackEnrichment.from(request));
        when(marketData.fetchComparables(List.of("AAA", "BBB", "CCC"))).thenReturn(List.of(
            comp("AAA", 40_000_000, 6.0), comp("BBB", 50_000_000, 8.0), comp("CCC", 60_000_000, 10.0)));
        when(writer.write(any(), any(), anyMap(), anyList())).thenReturn("Acme is worth about $400M.");
    }

    @Test
    void revenueOnlyRunProducesCompsValuation() {
        ValuationRequest request = revenueOnly();
        stubHappyPath(request);

        ValuationReport report = orchestrator.run(request);

        assertThat(report.getError()).isNull();
        assertThat(report.getBlendedValuation().getCompsResult()).isNotNull();
        assertThat(report.getBlendedValuation().getDcfResult()).isNull();
        assertThat(report.getBlendedValuation().getLastRoundResult()).isNull();
        assertThat(report.getNarrative()).isEqualTo("Acme is worth about $400M.");
        assertThat(report.getPipelineSteps()).extracting(PipelineStep::getStepName)
            .containsExactly("validate", "enrich", "fetch", "valuate", "narrate", "persist");
        assertThat(report.getPipelineSteps()).extracting(PipelineStep::getStatus)
            .containsOnly(StepStatus.COMPLETED);
        assertThat(report.getAssumptions()).containsEntry("revenue_source", "user-provided");
        assertThat(report.getMarketDataSummary()).containsEntry("comparables_count", 3);
        verify(store).save(report);
        verify(marketData, never()).fetchIndexReturn(any(), any());
    }

    @Test
    void insufficientDataSkipsNarrativeButStillPersists() {
        ValuationRequest request = ValuationRequest.builder().companyName("Stealth Co").build();
        when(enrichment.enrich(any(), anyList())).thenReturn(FallbackEnrichment.from(request));

        ValuationReport report = orchestrator.run(request);

        assertThat(report.getBlendedValuation()).isNull();
        assertThat(report.getError()).contains("Unable to perform valuation for \"Stealth Co\"");
        assertThat(report.getMissingData()).isNotEmpty();
        assertThat(report.getPipelineSteps())
            .filteredOn(s -> s.getStepName().equals("valuate"))
            .singleElement()
            .satisfies(s -> assertThat(s.getStatus()).isEqualTo(StepStatus.FAILED));
        assertThat(report.getPipelineSteps())
            .filteredOn(s -> s.getStepName().equals("narrate"))
            .singleElement()
            .satisfies(s -> {
                assertThat(s.getStatus()).isEqualTo(StepStatus.SKIPPED);
                assertThat(s.getError()).isEqualTo(PipelineOrchestrator.NARRATE_SKIPPED);
            });
        verify(writer, never()).write(any(), any(), anyMap(), anyList());
        verify(marketData, never()).fetchComparables(anyList());
        verify(store).save(report);
    }

    @Test
    void enrichmentFailureFallsBackToRawInputs() {
        ValuationRequest request = revenueOnly();
        stubHappyPath(request);
        when(enrichment.enrich(any(), anyList())).thenThrow(new AcquisitionException("research down"));

        ValuationReport report = orchestrator.run(request);

        assertThat(report.getEnrichedInput().isFallback()).isTrue();
        assertThat(report.getEnrichedInput().getEnrichmentNotes()).isEqualTo(FallbackEnrichment.NOTES);
        assertThat(report.getPipelineSteps().get(1)).satisfies(s -> {
            assertThat(s.getStepName()).isEqualTo("enrich");
            assertThat(s.getStatus()).isEqualTo(StepStatus.FAILED);
            assertThat(s.getError()).isEqualTo("research down");
        });
        assertThat(report.getBlendedValuation().getFairValue()).isPositive();
    }

    @Test
    void fetchFailureLeavesMarketDataEmpty() {
        ValuationRequest request = revenueOnly();
        stubHappyPath(request);
        when(marketData.fetchComparables(anyList())).thenThrow(new IllegalStateException("network"));

        ValuationReport report = orchestrator.run(request);

        assertThat(report.getMarketDataSummary()).containsEntry("comparables_count", 0);
        assertThat(report.getError()).isNotNull();
        assertThat(report.getMissingData()).anyMatch(m -> m.startsWith("Comparable companies:"));
    }

    @Test
    void writerFailureUsesFallbackNarrative() {
        ValuationRequest request = revenueOnly();
        stubHappyPath(request);
        when(writer.write(any(), any(), anyMap(), anyList())).thenThrow(new AcquisitionException("no key"));

        ValuationReport report = orchestrator.run(request);

        assertThat(report.getNarrative()).startsWith("Blended fair value estimate: $");
        assertThat(report.getPipelineSteps())
            .filteredOn(s -> s.getStepName().equals("narrate"))
            .singleElement()
            .satisfies(s -> assertThat(s.getStatus()).isEqualTo(StepStatus.COMPLETED));
    }

    @Test
    void persistFailureIsRecordedNotThrown() {
        ValuationRequest request = revenueOnly();
        stubHappyPath(request);
        when(store.save(any())).thenThrow(new IllegalStateException("disk full"));

        ValuationReport report = orchestrator.run(request);

        assertThat(report.getPipelineSteps()).last().satisfies(s -> {
            assertThat(s.getStepName()).isEqualTo("persist");
            assertThat(s.getStatus()).isEqualTo(StepStatus.FAILED);
        });
    }

    @Test
    void busReceivesEveryTransitionThenCompletes() throws Exception {
        ValuationRequest request = revenueOnly();
        stubHappyPath(request);
        StatusEventBus bus = new StatusEventBus("run-42");

        ValuationReport report = orchestrator.run(request, "run-42", bus);

        assertThat(report.getId()).isEqualTo("run-42");
        assertThat(bus.isComplete()).isTrue();
        List<StepEvent> events = bus.awaitEvents(Duration.ofMillis(10));
        assertThat(events).hasSize(11);
        assertThat(events.get(0).step()).isEqualTo("validate");
        assertThat(events.get(0).status()).isEqualTo(StepStatus.COMPLETED);
        assertThat(events.get(1).status()).isEqualTo(StepStatus.RUNNING);
        assertThat(events.get(10).step()).isEqualTo("persist");
        assertThat(events.get(10).status()).isEqualTo(StepStatus.COMPLETED);
        assertThat(bus.isDrained()).isTrue();
    }
}
