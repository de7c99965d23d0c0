package com.jay.valuator.layer3_engine;

import com.jay.valuator.config.ValuatorConfig;
import com.jay.valuator.layer1_data.FallbackEnrichment;
import com.jay.valuator.layer2_valuation.ComparableScorer;
import com.jay.valuator.layer2_valuation.DcfEngine;
import com.jay.valuator.layer2_valuation.LastRoundAdjuster;
import com.jay.valuator.layer2_valuation.ValuationBlender;
import com.jay.valuator.model.BlendedValuation;
import com.jay.valuator.model.ComparableCompany;
import com.jay.valuator.model.EnrichedInput;
import com.jay.valuator.model.FinancialProjections;
import com.jay.valuator.model.MarketData;
import com.jay.valuator.model.ValuationRequest;
import com.jay.valuator.model.enums.ValuationMethod;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ValuationEngineTest {

    private final ValuatorConfig config = new ValuatorConfig();
    private final ValuationEngine engine = new ValuationEngine(
        new ComparableScorer(config), new DcfEngine(config), new LastRoundAdjuster(config),
        new ValuationBlender(config), config);

    private static ComparableCompany comp(String ticker, double revenue, double evToRevenue) {
        return ComparableCompany.builder()
            .ticker(ticker).name(ticker).sector("Technology")
            .marketCap(revenue * evToRevenue).enterpriseValue(revenue * evToRevenue)
            .revenue(revenue).ebitda(revenue * 0.2)
            .evToRevenue(evToRevenue).evToEbitda(evToRevenue * 5)
            .build();
    }

    private static MarketData threeComps() {
        return new MarketData(new ArrayList<>(List.of(
            comp("AAA", 40_000_000, 6.0),
            comp("BBB", 50_000_000, 8.0),
            comp("CCC", 60_000_000, 10.0))), null);
    }

    private static ValuationRequest.ValuationRequestBuilder base() {
        return ValuationRequest.builder()
            .companyName("Acme Analytics")
            .sector("Technology")
            .comparableTickers(List.of("AAA", "BBB", "CCC"));
    }

    @Test
    void revenueOnlyRequestRunsCompsAlone() {
        ValuationRequest request = base().revenue(50_000_000.0).build();

        BlendedValuation blended = engine.run(request, FallbackEnrichment.from(request), threeComps());

        assertThat(blended.getCompsResult()).isNotNull();
        assertThat(blended.getDcfResult()).isNull();
        assertThat(blended.getLastRoundResult()).isNull();
        assertThat(blended.getFairValue()).isCloseTo(400_000_000.0, within(1e-3));
        assertThat(blended.getCompsResult().isEstimated()).isFalse();
    }

    @Test
    void nothingUsableRaisesInsufficientData() {
        ValuationRequest request = base().build();

        assertThatThrownBy(() -> engine.run(request, FallbackEnrichment.from(request), MarketData.empty()))
            .isInstanceOf(InsufficientDataException.class)
            .hasMessageContaining("Acme Analytics")
            .satisfies(e -> assertThat(((InsufficientDataException) e).getMissingFields())
                .isNotEmpty()
                .anyMatch(m -> m.startsWith("Revenue:")));
    }

    @Test
    void revenueWithoutComparablesNamesTheMissingComps() {
        ValuationRequest request = base().revenue(50_000_000.0).build();

        assertThatThrownBy(() -> engine.run(request, FallbackEnrichment.from(request), MarketData.empty()))
            .isInstanceOf(InsufficientDataException.class)
            .satisfies(e -> assertThat(((InsufficientDataException) e).getMissingFields())
                .anyMatch(m -> m.startsWith("Comparable companies:")));
    }

    @Test
    void estimatedRevenueMarksCompsEstimated() {
        ValuationRequest request = base().build();
        EnrichedInput enriched = EnrichedInput.builder()
            .sector("Technology")
            .applicableMethods(List.of(ValuationMethod.COMPS))
            .estimatedFinancials(EnrichedInput.EstimatedFinancials.builder()
                .estimatedRevenue(50_000_000.0).confidence("medium").build())
            .researchSources(List.of(new EnrichedInput.ResearchSource("Press release", "https://example.com/pr")))
            .build();

        BlendedValuation blended = engine.run(request, enriched, threeComps());

        assertThat(blended.getCompsResult().isEstimated()).isTrue();
        assertThat(blended.getCompsResult().getWarnings())
            .contains("Revenue source: LLM estimate (medium confidence). Sources: Press release (https://example.com/pr)");
    }

    @Test
    void estimatedProjectionsDriveAnEstimatedDcf() {
        ValuationRequest request = base().revenue(50_000_000.0).build();
        EnrichedInput enriched = EnrichedInput.builder()
            .sector("Technology")
            .applicableMethods(List.of(ValuationMethod.COMPS, ValuationMethod.DCF))
            .estimatedProjections(EnrichedInput.EstimatedProjections.builder()
                .estimatedGrowthRates(List.of(0.30, 0.25, 0.20))
                .estimatedEbitdaMargins(List.of(0.15))
                .source("industry reports")
                .build())
            .build();

        BlendedValuation blended = engine.run(request, enriched, threeComps());

        assertThat(blended.getDcfResult()).isNotNull();
        assertThat(blended.getDcfResult().isEstimated()).isTrue();
        assertThat(blended.getDcfResult().getWarnings())
            .anyMatch(w -> w.startsWith("DCF inputs are model-estimated (low confidence)"));
        assertThat(blended.getMethodologyWeights())
            .filteredOn(w -> w.method() == ValuationMethod.DCF)
            .singleElement()
            .satisfies(w -> assertThat(w.rationale()).contains("model-estimated inputs"));
    }

    @Test
    void estimatedProjectionsCompoundGrowthAndPadMargins() {
        EnrichedInput.EstimatedProjections ep = EnrichedInput.EstimatedProjections.builder()
            .estimatedGrowthRates(List.of(0.10, 0.20))
            .estimatedWacc(0.15)
            .estimatedTerminalGrowthRate(0.02)
            .build();

        FinancialProjections p = engine.buildEstimatedProjections(100.0, ep);

        assertThat(p.getRevenueProjections()).hasSize(2);
        assertThat(p.getRevenueProjections().get(0)).isCloseTo(110.0, within(1e-9));
        assertThat(p.getRevenueProjections().get(1)).isCloseTo(132.0, within(1e-9));
        assertThat(p.getEbitdaMargins()).containsExactly(0.20, 0.20);
        assertThat(p.getWacc()).isEqualTo(0.15);
        assertThat(p.getTerminalGrowthRate()).isEqualTo(0.02);
    }

    @Test
    void userInputsFarFromResearchAreFlagged() {
        FinancialProjections user = FinancialProjections.builder()
            .revenueProjections(List.of(10_000_000.0, 11_000_000.0, 12_100_000.0))
            .ebitdaMargins(List.of(0.2))
            .wacc(0.20)
            .terminalGrowthRate(0.03)
            .build();
        ValuationRequest request = base().revenue(10_000_000.0).financialProjections(user).build();
        EnrichedInput enriched = EnrichedInput.builder()
            .sector("Technology")
            .applicableMethods(List.of(ValuationMethod.DCF))
            .estimatedProjections(EnrichedInput.EstimatedProjections.builder()
                .estimatedGrowthRates(List.of(0.10, 0.10))
                .estimatedWacc(0.12)
                .estimatedTerminalGrowthRate(0.03)
                .build())
            .build();

        BlendedValuation blended = engine.run(request, enriched, MarketData.empty());

        assertThat(blended.getDcfResult().isEstimated()).isFalse();
        assertThat(blended.getDcfResult().getWarnings())
            .anyMatch(w -> w.startsWith("WACC mismatch: user provided 20.0% vs research estimate 12.0%"))
            .noneMatch(w -> w.startsWith("Terminal growth rate mismatch"))
            .noneMatch(w -> w.startsWith("Growth rate mismatch"));
    }

    @Test
    void reblendAppliesCustomWeights() {
        ValuationRequest request = base().revenue(50_000_000.0)
            .lastRoundValuation(100_000_000.0).lastRoundDate("2024-01-15").build();
        BlendedValuation first = engine.run(request, FallbackEnrichment.from(request), threeComps());

        BlendedValuation reweighted = engine.reblend(first,
            Map.of(ValuationMethod.COMPS, 1.0, ValuationMethod.LAST_ROUND, 0.0));

        assertThat(reweighted.getFairValue()).isCloseTo(first.getCompsResult().getEnterpriseValue(), within(1e-3));
        assertThat(reweighted.getCompsResult()).isSameAs(first.getCompsResult());
    }
}
