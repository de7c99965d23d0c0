package com.jay.valuator.layer5_report;

import com.jay.valuator.model.BlendedValuation;
import com.jay.valuator.model.MethodologyWeight;
import com.jay.valuator.model.enums.ValuationMethod;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FallbackNarrativeTest {

    @Test
    void listsValueRangeAndEachWeight() {
        BlendedValuation blended = BlendedValuation.builder()
            .fairValue(120_000_000).fairValueLow(102_000_000).fairValueHigh(138_000_000)
            .methodologyWeights(List.of(
                new MethodologyWeight(ValuationMethod.COMPS, 0.6, "Weight 0.40: 6 quality comps"),
                new MethodologyWeight(ValuationMethod.LAST_ROUND, 0.4, "Weight 0.25: recent round")))
            .build();

        String[] lines = FallbackNarrative.of(blended).split("\n");

        assertThat(lines).hasSize(4);
        assertThat(lines[0]).isEqualTo(String.format("Blended fair value estimate: $%,.0f", 120_000_000.0));
        assertThat(lines[1]).isEqualTo(String.format("Range: $%,.0f - $%,.0f", 102_000_000.0, 138_000_000.0));
        assertThat(lines[2]).isEqualTo("- comps: weight 60% (Weight 0.40: 6 quality comps)");
        assertThat(lines[3]).isEqualTo("- last_round: weight 40% (Weight 0.25: recent round)");
    }

    @Test
    void noWeightsMeansTwoLines() {
        BlendedValuation blended = BlendedValuation.builder().fairValue(500).fairValueLow(400).fairValueHigh(600).build();

        assertThat(FallbackNarrative.of(blended)).isEqualTo("Blended fair value estimate: $500\nRange: $400 - $600");
    }
}
