package com.jay.valuator.layer5_report;

import com.jay.valuator.model.BlendedValuation;
import com.jay.valuator.model.MethodologyWeight;

/**
 * Deterministic narrative used when the LLM writer is unavailable:
 * fair value, range, then one line per contributing method.
 */
public final class FallbackNarrative {

    private FallbackNarrative() {}

    public static String of(BlendedValuation blended) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Blended fair value estimate: $%,.0f", blended.getFairValue())).append("\n");
        sb.append(String.format("Range: $%,.0f - $%,.0f", blended.getFairValueLow(), blended.getFairValueHigh()));
        for (MethodologyWeight w : blended.getMethodologyWeights()) {
            sb.append("\n").append(String.format("- %s: weight %.0f%% (%s)",
                w.method().key(), w.weight() * 100, w.rationale()));
        }
        return sb.toString();
    }
}
