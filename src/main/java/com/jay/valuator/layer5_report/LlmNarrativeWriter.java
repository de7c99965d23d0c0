package com.jay.valuator.layer5_report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jay.valuator.layer1_data.AcquisitionException;
import com.jay.valuator.layer1_data.OpenAiClient;
import com.jay.valuator.model.BlendedValuation;
import com.jay.valuator.model.CompsResult;
import com.jay.valuator.model.DcfResult;
import com.jay.valuator.model.LastRoundResult;
import com.jay.valuator.model.LlmCallLog;
import com.jay.valuator.model.MethodologyWeight;
import com.jay.valuator.model.ValuationRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Layer 5: Narrative.
 * Asks the LLM for a 2-4 paragraph auditor-facing write-up of the blended valuation.
 * Estimated inputs are passed along so the narrative can disclose them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LlmNarrativeWriter implements NarrativeWriter {

    static final String SYSTEM_PROMPT =
        "You are a senior valuation analyst writing a fair value assessment narrative "
        + "for an auditor reviewing a VC portfolio company. Be precise, reference the data, "
        + "and explain the methodology weighting rationale. Write 2-4 paragraphs.\n\n"
        + "If any inputs were model-estimated (rather than user-provided), prominently disclose "
        + "which values were estimated, the confidence level, and the source. This is critical "
        + "for audit transparency.";

    static final List<String> ESTIMATION_KEYS = List.of(
        "revenue_source", "projections_source", "projections_confidence",
        "projections_reasoning", "last_round_source", "last_round_confidence",
        "last_round_reasoning", "estimated_growth_rates", "estimated_ebitda_margins",
        "estimated_wacc", "estimated_terminal_growth_rate",
        "estimated_last_round_valuation", "estimated_last_round_date");

    private final OpenAiClient openAi;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String write(ValuationRequest request, BlendedValuation blended,
                        Map<String, Object> assumptions, List<LlmCallLog> callLog) {
        String userPrompt = "Write a valuation narrative for:\n" + promptData(request, blended, assumptions);
        String narrative = openAi.complete(SYSTEM_PROMPT, userPrompt, "narrate", callLog);
        if (narrative == null || narrative.isBlank()) {
            throw new AcquisitionException("LLM returned an empty narrative");
        }
        log.info("Narrative written for {} ({} chars)", request.getCompanyName(), narrative.length());
        return narrative;
    }

    String promptData(ValuationRequest request, BlendedValuation blended, Map<String, Object> assumptions) {
        ObjectNode data = mapper.createObjectNode();
        data.put("company_name", request.getCompanyName());
        data.put("sector", request.getSector());
        data.put("blended_fair_value", blended.getFairValue());
        data.putArray("fair_value_range").add(blended.getFairValueLow()).add(blended.getFairValueHigh());

        ArrayNode weights = data.putArray("methodology_weights");
        for (MethodologyWeight w : blended.getMethodologyWeights()) {
            weights.addObject()
                .put("method", w.method().key())
                .put("weight", w.weight())
                .put("rationale", w.rationale());
        }

        CompsResult comps = blended.getCompsResult();
        if (comps != null) {
            ObjectNode node = data.putObject("comps");
            node.put("ev", comps.getEnterpriseValue());
            node.put("median_multiple", comps.getEvToRevenueMedian());
            node.put("comp_count", comps.getComparableCount());
            node.set("warnings", mapper.valueToTree(comps.getWarnings()));
        }
        DcfResult dcf = blended.getDcfResult();
        if (dcf != null) {
            ObjectNode node = data.putObject("dcf");
            node.put("ev", dcf.getEnterpriseValue());
            node.put("wacc", dcf.getDiscountRate());
            node.put("terminal_growth", dcf.getTerminalGrowthRate());
            node.set("warnings", mapper.valueToTree(dcf.getWarnings()));
        }
        LastRoundResult lastRound = blended.getLastRoundResult();
        if (lastRound != null) {
            ObjectNode node = data.putObject("last_round");
            node.put("ev", lastRound.getEnterpriseValue());
            node.put("adjustment_factor", lastRound.getAdjustmentFactor());
            node.put("months_since", lastRound.getMonthsSinceRound());
            node.set("warnings", mapper.valueToTree(lastRound.getWarnings()));
        }

        if (assumptions != null) {
            ObjectNode estimation = mapper.createObjectNode();
            for (String key : ESTIMATION_KEYS) {
                Object v = assumptions.get(key);
                if (v != null) estimation.set(key, mapper.valueToTree(v));
            }
            if (!estimation.isEmpty()) data.set("estimation_details", estimation);
        }

        try {
            return mapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new AcquisitionException("Could not serialise narrative prompt: " + e.getMessage(), e);
        }
    }
}
