package com.jay.valuator.layer1_data;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jay.valuator.model.EnrichedInput;
import com.jay.valuator.model.LlmCallLog;
import com.jay.valuator.model.ValuationRequest;
import com.jay.valuator.model.enums.ValuationMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Layer 1: Company enrichment.
 *
 * Two phases:
 *   1. Web research (only when the request is missing revenue, EBITDA, tickers,
 *      projections or last-round data). Citations come back as a "--- Sources ---" block.
 *   2. Structured extraction into {@link EnrichedInput} with a JSON-mode completion.
 *
 * The structured result is then normalised: applicable methods are reconciled with
 * the data actually available, and projection / last-round estimates are always
 * marked low confidence.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LlmEnrichmentService implements EnrichmentProvider {

    private static final Pattern SOURCE_LINE = Pattern.compile("^(.+?):\\s*(https?://\\S+)");
    private static final Pattern DOLLAR_AMOUNT =
        Pattern.compile("\\$\\s*([\\d,.]+)\\s*(trillion|billion|million)", Pattern.CASE_INSENSITIVE);
    private static final Map<String, Double> MULTIPLIERS =
        Map.of("trillion", 1e12, "billion", 1e9, "million", 1e6);

    private static final String SYSTEM_PROMPT =
        "You are a senior financial analyst. Based on the company information and research " +
        "provided, produce a structured analysis.\n" +
        "\n" +
        "Rules:\n" +
        "- For 'comparable_tickers': suggest 3-5 public company tickers that are genuine peers.\n" +
        "- For 'applicable_methods': always include 'comps' if revenue data exists or was found " +
        "in research. Include 'dcf' if the user provided financial projections OR if you can estimate " +
        "projections from research (growth rates, margins). Include 'last_round' if last round data " +
        "was provided by the user OR if you can estimate it from research.\n" +
        "- For 'estimated_financials': you MUST populate this whenever user_provided_revenue or " +
        "user_provided_ebitda is null AND the research mentions ANY revenue or EBITDA figures. " +
        "Set estimated_revenue and estimated_ebitda to annual values in USD (e.g. 674540000000 for $674.54B). " +
        "Set revenue_source to where the data came from. Set confidence to 'high', 'medium' or 'low'.\n" +
        "- For 'estimated_projections': populate this if the user did NOT provide projections and the " +
        "research supports estimating 5 years of growth rates and EBITDA margins, with estimated_wacc and " +
        "estimated_terminal_growth_rate appropriate for the company's risk profile. Include source and reasoning.\n" +
        "- For 'estimated_last_round': populate this if the user did NOT provide last round data and the " +
        "research found a funding round. estimated_valuation is the post-money valuation in USD and " +
        "estimated_date the round date (YYYY-MM-DD). Only populate with reasonably specific data.\n" +
        "- For 'enrichment_notes': provide your full reasoning chain.\n" +
        "\n" +
        "Respond with valid JSON of this shape:\n" +
        "{\n" +
        "  \"sector\": string, \"sub_sector\": string|null,\n" +
        "  \"comparable_tickers\": [string],\n" +
        "  \"applicable_methods\": [\"comps\"|\"dcf\"|\"last_round\"],\n" +
        "  \"estimated_financials\": {\"estimated_revenue\": number|null, \"estimated_ebitda\": number|null,\n" +
        "    \"revenue_source\": string, \"confidence\": string, \"reasoning\": string} | null,\n" +
        "  \"estimated_projections\": {\"estimated_growth_rates\": [number], \"estimated_ebitda_margins\": [number],\n" +
        "    \"estimated_wacc\": number, \"estimated_terminal_growth_rate\": number,\n" +
        "    \"source\": string, \"confidence\": string, \"reasoning\": string} | null,\n" +
        "  \"estimated_last_round\": {\"estimated_valuation\": number, \"estimated_date\": string,\n" +
        "    \"source\": string, \"confidence\": string, \"reasoning\": string} | null,\n" +
        "  \"enrichment_notes\": string\n" +
        "}";

    private final OpenAiClient openAi;
    private final ObjectMapper snakeMapper = new ObjectMapper()
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public EnrichedInput enrich(ValuationRequest request, List<LlmCallLog> callLog) {
        if (!openAi.isConfigured()) {
            throw new AcquisitionException("Research service unavailable: OPENAI_API_KEY is not configured");
        }

        String research = "";
        List<EnrichedInput.ResearchSource> sources = List.of();
        if (needsResearch(request)) {
            research = openAi.research(researchPrompt(request), "research", callLog);
            sources = parseResearchSources(research);
            log.info("Research completed for '{}': {} chars, {} sources",
                request.getCompanyName(), research.length(), sources.size());
        }

        EnrichedInput result = structure(request, research, callLog);
        if (!sources.isEmpty()) {
            result.setResearchSources(new ArrayList<>(sources));
        }

        if (result.getEstimatedFinancials() == null && request.getRevenue() == null && !research.isEmpty()) {
            EnrichedInput.EstimatedFinancials extracted = extractFinancials(research);
            if (extracted != null) {
                result.setEstimatedFinancials(extracted);
                log.info("Fallback extraction from research text: revenue={}", extracted.getEstimatedRevenue());
            }
        }

        normalise(request, result);
        log.info("Enrichment structured: sector={}, comps={}, methods={}, estimated_revenue={}",
            result.getSector(), result.getComparableTickers(), result.getApplicableMethods(),
            result.getEstimatedFinancials() != null ? result.getEstimatedFinancials().getEstimatedRevenue() : "N/A");
        return result;
    }

    static boolean needsResearch(ValuationRequest r) {
        return r.getRevenue() == null
            || r.getEbitda() == null
            || r.getComparableTickers() == null || r.getComparableTickers().isEmpty()
            || r.getFinancialProjections() == null
            || r.getLastRoundValuation() == null;
    }

    // ── Phase 1: research ─────────────────────────────────────────────────────

    private String researchPrompt(ValuationRequest request) {
        StringBuilder p = new StringBuilder()
            .append("Research the company \"").append(request.getCompanyName())
            .append("\" for a financial valuation.\n\n");
        if (request.getDescription() != null) p.append("Company description: ").append(request.getDescription()).append('\n');
        if (request.getSector() != null) p.append("Sector: ").append(request.getSector()).append('\n');
        p.append(
            "\n" +
            "I need the following information:\n" +
            "1. **Annual Revenue** (most recent, in USD)\n" +
            "2. **EBITDA** (most recent, in USD)\n" +
            "3. **Enterprise Value** (if available)\n" +
            "4. **Industry/Sector** classification\n" +
            "5. **Comparable public companies** (3-5 tickers of similar companies)\n" +
            "6. **Key business metrics** (growth rate, margins, etc.)\n" +
            "7. **Last funding round info** (valuation, date, investors, round type)\n" +
            "8. **Revenue growth trajectory** (historical growth rates, projected growth if available)\n" +
            "\n" +
            "If this is a private company, search for any publicly available financial data, funding rounds, " +
            "press releases, or industry reports that mention revenue or valuation. If no exact data is found, " +
            "find data on similar companies in the same space to establish reasonable estimates.\n" +
            "\n" +
            "Be specific with numbers and cite your sources.");
        return p.toString();
    }

    /** Parses "Title: https://..." lines after the sources marker; duplicate URLs dropped. */
    static List<EnrichedInput.ResearchSource> parseResearchSources(String research) {
        List<EnrichedInput.ResearchSource> sources = new ArrayList<>();
        int idx = research.indexOf(OpenAiClient.SOURCES_MARKER);
        if (idx < 0) return sources;

        Set<String> seen = new LinkedHashSet<>();
        String block = research.substring(idx + OpenAiClient.SOURCES_MARKER.length());
        for (String raw : block.strip().split("\\R")) {
            String line = raw.strip().replaceFirst("^[-\\s]+", "");
            if (line.isEmpty()) continue;
            Matcher m = SOURCE_LINE.matcher(line);
            if (m.find()) {
                String url = m.group(2).strip();
                if (seen.add(url)) {
                    sources.add(new EnrichedInput.ResearchSource(m.group(1).strip(), url));
                }
            }
        }
        return sources;
    }

    // ── Phase 2: structure ────────────────────────────────────────────────────

    private EnrichedInput structure(ValuationRequest request, String research, List<LlmCallLog> callLog) {
        ObjectNode data = snakeMapper.createObjectNode();
        data.put("company_name", request.getCompanyName());
        data.put("description", request.getDescription());
        data.put("sector", request.getSector());
        data.put("user_provided_revenue", request.getRevenue());
        data.put("user_provided_ebitda", request.getEbitda());
        data.set("user_suggested_comps", snakeMapper.valueToTree(
            request.getComparableTickers() != null ? request.getComparableTickers() : List.of()));
        data.put("has_projections", request.getFinancialProjections() != null);
        data.put("has_last_round", request.getLastRoundValuation() != null && request.getLastRoundDate() != null);

        String userPrompt = "Company data:\n" + data.toPrettyString();
        if (!research.isEmpty()) {
            userPrompt += "\n\n--- Web Research Results ---\n" + research;
        }

        JsonNode json = openAi.completeJson(SYSTEM_PROMPT, userPrompt, "enrich", callLog);
        try {
            EnrichedInput parsed = snakeMapper.treeToValue(json, EnrichedInput.class);
            List<ValuationMethod> methods = parsed.getApplicableMethods() == null ? new ArrayList<>()
                : new ArrayList<>(parsed.getApplicableMethods().stream().filter(Objects::nonNull).distinct().toList());
            parsed.setApplicableMethods(methods);
            if (parsed.getComparableTickers() == null) parsed.setComparableTickers(new ArrayList<>());
            if (parsed.getResearchSources() == null) parsed.setResearchSources(new ArrayList<>());
            parsed.setFallback(false);
            return parsed;
        } catch (Exception e) {
            throw new AcquisitionException("Enrichment response did not match the expected shape: " + e.getMessage(), e);
        }
    }

    /** Reconciles applicable methods with the data actually available. */
    static void normalise(ValuationRequest request, EnrichedInput result) {
        List<ValuationMethod> methods = result.getApplicableMethods();

        EnrichedInput.EstimatedFinancials ef = result.getEstimatedFinancials();
        boolean hasRevenue = request.getRevenue() != null
            || (ef != null && ef.getEstimatedRevenue() != null && ef.getEstimatedRevenue() > 0);
        if (hasRevenue && !methods.contains(ValuationMethod.COMPS)) {
            methods.add(ValuationMethod.COMPS);
        }

        EnrichedInput.EstimatedProjections ep = result.getEstimatedProjections();
        if (request.getFinancialProjections() == null && methods.contains(ValuationMethod.DCF)
                && (ep == null || !ep.hasGrowthRates())) {
            methods.remove(ValuationMethod.DCF);
            log.info("Removed 'dcf' from applicable methods: no user projections and no estimated projections");
        }

        EnrichedInput.EstimatedLastRound elr = result.getEstimatedLastRound();
        if ((request.getLastRoundValuation() == null || request.getLastRoundDate() == null) && elr != null
                && elr.getEstimatedValuation() > 0 && elr.getEstimatedDate() != null
                && !methods.contains(ValuationMethod.LAST_ROUND)) {
            methods.add(ValuationMethod.LAST_ROUND);
            log.info("Added 'last_round' to applicable methods based on estimated last round data");
        }

        // Anything the model estimated from research is treated as low confidence
        if (ep != null) ep.setConfidence("low");
        if (elr != null) elr.setConfidence("low");
    }

    /** Pattern-matches the first "$X billion/million/trillion" on revenue and EBITDA lines. */
    static EnrichedInput.EstimatedFinancials extractFinancials(String research) {
        Double revenue = null;
        Double ebitda = null;
        for (String seg : research.split("\n")) {
            String lower = seg.toLowerCase(Locale.ROOT);
            if (revenue == null && (lower.contains("revenue") || lower.contains("net sales") || lower.contains("total sales"))
                    && !lower.contains("growth rate") && !lower.contains("revenue source")) {
                revenue = firstDollarAmount(seg);
            }
            if (ebitda == null && lower.contains("ebitda") && !lower.contains("margin") && !lower.contains("multiple")) {
                ebitda = firstDollarAmount(seg);
            }
        }
        if (revenue == null && ebitda == null) return null;

        List<String> parts = new ArrayList<>();
        if (revenue != null) parts.add(String.format("Revenue: $%,.0f", revenue));
        if (ebitda != null) parts.add(String.format("EBITDA: $%,.0f", ebitda));
        return EnrichedInput.EstimatedFinancials.builder()
            .estimatedRevenue(revenue)
            .estimatedEbitda(ebitda)
            .revenueSource("web search - extracted from research text (fallback)")
            .confidence("medium")
            .reasoning("Extracted from web research results. " + String.join(", ", parts))
            .build();
    }

    private static Double firstDollarAmount(String text) {
        Matcher m = DOLLAR_AMOUNT.matcher(text);
        if (!m.find()) return null;
        try {
            return Double.parseDouble(m.group(1).replace(",", "")) * MULTIPLIERS.get(m.group(2).toLowerCase(Locale.ROOT));
        } catch (NumberFormatException e) {
            log.debug("Unparseable amount '{}' in research text", m.group(1));
            return null;
        }
    }
}
