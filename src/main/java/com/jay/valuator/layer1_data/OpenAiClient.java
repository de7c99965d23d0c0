package com.jay.valuator.layer1_data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jay.valuator.config.ValuatorConfig;
import com.jay.valuator.model.LlmCallLog;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * OpenAI API client for research, structured extraction and narrative text.
 * All interaction uses OkHttp and Jackson, no SDK dependency.
 *
 * Every call (successful or not parsed) is appended to the caller's call log
 * with full prompts, response, token usage and duration for the audit trail.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiClient {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final String SOURCES_MARKER = "--- Sources ---";

    private final ValuatorConfig config;
    private final ObjectMapper mapper = new ObjectMapper();
    private OkHttpClient http;

    @PostConstruct
    public void init() {
        ValuatorConfig.Llm llm = config.llm();
        this.http = new OkHttpClient.Builder()
            .connectTimeout(llm.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
            .readTimeout(llm.getReadTimeoutSeconds(), TimeUnit.SECONDS)
            .build();
        log.info("OpenAiClient initialized. API key configured: {}", llm.isConfigured());
    }

    public boolean isConfigured() {
        return config.llm().isConfigured();
    }

    // ── Web research ──────────────────────────────────────────────────────────

    /**
     * Researches a topic through the Responses API with the web search tool.
     * URL citations are appended as a "--- Sources ---" block of "- Title: url" lines.
     * Falls back to a plain chat completion when the search call fails.
     */
    public String research(String prompt, String stepName, List<LlmCallLog> callLog) {
        requireConfigured();
        String model = config.llm().getSearchModel();
        long start = System.nanoTime();
        try {
            ObjectNode body = mapper.createObjectNode();
            body.put("model", model);
            body.putArray("tools").addObject().put("type", "web_search_preview");
            body.put("input", prompt);

            JsonNode root = mapper.readTree(post("/responses", body.toString()));
            double durationMs = elapsedMs(start);

            List<String> texts = new ArrayList<>();
            StringBuilder citations = new StringBuilder();
            int citationCount = 0;
            for (JsonNode item : root.path("output")) {
                if (!"message".equals(item.path("type").asText())) continue;
                for (JsonNode block : item.path("content")) {
                    if (!"output_text".equals(block.path("type").asText())) continue;
                    texts.add(block.path("text").asText(""));
                    for (JsonNode ann : block.path("annotations")) {
                        if ("url_citation".equals(ann.path("type").asText())) {
                            citations.append("- ").append(ann.path("title").asText(""))
                                .append(": ").append(ann.path("url").asText("")).append('\n');
                            citationCount++;
                        }
                    }
                }
            }
            String content = texts.isEmpty() ? root.path("output").toString() : String.join("\n", texts);
            if (citationCount > 0) {
                content += "\n\n" + SOURCES_MARKER + "\n" + citations;
            }

            Integer tokens = tokens(root);
            log.info("LLM research call [{}]: model={}, tokens={}, duration={}ms, sources={}",
                stepName, model, tokens, Math.round(durationMs), citationCount);
            callLog.add(LlmCallLog.builder()
                .stepName(stepName).model(model)
                .systemPrompt("[web_search_preview tool]").userPrompt(prompt)
                .response(content).tokensUsed(tokens).durationMs(durationMs)
                .timestamp(LocalDateTime.now())
                .build());
            return content;
        } catch (Exception e) {
            log.warn("Research call failed [{}] after {}ms: {}. Falling back to standard completion.",
                stepName, Math.round(elapsedMs(start)), e.getMessage());
            return complete(
                "You are a financial research analyst. Answer based on your knowledge. "
                    + "Clearly state when you are estimating vs citing known data.",
                prompt, stepName + "_fallback", callLog);
        }
    }

    // ── Chat completions ──────────────────────────────────────────────────────

    /** Free-text completion, e.g. the valuation narrative. */
    public String complete(String systemPrompt, String userPrompt, String stepName, List<LlmCallLog> callLog) {
        requireConfigured();
        String model = config.llm().getModel();
        long start = System.nanoTime();
        try {
            JsonNode root = mapper.readTree(post("/chat/completions",
                chatBody(model, systemPrompt, userPrompt, false)));
            double durationMs = elapsedMs(start);
            String content = root.path("choices").path(0).path("message").path("content").asText("");
            Integer tokens = tokens(root);
            log.info("LLM text call [{}]: model={}, tokens={}, duration={}ms",
                stepName, model, tokens, Math.round(durationMs));
            callLog.add(LlmCallLog.builder()
                .stepName(stepName).model(model)
                .systemPrompt(systemPrompt).userPrompt(userPrompt)
                .response(content).tokensUsed(tokens).durationMs(durationMs)
                .timestamp(LocalDateTime.now())
                .build());
            return content;
        } catch (IOException e) {
            throw new AcquisitionException("LLM text completion failed [" + stepName + "]: " + e.getMessage(), e);
        }
    }

    /**
     * JSON-mode completion parsed into a tree. Retries up to {@code llm.max_retries}
     * extra times on transport or parse failure.
     */
    public JsonNode completeJson(String systemPrompt, String userPrompt, String stepName, List<LlmCallLog> callLog) {
        requireConfigured();
        String model = config.llm().getModel();
        int attempts = config.llm().getMaxRetries() + 1;
        Exception lastError = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            long start = System.nanoTime();
            try {
                JsonNode root = mapper.readTree(post("/chat/completions",
                    chatBody(model, systemPrompt, userPrompt, true)));
                double durationMs = elapsedMs(start);
                String content = root.path("choices").path(0).path("message").path("content").asText("");
                Integer tokens = tokens(root);
                log.info("LLM structured call [{}]: model={}, tokens={}, duration={}ms",
                    stepName, model, tokens, Math.round(durationMs));
                callLog.add(LlmCallLog.builder()
                    .stepName(stepName).model(model)
                    .systemPrompt(systemPrompt).userPrompt(userPrompt)
                    .response(content).tokensUsed(tokens).durationMs(durationMs)
                    .timestamp(LocalDateTime.now())
                    .build());

                JsonNode parsed = mapper.readTree(content);
                if (parsed == null || !parsed.isObject()) {
                    throw new IOException("Response is not a JSON object");
                }
                return parsed;
            } catch (Exception e) {
                lastError = e;
                log.warn("LLM call attempt {} failed for [{}]: {}", attempt, stepName, e.getMessage());
            }
        }
        throw new AcquisitionException("LLM call failed after " + attempts + " attempts: "
            + (lastError != null ? lastError.getMessage() : "unknown error"), lastError);
    }

    // ── HTTP Helpers ──────────────────────────────────────────────────────────

    private String chatBody(String model, String systemPrompt, String userPrompt, boolean jsonMode) {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", model);
        body.put("temperature", 0.0);
        if (jsonMode) {
            body.putObject("response_format").put("type", "json_object");
        }
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userPrompt);
        return body.toString();
    }

    private String post(String path, String jsonBody) throws IOException {
        Request request = new Request.Builder()
            .url(config.llm().getBaseUrl() + path)
            .post(RequestBody.create(jsonBody, JSON))
            .addHeader("Accept", "application/json")
            .addHeader("Authorization", "Bearer " + config.llm().getApiKey())
            .build();

        try (Response response = http.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code() + " from " + path + ": " + abbreviate(body));
            }
            return body;
        }
    }

    private void requireConfigured() {
        if (!isConfigured()) {
            throw new AcquisitionException("OPENAI_API_KEY is not configured");
        }
    }

    private static Integer tokens(JsonNode root) {
        JsonNode usage = root.path("usage").path("total_tokens");
        return usage.isNumber() ? usage.asInt() : null;
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private static String abbreviate(String s) {
        return s.length() > 300 ? s.substring(0, 300) + "..." : s;
    }
}
