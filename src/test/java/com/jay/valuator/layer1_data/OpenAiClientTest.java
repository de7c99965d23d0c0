package com.jay.valuator.layer1_data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.valuator.config.ValuatorConfig;
import com.jay.valuator.model.LlmCallLog;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiClientTest {

    private MockWebServer server;
    private ValuatorConfig config;
    private OpenAiClient client;
    private final List<LlmCallLog> callLog = new ArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        config = new ValuatorConfig();
        String base = server.url("/v1").toString();
        config.llm().setBaseUrl(base);
        config.llm().setApiKey("sk-test");
        client = new OpenAiClient(config);
        client.init();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static String chat(String content) {
        return "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":"
            + new ObjectMapper().valueToTree(content).toString()
            + "}}],\"usage\":{\"total_tokens\":42}}";
    }

    @Test
    void completeSendsPromptsAndLogsTheCall() throws Exception {
        server.enqueue(new MockResponse().setBody(chat("A fine company.")));

        String text = client.complete("system text", "user text", "narrate", callLog);

        assertThat(text).isEqualTo("A fine company.");
        RecordedRequest req = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(req.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(req.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        JsonNode body = new ObjectMapper().readTree(req.getBody().readUtf8());
        assertThat(body.path("messages").path(0).path("content").asText()).isEqualTo("system text");
        assertThat(body.path("messages").path(1).path("content").asText()).isEqualTo("user text");
        assertThat(body.has("response_format")).isFalse();

        assertThat(callLog).singleElement().satisfies(c -> {
            assertThat(c.getStepName()).isEqualTo("narrate");
            assertThat(c.getTokensUsed()).isEqualTo(42);
            assertThat(c.getResponse()).isEqualTo("A fine company.");
            assertThat(c.getTimestamp()).isNotNull();
        });
    }

    @Test
    void completeJsonRetriesOnUnparseableContent() throws Exception {
        server.enqueue(new MockResponse().setBody(chat("not json at all")));
        server.enqueue(new MockResponse().setBody(chat("{\"sector\":\"Fintech\"}")));

        JsonNode json = client.completeJson("sys", "user", "enrich", callLog);

        assertThat(json.path("sector").asText()).isEqualTo("Fintech");
        assertThat(callLog).hasSize(2);
        RecordedRequest first = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(first.getBody().readUtf8()).contains("\"json_object\"");
    }

    @Test
    void completeJsonGivesUpAfterConfiguredRetries() {
        config.llm().setMaxRetries(1);
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        assertThatThrownBy(() -> client.completeJson("sys", "user", "enrich", callLog))
            .isInstanceOf(AcquisitionException.class)
            .hasMessageContaining("after 2 attempts");
        assertThat(server.getRequestCount()).isEqualTo(2);
        assertThat(callLog).isEmpty();
    }

    @Test
    void researchAppendsCitationsAsSourcesBlock() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"output\":["
            + "{\"type\":\"web_search_call\"},"
            + "{\"type\":\"message\",\"content\":[{\"type\":\"output_text\",\"text\":\"Revenue is $12 million.\","
            + "\"annotations\":[{\"type\":\"url_citation\",\"title\":\"Press\",\"url\":\"https://news.example/acme\"}]}]}"
            + "],\"usage\":{\"total_tokens\":100}}"));

        String research = client.research("Research Acme", "research", callLog);

        assertThat(research).startsWith("Revenue is $12 million.");
        assertThat(research).contains(OpenAiClient.SOURCES_MARKER + "\n- Press: https://news.example/acme");
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getPath()).isEqualTo("/v1/responses");
        assertThat(callLog).singleElement()
            .satisfies(c -> assertThat(c.getSystemPrompt()).isEqualTo("[web_search_preview tool]"));
    }

    @Test
    void researchFallsBackToPlainCompletion() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":\"no tools\"}"));
        server.enqueue(new MockResponse().setBody(chat("From memory: about $10 million.")));

        String research = client.research("Research Acme", "research", callLog);

        assertThat(research).isEqualTo("From memory: about $10 million.");
        assertThat(callLog).singleElement()
            .satisfies(c -> assertThat(c.getStepName()).isEqualTo("research_fallback"));
    }

    @Test
    void missingApiKeyFailsFast() {
        config.llm().setApiKey("");

        assertThat(client.isConfigured()).isFalse();
        assertThatThrownBy(() -> client.complete("s", "u", "narrate", callLog))
            .isInstanceOf(AcquisitionException.class)
            .hasMessageContaining("OPENAI_API_KEY");
        assertThat(server.getRequestCount()).isZero();
    }
}
