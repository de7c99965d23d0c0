package com.jay.valuator.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.PropertyPlaceholderHelper;

import java.io.InputStream;
import java.util.List;

/**
 * Loads and exposes all tunables from valuator.yaml.
 * Values are read once at startup and cached. A freshly constructed instance
 * (no Spring context) carries the built-in defaults, which is what the unit tests use.
 */
@Slf4j
@Component
public class ValuatorConfig {

    @Value("${valuator.config-file:valuator.yaml}")
    private String configFile = "valuator.yaml";

    @Autowired(required = false)
    private Environment env;

    private static final PropertyPlaceholderHelper PLACEHOLDER_HELPER =
        new PropertyPlaceholderHelper("${", "}", ":", true);

    /** Resolves ${VAR:default} placeholders using Spring Environment (env vars / system props). */
    private String resolve(String value) {
        if (value == null) return null;
        return PLACEHOLDER_HELPER.replacePlaceholders(value, key -> env != null ? env.getProperty(key) : null);
    }

    // ── Sections ──────────────────────────────────────────────────────────────
    private Comps comps = new Comps();
    private Dcf dcf = new Dcf();
    private LastRound lastRound = new LastRound();
    private Blender blender = new Blender();
    private Consistency consistency = new Consistency();
    private Llm llm = new Llm();
    private MarketData marketData = new MarketData();
    private Pipeline pipeline = new Pipeline();

    @PostConstruct
    public void load() {
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            InputStream is = getClass().getClassLoader().getResourceAsStream(configFile);
            if (is == null) {
                log.warn("Config file '{}' not found on classpath, using defaults", configFile);
                resolvePlaceholders();
                return;
            }
            ConfigRoot root = mapper.readValue(is, ConfigRoot.class);
            this.comps       = root.getComps();
            this.dcf         = root.getDcf();
            this.lastRound   = root.getLastRound();
            this.blender     = root.getBlender();
            this.consistency = root.getConsistency();
            this.llm         = root.getLlm();
            this.marketData  = root.getMarketData();
            this.pipeline    = root.getPipeline();

            // Jackson reads ${VAR:default} as literal strings
            resolvePlaceholders();
            log.info("ValuatorConfig loaded from '{}'. LLM configured: {}, mock market data: {}",
                configFile, llm.isConfigured(), marketData.isMockEnabled());
        } catch (Exception e) {
            log.error("Failed to load {}, valuator will use defaults: {}", configFile, e.getMessage());
        }
    }

    private void resolvePlaceholders() {
        this.llm.setApiKey(resolve(this.llm.getApiKey()));
        this.marketData.setUseMock(resolve(this.marketData.getUseMock()));
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Comps comps()             { return comps; }
    public Dcf dcf()                 { return dcf; }
    public LastRound lastRound()     { return lastRound; }
    public Blender blender()         { return blender; }
    public Consistency consistency() { return consistency; }
    public Llm llm()                 { return llm; }
    public MarketData marketData()   { return marketData; }
    public Pipeline pipeline()       { return pipeline; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Comps comps = new Comps();
        private Dcf dcf = new Dcf();
        private LastRound lastRound = new LastRound();
        private Blender blender = new Blender();
        private Consistency consistency = new Consistency();
        private Llm llm = new Llm();
        private MarketData marketData = new MarketData();
        private Pipeline pipeline = new Pipeline();
    }

    @Data public static class Comps {
        private double sectorWeight = 0.3;
        private double sizeWeight = 0.4;
        private double qualityWeight = 0.3;
        private double minComposite = 0.3;
        private double minSizeRatio = 0.1;
        private double maxSizeRatio = 10.0;
        private List<List<String>> sectorGroups = List.of(
            List.of("Technology", "Information Technology", "Software", "SaaS"),
            List.of("Consumer Cyclical", "Consumer Defensive", "Retail"),
            List.of("Healthcare", "Biotechnology", "Pharmaceuticals"),
            List.of("Financial Services", "Fintech", "Insurance"));
    }

    @Data public static class Dcf {
        private List<Double> waccDeltas = List.of(-0.02, -0.01, 0.0, 0.01, 0.02);
        private List<Double> growthDeltas = List.of(-0.01, -0.005, 0.0, 0.005, 0.01);
        private double defaultCapexPercent = 0.05;
        private double defaultNwcChangePercent = 0.02;
        private double defaultTaxRate = 0.25;
        private double defaultWacc = 0.12;
        private double defaultTerminalGrowthRate = 0.03;
        private double defaultDepreciationPercent = 0.0;
        private double defaultMargin = 0.20;    // used when estimated margins are empty
    }

    @Data public static class LastRound {
        private int stalenessMonths = 18;
        private String defaultIndexTicker = "^IXIC";
    }

    @Data public static class Blender {
        private double compsFullWeight = 0.40;
        private double compsLimitedWeight = 0.25;
        private int minCompsForFullWeight = 3;
        private double dcfWeight = 0.35;
        private double dcfEstimatedWeight = 0.15;
        private double lastRoundFreshWeight = 0.25;
        private double lastRoundStaleWeight = 0.15;
        private double lastRoundEstimatedWeight = 0.10;
        private double defaultRangePct = 0.20;
        private double tightRangePct = 0.15;
        private int tightRangeMinComps = 5;
    }

    @Data public static class Consistency {
        private double waccDiff = 0.02;            // absolute, 2pp
        private double growthDiff = 0.01;          // absolute, 1pp
        private double avgGrowthRelative = 0.20;   // relative
        private double lastRoundRelative = 0.30;   // relative
        private int maxSourceLinks = 5;
    }

    @Data public static class Llm {
        private String apiKey = "";
        private String baseUrl = "https://api.openai.com/v1";
        private String model = "gpt-4o-mini";
        private String searchModel = "gpt-4o-mini";
        private int maxRetries = 2;
        private int connectTimeoutSeconds = 10;
        private int readTimeoutSeconds = 90;

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Data public static class MarketData {
        private String useMock = "false";
        private String yahooBaseUrl = "https://query1.finance.yahoo.com";
        private String cookieUrl = "https://fc.yahoo.com";
        private String crumbUrl = "https://query2.finance.yahoo.com/v1/test/getcrumb";
        private int connectTimeoutSeconds = 10;
        private int readTimeoutSeconds = 15;
        private int maxConcurrentRequests = 5;

        public boolean isMockEnabled() {
            return useMock != null && Boolean.parseBoolean(useMock.trim());
        }
    }

    @Data public static class Pipeline {
        private int streamPollTimeoutSeconds = 15;
        private int asyncThreads = 4;
        private int completedBusRetentionSeconds = 600;
    }
}
