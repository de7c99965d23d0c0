package com.jay.valuator.layer1_data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.valuator.config.ValuatorConfig;
import com.jay.valuator.model.ComparableCompany;
import com.jay.valuator.model.IndexData;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Layer 1: Market Data.
 *
 * Comparables come from the Yahoo Finance quoteSummary endpoint, one call per
 * ticker, at most {@code market_data.max_concurrent_requests} in flight.
 * The index return comes from the chart endpoint (first and last daily close
 * since the round date).
 *
 * Any live failure falls back to {@link MockMarketData} for that ticker, and
 * {@code market_data.use_mock} skips the network entirely.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class YahooMarketDataService implements MarketDataProvider {

    private static final String USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
        + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    private static final String MODULES = "price,financialData,defaultKeyStatistics,summaryDetail,assetProfile";

    private final ValuatorConfig config;
    private final MockMarketData mockData;

    private final ObjectMapper mapper = new ObjectMapper();
    private OkHttpClient http;
    private ExecutorService fetchPool;
    private volatile String crumb = null;

    @PostConstruct
    public void init() {
        ValuatorConfig.MarketData md = config.marketData();
        this.http = new OkHttpClient.Builder()
            .connectTimeout(md.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
            .readTimeout(md.getReadTimeoutSeconds(), TimeUnit.SECONDS)
            .cookieJar(new YahooCookieJar())
            .build();
        this.fetchPool = Executors.newFixedThreadPool(Math.max(1, md.getMaxConcurrentRequests()));
        log.info("Market data initialised. Mock mode: {}", md.isMockEnabled());
    }

    @PreDestroy
    public void shutdown() {
        if (fetchPool != null) fetchPool.shutdownNow();
    }

    // ── Comparables ───────────────────────────────────────────────────────────

    @Override
    public List<ComparableCompany> fetchComparables(List<String> tickers) {
        if (tickers == null || tickers.isEmpty()) return List.of();

        List<CompletableFuture<ComparableCompany>> futures = tickers.stream()
            .filter(t -> t != null && !t.isBlank())
            .map(t -> CompletableFuture.supplyAsync(() -> fetchOne(t.trim()), fetchPool))
            .toList();

        List<ComparableCompany> out = futures.stream()
            .map(CompletableFuture::join)
            .filter(Objects::nonNull)
            .toList();
        log.info("Fetched {}/{} comparables", out.size(), tickers.size());
        return out;
    }

    private ComparableCompany fetchOne(String ticker) {
        if (!config.marketData().isMockEnabled()) {
            try {
                return fetchLive(ticker);
            } catch (Exception e) {
                log.warn("Yahoo Finance failed for {}: {}, falling back to mock", ticker, e.getMessage());
            }
        }
        return mockData.comparable(ticker);
    }

    ComparableCompany fetchLive(String ticker) throws IOException {
        if (crumb == null) initCredentials();

        String url = config.marketData().getYahooBaseUrl() + "/v10/finance/quoteSummary/" + ticker
            + "?modules=" + MODULES
            + (crumb != null ? "&crumb=" + URLEncoder.encode(crumb, StandardCharsets.UTF_8) : "");
        JsonNode result = getJson(url).path("quoteSummary").path("result");
        if (!result.isArray() || result.isEmpty()) {
            throw new IOException("empty quoteSummary result");
        }
        JsonNode node = result.get(0);
        JsonNode price     = node.path("price");
        JsonNode financial = node.path("financialData");
        JsonNode keyStats  = node.path("defaultKeyStatistics");
        JsonNode summary   = node.path("summaryDetail");
        JsonNode profile   = node.path("assetProfile");

        Double marketCap = raw(summary, "marketCap");
        if (marketCap == null) marketCap = raw(price, "marketCap");
        Double ev = raw(keyStats, "enterpriseValue");
        Double revenue = raw(financial, "totalRevenue");
        Double ebitda = raw(financial, "ebitda");

        Double evToRevenue = (ev != null && ev != 0 && revenue != null && revenue > 0) ? ev / revenue : null;
        Double evToEbitda = (ev != null && ev != 0 && ebitda != null && ebitda > 0) ? ev / ebitda : null;

        String name = price.path("shortName").asText(null);
        String sector = profile.path("sector").asText(null);

        log.debug("Yahoo parsed {}: EV={} revenue={} EV/Rev={} sector={}",
            ticker, ev, revenue, evToRevenue, sector);

        return ComparableCompany.builder()
            .ticker(ticker)
            .name(name)
            .sector(sector)
            .marketCap(marketCap)
            .enterpriseValue(ev)
            .revenue(revenue)
            .ebitda(ebitda)
            .evToRevenue(evToRevenue)
            .evToEbitda(evToEbitda)
            .dataSource("yahoo")
            .dataSourceUrl("https://finance.yahoo.com/quote/" + ticker)
            .fetchedAt(LocalDateTime.now())
            .build();
    }

    // ── Index ─────────────────────────────────────────────────────────────────

    @Override
    public IndexData fetchIndexReturn(String indexTicker, String sinceDate) {
        if (!config.marketData().isMockEnabled()) {
            try {
                return fetchIndexLive(indexTicker, sinceDate);
            } catch (Exception e) {
                log.warn("Yahoo index fetch failed for {}: {}, falling back to mock", indexTicker, e.getMessage());
            }
        }
        return mockData.indexReturn(indexTicker, sinceDate);
    }

    IndexData fetchIndexLive(String indexTicker, String sinceDate) throws IOException {
        long period1;
        try {
            period1 = LocalDate.parse(sinceDate.trim()).atStartOfDay().toEpochSecond(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IOException("unparsable round date: " + sinceDate, e);
        }
        long period2 = LocalDateTime.now().toEpochSecond(ZoneOffset.UTC);

        String url = config.marketData().getYahooBaseUrl() + "/v8/finance/chart/"
            + URLEncoder.encode(indexTicker, StandardCharsets.UTF_8)
            + "?period1=" + period1 + "&period2=" + period2 + "&interval=1d";
        JsonNode closes = getJson(url).path("chart").path("result").path(0)
            .path("indicators").path("quote").path(0).path("close");

        List<Double> series = new ArrayList<>();
        for (JsonNode c : closes) {
            if (c.isNumber()) series.add(c.asDouble());
        }
        if (series.isEmpty()) {
            log.warn("No index history for {} since {}", indexTicker, sinceDate);
            return null;
        }

        double atRound = series.get(0);
        double current = series.get(series.size() - 1);
        if (atRound <= 0) return null;
        double ret = (current - atRound) / atRound;
        log.info("Index {} return since {}: {}%", indexTicker, sinceDate, Math.round(ret * 1000) / 10.0);
        return IndexData.builder()
            .ticker(indexTicker)
            .priceAtRound(atRound)
            .priceCurrent(current)
            .returnSinceRound(ret)
            .build();
    }

    // ── HTTP Helpers ──────────────────────────────────────────────────────────

    /**
     * Obtains a session cookie and crumb for quoteSummary. Either URL left blank
     * skips that step; without a crumb the call is made unauthenticated.
     */
    private synchronized void initCredentials() {
        if (crumb != null) return;
        ValuatorConfig.MarketData md = config.marketData();
        try {
            if (md.getCookieUrl() != null && !md.getCookieUrl().isBlank()) {
                Request fcReq = new Request.Builder().url(md.getCookieUrl())
                    .addHeader("User-Agent", USER_AGENT).get().build();
                try (Response fcResp = http.newCall(fcReq).execute()) {
                    log.debug("Cookie endpoint responded with HTTP {}", fcResp.code());
                }
            }
            if (md.getCrumbUrl() == null || md.getCrumbUrl().isBlank()) return;

            Request crumbReq = new Request.Builder().url(md.getCrumbUrl())
                .addHeader("User-Agent", USER_AGENT)
                .addHeader("Accept", "text/plain")
                .get().build();
            try (Response resp = http.newCall(crumbReq).execute()) {
                String body = resp.body() != null ? resp.body().string().trim() : "";
                if (!resp.isSuccessful() || body.isEmpty() || body.startsWith("{")) {
                    log.warn("Yahoo Finance: crumb request returned {}", resp.code());
                    return;
                }
                crumb = body;
                log.info("Yahoo Finance credentials initialised (crumb length={})", body.length());
            }
        } catch (Exception e) {
            log.warn("Yahoo Finance credential init failed: {}", e.getMessage());
        }
    }

    private JsonNode getJson(String url) throws IOException {
        Request request = new Request.Builder()
            .url(url)
            .addHeader("User-Agent", USER_AGENT)
            .addHeader("Accept", "application/json")
            .get().build();
        try (Response response = http.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                if (response.code() == 401) {
                    crumb = null;
                    cookieStore.clear();
                }
                throw new IOException("HTTP " + response.code());
            }
            return mapper.readTree(response.body().string());
        }
    }

    private static Double raw(JsonNode module, String field) {
        JsonNode v = module.path(field).path("raw");
        return v.isNumber() ? v.asDouble() : null;
    }
}
