package com.dextrader.exchange;

import com.dextrader.core.error.ExchangeException;
import com.dextrader.core.error.TransientTransportException;
import com.dextrader.core.model.Candle;
import com.dextrader.core.model.MarketInfo;
import com.dextrader.core.model.Ticker;
import com.dextrader.core.model.Timeframe;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.Map;

/**
 * Public market data from the Hyperliquid {@code /info} endpoint: candles, top of book and size decimals.
 * No credentials are involved.
 */
public final class HyperliquidInfoClient implements MarketDataSource {
    private static final Logger logger = LoggerFactory.getLogger(HyperliquidInfoClient.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration META_TTL = Duration.ofHours(1);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI infoUri;
    private final Clock clock;

    private final Map<String, Integer> sizeDecimals = new ConcurrentHashMap<>();
    private volatile Instant metaLoadedAt;

    public HyperliquidInfoClient(String baseUrl, ObjectMapper objectMapper, Clock clock) {
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(REQUEST_TIMEOUT)
            .build();
        this.objectMapper = objectMapper;
        this.infoUri = URI.create(baseUrl + "/info");
        this.clock = clock;
        logger.info("Hyperliquid info client initialized for {}", baseUrl);
    }

    @Override
    public List<Candle> getCandles(String symbol, Timeframe timeframe, int lookback) {
        long end = clock.millis();
        long start = end - timeframe.duration().toMillis() * lookback;
        ObjectNode req = objectMapper.createObjectNode()
            .put("coin", symbol)
            .put("interval", timeframe.code())
            .put("startTime", start)
            .put("endTime", end);
        ObjectNode body = objectMapper.createObjectNode().put("type", "candleSnapshot");
        body.set("req", req);
        List<Candle> candles = parseCandles(post(body));
        logger.debug("Fetched {} {} candles for {}", candles.size(), timeframe.code(), symbol);
        return candles.size() > lookback ? candles.subList(candles.size() - lookback, candles.size()) : candles;
    }

    @Override
    public Ticker getTicker(String symbol) {
        ObjectNode body = objectMapper.createObjectNode()
            .put("type", "l2Book")
            .put("coin", symbol);
        return parseTicker(symbol, post(body), clock.instant());
    }

    @Override
    public MarketInfo getMarketInfo(String symbol) {
        Instant loaded = metaLoadedAt;
        if (loaded == null || clock.instant().isAfter(loaded.plus(META_TTL))) {
            sizeDecimals.putAll(parseSizeDecimals(post(objectMapper.createObjectNode().put("type", "meta"))));
            metaLoadedAt = clock.instant();
        }
        Integer decimals = sizeDecimals.get(symbol);
        if (decimals == null) {
            logger.warn("{} not found in exchange meta, using {} size decimals", symbol,
                MarketInfo.DEFAULT_SIZE_DECIMALS);
            return MarketInfo.defaults(symbol);
        }
        return new MarketInfo(symbol, decimals);
    }

    static List<Candle> parseCandles(JsonNode root) {
        List<Candle> candles = new ArrayList<>();
        if (root == null || !root.isArray()) {
            return candles;
        }
        for (JsonNode node : root) {
            candles.add(new Candle(
                Instant.ofEpochMilli(epochMillis(node, "t")),
                number(node, "o"),
                number(node, "h"),
                number(node, "l"),
                number(node, "c"),
                number(node, "v")));
        }
        candles.sort(Comparator.comparing(Candle::openTime));
        return candles;
    }

    static Ticker parseTicker(String symbol, JsonNode root, Instant now) {
        JsonNode levels = root == null ? null : root.get("levels");
        if (levels == null || levels.size() < 2 || levels.get(0).isEmpty() || levels.get(1).isEmpty()) {
            throw new ExchangeException("Empty order book for " + symbol);
        }
        double bid = number(levels.get(0).get(0), "px");
        double ask = number(levels.get(1).get(0), "px");
        Instant at = root.hasNonNull("time") ? Instant.ofEpochMilli(epochMillis(root, "time")) : now;
        return new Ticker(symbol, bid, ask, at);
    }

    static Map<String, Integer> parseSizeDecimals(JsonNode root) {
        Map<String, Integer> result = new ConcurrentHashMap<>();
        JsonNode universe = root == null ? null : root.get("universe");
        if (universe != null && universe.isArray()) {
            for (JsonNode asset : universe) {
                String name = asset.path("name").asText("");
                if (!name.isEmpty()) {
                    result.put(name, asset.path("szDecimals").asInt(MarketInfo.DEFAULT_SIZE_DECIMALS));
                }
            }
        }
        return result;
    }

    private static double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new ExchangeException("Missing field '" + field + "' in exchange response");
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        try {
            return Double.parseDouble(value.asText());
        } catch (NumberFormatException e) {
            throw new ExchangeException("Invalid number '" + field + "' in exchange response: " + value.asText(), e);
        }
    }

    private static long epochMillis(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.canConvertToLong()) {
            return value.asLong();
        }
        if (value.isTextual()) {
            try {
                return Long.parseLong(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new ExchangeException("Invalid timestamp '" + field + "' in exchange response: " + value.asText(), e);
            }
        }
        throw new ExchangeException("Missing field '" + field + "' in exchange response");
    }

    private JsonNode post(ObjectNode body) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize info request", e);
        }
        HttpRequest request = HttpRequest.newBuilder()
            .uri(infoUri)
            .header("Content-Type", "application/json")
            .timeout(REQUEST_TIMEOUT)
            .POST(HttpRequest.BodyPublishers.ofString(payload))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransientTransportException("Info request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientTransportException("Interrupted during info request", e);
        }

        int status = response.statusCode();
        if (status == 429) {
            throw new TransientTransportException("Info API rate limit (429)", true, null);
        }
        if (status >= 500) {
            throw new TransientTransportException("Info API error " + status);
        }
        if (status < 200 || status >= 300) {
            throw new ExchangeException(String.format("Info request failed: %d - %s", status, response.body()));
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new ExchangeException("Malformed info response", e);
        }
    }
}
