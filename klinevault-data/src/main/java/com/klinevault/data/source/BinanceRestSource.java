package com.klinevault.data.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.klinevault.core.error.DataSourceException;
import com.klinevault.core.error.ValidationException;
import com.klinevault.core.model.Bar;
import com.klinevault.core.model.Interval;
import com.klinevault.core.model.MarketType;
import com.klinevault.core.model.TimeWindow;
import com.klinevault.data.boundary.BoundaryProbe;
import com.klinevault.data.boundary.BoundaryRules;
import com.klinevault.data.resilience.Deadline;
import com.klinevault.data.transport.HttpClientFactory;
import com.klinevault.data.transport.Transport;
import com.klinevault.data.transport.TransportRequest;
import com.klinevault.data.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Binance klines REST endpoint as the incremental source.
 * Public API, no authentication. Paginates with startTime = last close_time + 1.
 */
public class BinanceRestSource implements BarSource, BoundaryProbe {

    private static final Logger log = LoggerFactory.getLogger(BinanceRestSource.class);

    public static final String ID = "binance-rest";
    public static final int MAX_KLINES_PER_REQUEST = 1000;
    static final String WEIGHT_HEADER = "X-MBX-USED-WEIGHT-1M";

    private static final double WEIGHT_WARN_RATIO = 0.8;

    private final Transport transport;
    private final MarketType market;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final int weightLimit;
    private final ObjectMapper mapper = HttpClientFactory.getMapper();
    private final AtomicInteger usedWeight = new AtomicInteger();

    public BinanceRestSource(Transport transport, MarketType market, Duration requestTimeout) {
        this(transport, market, market.getRestBaseUrl(), requestTimeout);
    }

    public BinanceRestSource(Transport transport, MarketType market, String baseUrl, Duration requestTimeout) {
        this.transport = transport;
        this.market = market;
        this.baseUrl = baseUrl;
        this.requestTimeout = requestTimeout;
        // Spot allows 6000 weight per minute, futures 2400
        this.weightLimit = market == MarketType.SPOT ? 6000 : 2400;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public SourceRole role() {
        return SourceRole.INCREMENTAL;
    }

    @Override
    public MarketType market() {
        return market;
    }

    /**
     * Request weight used in the current minute, as last reported by the server.
     */
    public int getUsedWeight() {
        return usedWeight.get();
    }

    @Override
    public List<Bar> fetch(String symbol, Interval interval, TimeWindow window, Deadline deadline)
            throws DataSourceException {
        if (!market.supports(interval)) {
            throw new IllegalArgumentException(interval + " klines are not available on " + market);
        }

        List<Bar> all = new ArrayList<>();
        long currentStart = window.start();

        while (currentStart <= window.end()) {
            deadline.check("klines page for " + symbol);
            List<Bar> page = fetchPage(symbol, interval, currentStart, window.end(), MAX_KLINES_PER_REQUEST, deadline);
            if (page.isEmpty()) {
                break;
            }
            all.addAll(page);

            if (page.size() < MAX_KLINES_PER_REQUEST) {
                break;
            }
            long nextStart = page.get(page.size() - 1).closeTime() + 1;
            if (nextStart <= currentStart) {
                throw new ValidationException(ValidationException.Kind.SCHEMA_INVALID,
                    "Pagination did not advance past " + currentStart + " for " + symbol);
            }
            currentStart = nextStart;
        }

        log.debug("Fetched {} {} {} bars for {}", all.size(), market.getConfigKey(), interval, window);
        return all;
    }

    /**
     * One request with an off-grid start and an on-grid end; the answer reveals how each edge is treated.
     */
    @Override
    public BoundaryRules probe(Interval interval, long referenceTime, Deadline deadline) throws DataSourceException {
        long step = interval.getMillis();
        long probeEnd = interval.floor(referenceTime);
        long probeStart = probeEnd - 3 * step + 1;
        deadline.check("boundary check for " + interval);
        List<Bar> answer = fetchPage(probeSymbol(), interval, probeStart, probeEnd, 10, deadline);
        return BoundaryRules.infer(probeStart, probeEnd, interval, answer);
    }

    private String probeSymbol() {
        return market == MarketType.FUTURES_COIN ? "BTCUSD_PERP" : "BTCUSDT";
    }

    private List<Bar> fetchPage(String symbol, Interval interval, long startTime, long endTime, int limit,
                                Deadline deadline) throws DataSourceException {
        TransportRequest request = TransportRequest.get(baseUrl + "/klines")
            .withParam("symbol", symbol.toUpperCase())
            .withParam("interval", interval.getCode())
            .withParam("startTime", startTime)
            .withParam("endTime", endTime)
            .withParam("limit", limit)
            .withTimeout(deadline.cap(requestTimeout));

        TransportResponse response = transport.request(request);
        trackWeight(response);
        response.requireSuccess();
        return parseKlines(response);
    }

    private void trackWeight(TransportResponse response) {
        String header = response.header(WEIGHT_HEADER);
        if (header == null) {
            return;
        }
        try {
            int weight = Integer.parseInt(header.trim());
            usedWeight.set(weight);
            if (weight >= weightLimit * WEIGHT_WARN_RATIO) {
                log.warn("Binance {} request weight at {}/{} for the current minute",
                    market.getConfigKey(), weight, weightLimit);
            }
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed {} header: {}", WEIGHT_HEADER, header);
        }
    }

    /**
     * Kline format: [openTime, open, high, low, close, volume, closeTime, quoteVolume, trades,
     * takerBuyBase, takerBuyQuote, ignore]. Prices and volumes arrive as strings.
     */
    List<Bar> parseKlines(TransportResponse response) throws ValidationException {
        JsonNode root;
        try {
            root = mapper.readTree(response.body());
        } catch (IOException e) {
            throw new ValidationException(ValidationException.Kind.SCHEMA_INVALID,
                "Unparseable klines response from " + response.url(), e);
        }
        if (root == null || !root.isArray()) {
            throw new ValidationException(ValidationException.Kind.SCHEMA_INVALID,
                "Expected a JSON array from " + response.url());
        }

        List<Bar> bars = new ArrayList<>(root.size());
        for (JsonNode kline : root) {
            if (!kline.isArray() || kline.size() < 7) {
                throw new ValidationException(ValidationException.Kind.SCHEMA_INVALID,
                    "Malformed kline entry: " + kline);
            }
            try {
                bars.add(new Bar(
                    kline.get(0).asLong(),
                    Double.parseDouble(kline.get(1).asText()),
                    Double.parseDouble(kline.get(2).asText()),
                    Double.parseDouble(kline.get(3).asText()),
                    Double.parseDouble(kline.get(4).asText()),
                    Double.parseDouble(kline.get(5).asText()),
                    kline.get(6).asLong(),
                    kline.size() > 7 ? Double.parseDouble(kline.get(7).asText()) : -1,
                    kline.size() > 8 ? kline.get(8).asInt() : -1,
                    kline.size() > 9 ? Double.parseDouble(kline.get(9).asText()) : -1,
                    kline.size() > 10 ? Double.parseDouble(kline.get(10).asText()) : -1
                ));
            } catch (NumberFormatException e) {
                throw new ValidationException(ValidationException.Kind.SCHEMA_INVALID,
                    "Non-numeric kline field: " + kline, e);
            }
        }
        return bars;
    }
}
