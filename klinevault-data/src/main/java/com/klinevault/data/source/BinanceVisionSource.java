package com.klinevault.data.source;

import com.klinevault.core.error.ClientErrorException;
import com.klinevault.core.error.DataSourceException;
import com.klinevault.core.error.ValidationException;
import com.klinevault.core.model.Bar;
import com.klinevault.core.model.Interval;
import com.klinevault.core.model.MarketType;
import com.klinevault.core.model.TimeWindow;
import com.klinevault.data.cache.BarCsv;
import com.klinevault.data.resilience.Deadline;
import com.klinevault.data.transport.Transport;
import com.klinevault.data.transport.TransportRequest;
import com.klinevault.data.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Binance Vision daily kline archives as the archive source.
 *
 * One ZIP per symbol, interval and UTC day, published a day or two after the fact.
 * Each ZIP has a sibling {@code .CHECKSUM} file holding its SHA-256. A 404 means the
 * day has not been published (yet) and surfaces as a {@link ClientErrorException}.
 */
public class BinanceVisionSource implements BarSource {

    private static final Logger log = LoggerFactory.getLogger(BinanceVisionSource.class);

    public static final String ID = "binance-vision";
    public static final String DEFAULT_BASE_URL = "https://data.binance.vision/data";

    // Spot archives switched to microsecond timestamps in 2025
    private static final long MICROSECOND_THRESHOLD = 100_000_000_000_000L;

    private final Transport transport;
    private final MarketType market;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final boolean verifyChecksum;

    public BinanceVisionSource(Transport transport, MarketType market, Duration requestTimeout, boolean verifyChecksum) {
        this(transport, market, DEFAULT_BASE_URL, requestTimeout, verifyChecksum);
    }

    public BinanceVisionSource(Transport transport, MarketType market, String baseUrl,
                               Duration requestTimeout, boolean verifyChecksum) {
        this.transport = transport;
        this.market = market;
        this.baseUrl = baseUrl;
        this.requestTimeout = requestTimeout;
        this.verifyChecksum = verifyChecksum;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public SourceRole role() {
        return SourceRole.ARCHIVE;
    }

    @Override
    public MarketType market() {
        return market;
    }

    /**
     * URL of the daily kline archive, e.g.
     * {@code .../futures/um/daily/klines/BTCUSDT/1h/BTCUSDT-1h-2024-01-15.zip}.
     */
    public String buildUrl(String symbol, Interval interval, LocalDate date) {
        String archiveSymbol = market.archiveSymbol(symbol);
        return String.format("%s/%s/daily/klines/%s/%s/%s-%s-%s.zip",
            baseUrl, market.getVisionPath(), archiveSymbol, interval.getCode(),
            archiveSymbol, interval.getCode(), date.format(DateTimeFormatter.ISO_LOCAL_DATE));
    }

    @Override
    public List<Bar> fetch(String symbol, Interval interval, TimeWindow window, Deadline deadline)
            throws DataSourceException {
        if (!market.supports(interval)) {
            throw new IllegalArgumentException(interval + " klines are not available on " + market);
        }
        List<Bar> bars = new ArrayList<>();
        for (LocalDate date : window.dates()) {
            bars.addAll(fetchDay(symbol, interval, date, deadline));
        }
        return bars;
    }

    /**
     * Download, verify and parse one day.
     */
    public List<Bar> fetchDay(String symbol, Interval interval, LocalDate date, Deadline deadline)
            throws DataSourceException {
        String url = buildUrl(symbol, interval, date);
        deadline.check("archive download " + url);
        log.debug("Downloading: {}", url);

        TransportResponse response = transport.request(
            TransportRequest.get(url).withTimeout(deadline.cap(requestTimeout)));
        response.requireSuccess();
        byte[] zip = response.body();

        if (verifyChecksum) {
            verifyChecksum(url, zip, deadline);
        }

        List<Bar> bars = parseZip(zip, url);
        log.info("Downloaded {} {} bars for {} from archive", bars.size(), interval, date);
        return bars;
    }

    private void verifyChecksum(String zipUrl, byte[] zip, Deadline deadline) throws DataSourceException {
        String checksumUrl = zipUrl + ".CHECKSUM";
        TransportResponse response = transport.request(
            TransportRequest.get(checksumUrl).withTimeout(deadline.cap(requestTimeout)));
        if (response.status() == 404) {
            log.warn("No checksum published for {}, skipping verification", zipUrl);
            return;
        }
        response.requireSuccess();

        String expected = parseChecksum(response.bodyAsString());
        if (expected == null) {
            throw new ValidationException(ValidationException.Kind.INTEGRITY_CHECK_FAILED,
                "Malformed checksum file " + checksumUrl);
        }
        String actual = sha256(zip);
        if (!expected.equalsIgnoreCase(actual)) {
            throw new ValidationException(ValidationException.Kind.INTEGRITY_CHECK_FAILED,
                "Checksum mismatch for " + zipUrl + ": expected " + expected + ", got " + actual);
        }
    }

    /**
     * Checksum file format: {@code <sha256>  <file name>}.
     */
    static String parseChecksum(String content) {
        String trimmed = content.strip();
        if (trimmed.isEmpty()) {
            return null;
        }
        String hash = trimmed.split("\\s+")[0];
        return hash.length() == 64 ? hash : null;
    }

    /**
     * Extract bars from every CSV entry of the archive, normalizing microsecond timestamps.
     */
    List<Bar> parseZip(byte[] zip, String url) throws ValidationException {
        List<Bar> bars = new ArrayList<>();
        try (ZipInputStream zis = new ZipInputStream(new ByteArrayInputStream(zip))) {
            ZipEntry entry;
            boolean sawCsv = false;
            while ((entry = zis.getNextEntry()) != null) {
                if (entry.getName().endsWith(".csv")) {
                    sawCsv = true;
                    BufferedReader reader = new BufferedReader(new InputStreamReader(zis, StandardCharsets.UTF_8));
                    for (Bar bar : BarCsv.read(reader)) {
                        bars.add(normalizeTimestamps(bar));
                    }
                }
                zis.closeEntry();
            }
            if (!sawCsv) {
                throw new ValidationException(ValidationException.Kind.SCHEMA_INVALID, "No CSV in archive " + url);
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new ValidationException(ValidationException.Kind.SCHEMA_INVALID,
                "Unreadable archive " + url + ": " + e.getMessage(), e);
        }
        return bars;
    }

    static Bar normalizeTimestamps(Bar bar) {
        if (bar.openTime() < MICROSECOND_THRESHOLD) {
            return bar;
        }
        return new Bar(bar.openTime() / 1000, bar.open(), bar.high(), bar.low(), bar.close(), bar.volume(),
            bar.closeTime() / 1000, bar.quoteVolume(), bar.tradeCount(), bar.takerBuyVolume(),
            bar.takerBuyQuoteVolume());
    }

    private static String sha256(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
