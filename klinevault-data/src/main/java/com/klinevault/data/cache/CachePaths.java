package com.klinevault.data.cache;

import com.klinevault.core.model.Interval;
import com.klinevault.core.model.MarketType;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * On-disk layout: {@code <root>/binance/<market path>/klines/daily/<SYMBOL>/<interval>/<yyyyMMdd>.csv}.
 */
public final class CachePaths {

    static final DateTimeFormatter FILE_DATE = DateTimeFormatter.BASIC_ISO_DATE;
    static final String EXTENSION = ".csv";

    private final Path root;

    public CachePaths(Path root) {
        this.root = root;
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Directory holding everything cached for one market.
     */
    public Path marketDir(MarketType market) {
        Path dir = root.resolve("binance");
        for (String segment : market.getVisionPath().split("/")) {
            dir = dir.resolve(segment);
        }
        return dir.resolve("klines").resolve("daily");
    }

    /**
     * Boundary rules learned for one market, kept beside its partitions.
     */
    public Path rulesFile(MarketType market) {
        return marketDir(market).getParent().resolve("boundary-rules.json");
    }

    public Path seriesDir(MarketType market, String symbol, Interval interval) {
        return marketDir(market).resolve(symbol.toUpperCase()).resolve(interval.getCode());
    }

    public Path file(CacheKey key) {
        return seriesDir(key.market(), key.symbol(), key.interval())
            .resolve(key.date().format(FILE_DATE) + EXTENSION);
    }

    /**
     * Date encoded in a cache file name, or null if the name doesn't follow the layout.
     */
    static LocalDate dateOf(Path file) {
        String name = file.getFileName().toString();
        if (!name.endsWith(EXTENSION) || name.length() != 8 + EXTENSION.length()) {
            return null;
        }
        try {
            return LocalDate.parse(name.substring(0, 8), FILE_DATE);
        } catch (RuntimeException e) {
            return null;
        }
    }
}
